/*
 * USLM-Tree - Legal Code Hierarchy Parser
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.uslm.core;

import java.nio.file.Path;
import net.boyechko.uslm.building.DocumentTreeBuilder;
import net.boyechko.uslm.document.UslmCustodian;
import net.boyechko.uslm.document.UslmElements;
import net.boyechko.uslm.issue.Issue;
import net.boyechko.uslm.issue.IssueSev;
import net.boyechko.uslm.issue.IssueType;
import net.boyechko.uslm.model.ParsedDocument;
import net.boyechko.uslm.rules.CitationResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/** Orchestrates the parsing of a USLM document: load, locate the root title, build the tree. */
public class ParsingService {
    private static final Logger logger = LoggerFactory.getLogger(ParsingService.class);

    private final ParserConfig config;
    private final ParsingListener listener;

    public static class ParsingServiceBuilder {
        private ParserConfig config;
        private ParsingListener listener;
        private Integer maxSections;
        private boolean maxSectionsSet;

        public ParsingServiceBuilder withConfig(ParserConfig config) {
            this.config = config;
            return this;
        }

        public ParsingServiceBuilder withListener(ParsingListener listener) {
            this.listener = listener;
            return this;
        }

        /** Overrides the configured section cutoff; null removes it. */
        public ParsingServiceBuilder withMaxSections(Integer maxSections) {
            this.maxSections = maxSections;
            this.maxSectionsSet = true;
            return this;
        }

        public ParsingService build() {
            ParserConfig effective = config != null ? config.validate() : ParserConfig.defaults();
            if (maxSectionsSet) {
                effective = effective.withMaxSections(maxSections);
            }
            return new ParsingService(
                    effective, listener != null ? listener : ParsingListener.silent());
        }
    }

    private ParsingService(ParserConfig config, ParsingListener listener) {
        this.config = config;
        this.listener = listener;
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Parses the USLM file at {@code xmlPath}.
     *
     * @throws StructureException if the file is missing or malformed or has no title element
     */
    public ParsedDocument parseFile(Path xmlPath) throws StructureException {
        listener.onPhaseStart("Loading " + xmlPath);
        Document doc;
        try {
            doc = new UslmCustodian(xmlPath).openForReading();
        } catch (StructureException e) {
            listener.onError(e.getMessage());
            throw e;
        }
        return parseDocument(doc);
    }

    /** Parses an already loaded DOM document. */
    public ParsedDocument parseDocument(Document doc) throws StructureException {
        Element title = UslmElements.findRootTitle(doc);
        if (title == null) {
            listener.onWarning(
                    new Issue(
                            IssueType.MISSING_ROOT_ELEMENT,
                            IssueSev.FATAL,
                            "Could not find title element in XML"));
            throw new StructureException("Could not find title element in XML");
        }
        return parseElement(title);
    }

    /** Builds the tree for a located root element. */
    public ParsedDocument parseElement(Element rootElement) throws StructureException {
        String identifier =
                rootElement != null ? UslmElements.attribute(rootElement, "identifier") : "";
        String codeLabel = resolveCodeLabel(identifier);
        logger.info(
                "Building tree under {} (max sections: {})",
                codeLabel,
                config.getMaxSections() != null ? config.getMaxSections() : "unlimited");

        listener.onPhaseStart("Building tree");
        DocumentTreeBuilder builder = DocumentTreeBuilder.fromConfig(config, codeLabel);
        ParsedDocument parsed = builder.build(rootElement);

        for (Issue issue : parsed.issues()) {
            listener.onWarning(issue);
        }
        listener.onSuccess(
                "Parsed "
                        + parsed.totalNodes()
                        + " nodes ("
                        + parsed.totalSections()
                        + " sections)");
        listener.onSummary(parsed);
        return parsed;
    }

    /** Configured label if set, else one derived from the title identifier, else the default. */
    String resolveCodeLabel(String rootIdentifier) {
        if (config.getCodeLabel() != null) {
            return config.getCodeLabel();
        }
        String derived =
                new CitationResolver(
                                config.getDefaultCodeLabel(),
                                config.getJurisdiction(),
                                config.getCollection())
                        .codeLabelFor(rootIdentifier);
        return derived != null ? derived : config.getDefaultCodeLabel();
    }
}
