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
package net.boyechko.uslm.building;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import net.boyechko.uslm.core.ParserConfig;
import net.boyechko.uslm.core.StructureException;
import net.boyechko.uslm.document.TextExtractor;
import net.boyechko.uslm.document.UslmElements;
import net.boyechko.uslm.model.LegalNode;
import net.boyechko.uslm.model.NodeStatus;
import net.boyechko.uslm.model.NodeType;
import net.boyechko.uslm.model.ParsedDocument;
import net.boyechko.uslm.model.Reference;
import net.boyechko.uslm.rules.CitationResolver;
import net.boyechko.uslm.rules.ReferenceExtractor;
import net.boyechko.uslm.rules.StatusClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Walks a USLM element tree once, depth-first in document order, and builds the matching {@link
 * LegalNode} hierarchy. A node's own fields are resolved before any of its children are visited.
 *
 * <p>The builder holds no per-parse state; counters live in a {@link TraversalContext} created
 * for each {@link #build} call.
 */
public class DocumentTreeBuilder {
    private static final Logger logger = LoggerFactory.getLogger(DocumentTreeBuilder.class);

    private static final Pattern TRAILING_NUM_PUNCTUATION = Pattern.compile("[\\s\\-—–:.]+$");

    private final CitationResolver resolver;
    private final ReferenceExtractor extractor;
    private final Integer maxSections;
    private final int maxDepth;

    public DocumentTreeBuilder(
            CitationResolver resolver,
            ReferenceExtractor extractor,
            Integer maxSections,
            int maxDepth) {
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive");
        }
        this.resolver = resolver;
        this.extractor = extractor;
        this.maxSections = maxSections;
        this.maxDepth = maxDepth;
    }

    /** Creates a builder from config, citing nodes under {@code codeLabel}. */
    public static DocumentTreeBuilder fromConfig(ParserConfig config, String codeLabel) {
        return new DocumentTreeBuilder(
                new CitationResolver(codeLabel, config.getJurisdiction(), config.getCollection()),
                new ReferenceExtractor(config.getContextWindow(), config.getContextMaxLength()),
                config.getMaxSections(),
                config.getMaxDepth());
    }

    public String codeLabel() {
        return resolver.codeLabel();
    }

    /**
     * Builds the tree rooted at {@code rootElement}. With a section cutoff of k, the k-th section
     * is kept whole, subsections included, and nothing after it is built.
     *
     * @throws StructureException if the root is missing or is not a structural element
     */
    public ParsedDocument build(Element rootElement) throws StructureException {
        if (rootElement == null) {
            throw new StructureException("Could not find title element in XML");
        }
        if (!UslmElements.isStructural(rootElement)) {
            throw new StructureException(
                    "Root element <" + UslmElements.localName(rootElement) + "> is not structural");
        }

        TraversalContext ctx = new TraversalContext(maxSections);
        LegalNode root = buildNode(rootElement, "", null, 0, false, ctx);
        if (root == null) {
            throw new StructureException("Failed to parse root title element");
        }

        logger.debug(
                "Built {} nodes ({} sections, {} repealed)",
                ctx.totalNodes(),
                ctx.sectionsParsed(),
                ctx.repealedSections().size());

        return new ParsedDocument(
                documentTitle(root),
                resolver.codeLabel(),
                root,
                ctx.totalNodes(),
                ctx.sectionsParsed(),
                ctx.repealedSections(),
                ctx.issues());
    }

    /**
     * Builds one node and, recursively, its structural children. Returns null if the element is
     * not structural, the section cutoff has been reached, or the depth limit is exceeded.
     */
    private LegalNode buildNode(
            Element elem,
            String parentPath,
            String parentId,
            int depth,
            boolean insideSection,
            TraversalContext ctx) {
        // Sections already built keep their whole subtree.
        if (!insideSection && ctx.cutoffReached()) {
            return null;
        }

        Optional<NodeType> maybeType = NodeType.fromTag(UslmElements.localName(elem));
        if (maybeType.isEmpty()) {
            return null;
        }
        NodeType nodeType = maybeType.get();

        String identifier = UslmElements.attribute(elem, "identifier");
        if (depth >= maxDepth) {
            ctx.recordDepthExceeded(nodeType.tag(), identifier, depth);
            return null;
        }

        String num = UslmElements.childText(elem, "num");
        String heading = UslmElements.childText(elem, "heading");
        String text = TextExtractor.extract(elem);
        NodeStatus status = StatusClassifier.classify(elem, text);
        String hierarchicalPath = breadcrumb(parentPath, nodeType, num, heading);
        String id = resolver.resolve(num, identifier);
        List<Reference> references = extractor.extract(text);

        ctx.recordNode(id, identifier, nodeType, status);

        boolean childrenInsideSection = insideSection || nodeType == NodeType.SECTION;
        List<LegalNode> children = new ArrayList<>();
        for (Element childElem : UslmElements.childElements(elem)) {
            if (!UslmElements.isStructural(childElem)) continue;
            LegalNode child =
                    buildNode(
                            childElem,
                            hierarchicalPath,
                            id,
                            depth + 1,
                            childrenInsideSection,
                            ctx);
            if (child != null) {
                children.add(child);
            }
        }

        return new LegalNode(
                id,
                identifier,
                nodeType,
                num,
                heading,
                text,
                status,
                hierarchicalPath,
                parentId,
                children,
                references);
    }

    /** Appends "Type: heading" (or "Type num" when there is no heading) to the parent's path. */
    static String breadcrumb(String parentPath, NodeType type, String num, String heading) {
        String label = null;
        if (heading != null) {
            label = type.label() + ": " + heading;
        } else if (num != null) {
            label = type.label() + " " + num;
        }

        if (label == null) return parentPath != null ? parentPath : "";
        if (parentPath == null || parentPath.isEmpty()) return label;
        return parentPath + " > " + label;
    }

    /** "Title 26 - Internal Revenue Code" from num "Title 26—" and its heading. */
    static String documentTitle(LegalNode root) {
        String num =
                root.num() != null
                        ? TRAILING_NUM_PUNCTUATION.matcher(root.num()).replaceFirst("")
                        : null;
        if (root.heading() != null) {
            return num != null && !num.isEmpty() ? num + " - " + root.heading() : root.heading();
        }
        return num != null && !num.isEmpty() ? num : root.id();
    }
}
