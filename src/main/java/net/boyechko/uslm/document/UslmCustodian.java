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
package net.boyechko.uslm.document;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import net.boyechko.uslm.core.StructureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/** Opens USLM documents into a namespace-aware DOM with external entity loading disabled. */
public final class UslmCustodian {
    private static final Logger logger = LoggerFactory.getLogger(UslmCustodian.class);

    private final Path inputPath;

    public UslmCustodian(Path inputPath) {
        this.inputPath = inputPath;
    }

    public Path getInputPath() {
        return inputPath;
    }

    /** Reads and parses the whole input file. */
    public Document openForReading() throws StructureException {
        if (inputPath == null || !Files.isRegularFile(inputPath)) {
            throw new StructureException("XML file not found: " + inputPath);
        }
        try (InputStream in = Files.newInputStream(inputPath)) {
            logger.debug("Reading USLM document {}", inputPath);
            return parse(in, inputPath.toString());
        } catch (IOException e) {
            throw new StructureException("Failed to read " + inputPath + ": " + e.getMessage(), e);
        }
    }

    /** Parses a document from a stream; {@code sourceName} is used only in error messages. */
    public static Document parse(InputStream in, String sourceName) throws StructureException {
        try {
            Document doc = newDocumentBuilder().parse(in);
            doc.getDocumentElement().normalize();
            return doc;
        } catch (SAXException e) {
            throw new StructureException(
                    "Malformed XML in " + sourceName + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StructureException("Failed to read " + sourceName + ": " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newDocumentBuilder() throws StructureException {
        try {
            DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
            f.setNamespaceAware(true);
            f.setValidating(false);
            f.setXIncludeAware(false);
            f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            f.setFeature("http://xml.org/sax/features/external-general-entities", false);
            f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            f.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            f.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            f.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            DocumentBuilder builder = f.newDocumentBuilder();
            builder.setErrorHandler(new LoggingErrorHandler());
            return builder;
        } catch (ParserConfigurationException | IllegalArgumentException e) {
            throw new StructureException("Failed to configure XML parser: " + e.getMessage(), e);
        }
    }

    /** Sends parser diagnostics to the log rather than stderr. Fatal errors still abort. */
    private static final class LoggingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException e) {
            logger.debug(
                    "XML warning at {}:{}: {}",
                    e.getLineNumber(),
                    e.getColumnNumber(),
                    e.getMessage());
        }

        @Override
        public void error(SAXParseException e) {
            logger.warn(
                    "XML error at {}:{}: {}",
                    e.getLineNumber(),
                    e.getColumnNumber(),
                    e.getMessage());
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
