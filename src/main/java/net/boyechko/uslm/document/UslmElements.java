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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.uslm.model.NodeType;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/** Utilities for navigating USLM documents loaded into a DOM. */
public final class UslmElements {
    public static final String USLM_NS = "http://xml.house.gov/schemas/uslm/1.0";

    private UslmElements() {}

    /** Returns the element name without any namespace prefix. */
    public static String localName(Node node) {
        String local = node.getLocalName();
        if (local != null) return local;
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    /** Returns true if the element is in the USLM namespace or in no namespace. */
    public static boolean isUslm(Element elem) {
        String ns = elem.getNamespaceURI();
        return ns == null || USLM_NS.equals(ns);
    }

    public static boolean isStructural(Element elem) {
        return NodeType.isStructural(localName(elem));
    }

    /** Returns the direct child elements of {@code parent}, in document order. */
    public static List<Element> childElements(Element parent) {
        List<Element> out = new ArrayList<>();
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element child) {
                out.add(child);
            }
        }
        return out;
    }

    /** Finds the first direct USLM child element with the given local name, or null. */
    public static Element findChild(Element parent, String localName) {
        for (Node n = parent.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n instanceof Element child
                    && localName.equals(localName(child))
                    && isUslm(child)) {
                return child;
            }
        }
        return null;
    }

    /**
     * Finds the first descendant element (not {@code parent} itself) with the given local name in
     * any namespace, searching in document order. Returns null if there is none.
     */
    public static Element findDescendant(Element parent, String localName) {
        for (Element child : childElements(parent)) {
            if (localName.equals(localName(child))) {
                return child;
            }
            Element nested = findDescendant(child, localName);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    /** Collects descendants with the given local name in any namespace, in document order. */
    public static List<Element> descendants(Element parent, String localName) {
        List<Element> out = new ArrayList<>();
        collectDescendants(parent, localName, out);
        return out;
    }

    private static void collectDescendants(Element parent, String localName, List<Element> out) {
        for (Element child : childElements(parent)) {
            if (localName.equals(localName(child))) {
                out.add(child);
            }
            collectDescendants(child, localName, out);
        }
    }

    /** Text appearing inside {@code elem} before its first child element. */
    public static String leadingText(Element elem) {
        StringBuilder sb = new StringBuilder();
        for (Node n = elem.getFirstChild(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) break;
            appendIfText(n, sb);
        }
        return sb.toString();
    }

    /** Text following {@code elem} up to its next sibling element. */
    public static String tailText(Element elem) {
        StringBuilder sb = new StringBuilder();
        for (Node n = elem.getNextSibling(); n != null; n = n.getNextSibling()) {
            if (n.getNodeType() == Node.ELEMENT_NODE) break;
            appendIfText(n, sb);
        }
        return sb.toString();
    }

    private static void appendIfText(Node n, StringBuilder sb) {
        short type = n.getNodeType();
        if (type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE) {
            sb.append(n.getNodeValue());
        }
    }

    /** All text content of the element and its descendants, concatenated. */
    public static String allText(Element elem) {
        String text = elem.getTextContent();
        return text != null ? text : "";
    }

    /** Returns the trimmed text of a direct USLM child element, or null if absent or blank. */
    public static String childText(Element parent, String localName) {
        Element child = findChild(parent, localName);
        if (child == null) return null;
        String text = allText(child).strip();
        return text.isEmpty() ? null : text;
    }

    /** Returns the attribute value, or "" if the attribute is absent. */
    public static String attribute(Element elem, String name) {
        return elem.hasAttribute(name) ? elem.getAttribute(name) : "";
    }

    /**
     * Locates the top-level title element: the {@code title} child of {@code main} if there is
     * one, otherwise the first USLM {@code title} element anywhere under the document root.
     * Returns null if neither exists.
     */
    public static Element findRootTitle(Document doc) {
        Element docRoot = doc.getDocumentElement();
        if (docRoot == null) return null;

        if ("title".equals(localName(docRoot)) && isUslm(docRoot)) {
            return docRoot;
        }

        for (Element main : descendants(docRoot, "main")) {
            if (!isUslm(main)) continue;
            Element title = findChild(main, "title");
            if (title != null) return title;
        }

        for (Element title : descendants(docRoot, "title")) {
            if (isUslm(title)) return title;
        }
        return null;
    }
}
