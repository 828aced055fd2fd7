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
import java.util.Set;
import java.util.regex.Pattern;
import org.apache.commons.text.StringEscapeUtils;
import org.w3c.dom.Element;

/**
 * Extracts the prose of a structural element as one normalized string. Metadata children
 * ({@code num}, {@code heading}, {@code meta}) and nested structural elements are left out; the
 * latter become nodes of their own.
 */
public final class TextExtractor {
    private static final Set<String> METADATA_TAGS = Set.of("num", "heading", "meta");
    private static final Pattern WHITESPACE =
            Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TextExtractor() {}

    /** Returns the normalized body text of {@code elem}, or "" for pure containers. */
    public static String extract(Element elem) {
        List<String> parts = new ArrayList<>();

        Element content = UslmElements.findChild(elem, "content");
        if (content != null) {
            parts.add(elementToText(content));
        } else {
            String leading = UslmElements.leadingText(elem).strip();
            if (!leading.isEmpty()) {
                parts.add(leading);
            }
            for (Element child : UslmElements.childElements(elem)) {
                String tag = UslmElements.localName(child);
                if (!UslmElements.isStructural(child) && !METADATA_TAGS.contains(tag)) {
                    parts.add(elementToText(child));
                }
            }
        }

        List<String> nonEmpty = new ArrayList<>(parts.size());
        for (String part : parts) {
            if (!part.isEmpty()) nonEmpty.add(part);
        }
        return normalize(String.join(" ", nonEmpty));
    }

    /**
     * Converts one element to raw text. Tables become pipe-delimited blocks; an element wrapping a
     * table keeps its text before and after the table on separate lines.
     */
    static String elementToText(Element elem) {
        if ("table".equals(UslmElements.localName(elem))) {
            return TableConverter.toText(elem);
        }

        Element table = UslmElements.findDescendant(elem, "table");
        if (table != null) {
            String pre = UslmElements.leadingText(elem);
            String tableText = TableConverter.toText(table);
            List<String> post = new ArrayList<>();
            for (Element child : UslmElements.childElements(elem)) {
                String tail = UslmElements.tailText(child);
                if (!tail.isEmpty()) post.add(tail);
            }
            return (pre + "\n" + tableText + "\n" + String.join(" ", post)).strip();
        }

        return UslmElements.allText(elem);
    }

    /**
     * Decodes character entities, collapses whitespace runs (newlines included) to single spaces,
     * and trims. Returns "" for null.
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";
        String decoded = StringEscapeUtils.unescapeHtml4(text);
        return WHITESPACE.matcher(decoded).replaceAll(" ").strip();
    }
}
