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
package net.boyechko.uslm.rules;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives canonical citations such as "26 USC 162(a)" from USLM identifier paths.
 *
 * <p>A well-formed path starts with the jurisdiction and collection segments ({@code
 * /us/usc/t26/...}). Grouping segments above the section level ({@code stA}, {@code ch1}, {@code
 * schB}, {@code pt2}, {@code spt3}) are skipped; the section segment ({@code s162}) supplies the
 * leading number and every segment after it is appended in parentheses.
 */
public final class CitationResolver {
    public static final String DEFAULT_CODE_LABEL = "26 USC";
    public static final String DEFAULT_JURISDICTION = "us";
    public static final String DEFAULT_COLLECTION = "usc";

    private static final Pattern SECTION_SEGMENT = Pattern.compile("s(\\d.*)");
    private static final Pattern TITLE_SEGMENT = Pattern.compile("t(\\w+)");
    private static final Pattern NUM_PREFIX =
            Pattern.compile("^(?:sec\\.?|§+)\\s*", Pattern.CASE_INSENSITIVE);

    private final String codeLabel;
    private final String jurisdiction;
    private final String collection;

    public CitationResolver() {
        this(DEFAULT_CODE_LABEL);
    }

    public CitationResolver(String codeLabel) {
        this(codeLabel, DEFAULT_JURISDICTION, DEFAULT_COLLECTION);
    }

    public CitationResolver(String codeLabel, String jurisdiction, String collection) {
        this.codeLabel = Objects.requireNonNull(codeLabel, "codeLabel");
        this.jurisdiction = Objects.requireNonNull(jurisdiction, "jurisdiction");
        this.collection = Objects.requireNonNull(collection, "collection");
    }

    public String codeLabel() {
        return codeLabel;
    }

    /**
     * Returns the citation for a node.
     *
     * @param num declared number label such as "Sec. 162", or null
     * @param identifier USLM identifier path, or null/blank if the element has none
     */
    public String resolve(String num, String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return codeLabel + " " + (num != null ? num : "unknown");
        }

        String sectionPart = sectionPartOf(identifier);
        if (sectionPart != null) {
            return codeLabel + " " + sectionPart;
        }

        if (num != null) {
            return codeLabel + " " + cleanNum(num);
        }

        return codeLabel + " " + identifier;
    }

    /** Returns e.g. "162(a)(1)" for "/us/usc/t26/stA/ch1/s162/a/1", or null if no section. */
    String sectionPartOf(String identifier) {
        String[] parts = splitPath(identifier);
        if (parts.length < 4 || !parts[0].equals(jurisdiction) || !parts[1].equals(collection)) {
            return null;
        }

        StringBuilder sb = new StringBuilder();
        boolean inSection = false;
        for (int i = 3; i < parts.length; i++) {
            String part = parts[i];
            if (inSection) {
                sb.append('(').append(part).append(')');
                continue;
            }
            // Grouping segments above the section contribute nothing.
            Matcher section = SECTION_SEGMENT.matcher(part);
            if (section.matches()) {
                inSection = true;
                sb.append(section.group(1));
            }
        }
        return inSection ? sb.toString() : null;
    }

    /**
     * Derives a code label such as "26 USC" from a path naming a title ("/us/usc/t26"), or
     * returns null if the path does not name one.
     */
    public String codeLabelFor(String identifier) {
        if (identifier == null || identifier.isBlank()) return null;
        String[] parts = splitPath(identifier);
        if (parts.length < 3 || !parts[0].equals(jurisdiction) || !parts[1].equals(collection)) {
            return null;
        }
        Matcher title = TITLE_SEGMENT.matcher(parts[2]);
        return title.matches() ? title.group(1) + " " + collection.toUpperCase(Locale.ROOT) : null;
    }

    static String cleanNum(String num) {
        String clean = NUM_PREFIX.matcher(num.strip()).replaceFirst("");
        if (clean.endsWith(".")) {
            clean = clean.substring(0, clean.length() - 1);
        }
        return clean.strip();
    }

    private static String[] splitPath(String identifier) {
        String trimmed = identifier.strip();
        int start = 0;
        int end = trimmed.length();
        while (start < end && trimmed.charAt(start) == '/') start++;
        while (end > start && trimmed.charAt(end - 1) == '/') end--;
        return trimmed.substring(start, end).split("/");
    }
}
