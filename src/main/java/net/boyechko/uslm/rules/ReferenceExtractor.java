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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.uslm.model.Reference;
import net.boyechko.uslm.model.ReferenceType;

/**
 * Finds section citations in normalized text. Patterns are tried from the most specific legal
 * phrasing to the plainest, and each designator is kept only for the first pattern that finds
 * it, so "as defined in section 162" wins over a later bare "section 162".
 */
public final class ReferenceExtractor {
    public static final int DEFAULT_CONTEXT_WINDOW = 30;
    public static final int DEFAULT_CONTEXT_MAX_LENGTH = 500;

    /** Digits, an optional letter, then any number of parenthesized designators: 274(a)(3). */
    private static final String DESIGNATOR = "(\\d+[A-Za-z]?(?:\\([a-z0-9]+\\))*)";

    private record RefPattern(Pattern pattern, ReferenceType type) {
        RefPattern(String regex, ReferenceType type) {
            this(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), type);
        }
    }

    private static final List<RefPattern> PATTERNS =
            List.of(
                    new RefPattern(
                            "as defined in section\\s+" + DESIGNATOR, ReferenceType.DEFINITION),
                    new RefPattern(
                            "subject to (?:the provisions of )?section\\s+" + DESIGNATOR,
                            ReferenceType.SUBJECT_TO),
                    new RefPattern(
                            "except as provided in section\\s+" + DESIGNATOR,
                            ReferenceType.EXCEPTION),
                    new RefPattern(
                            "\\bsections?\\s+(\\d+[A-Za-z]?)\\s+(?:and|or)\\s+(\\d+[A-Za-z]?)",
                            ReferenceType.GENERAL),
                    new RefPattern("\\bsection\\s+" + DESIGNATOR, ReferenceType.GENERAL),
                    new RefPattern("\\bsec\\.\\s*" + DESIGNATOR, ReferenceType.GENERAL),
                    new RefPattern("under section\\s+" + DESIGNATOR, ReferenceType.GENERAL),
                    new RefPattern("provided in section\\s+" + DESIGNATOR, ReferenceType.GENERAL),
                    new RefPattern("see section\\s+" + DESIGNATOR, ReferenceType.GENERAL));

    private final int contextWindow;
    private final int contextMaxLength;

    public ReferenceExtractor() {
        this(DEFAULT_CONTEXT_WINDOW, DEFAULT_CONTEXT_MAX_LENGTH);
    }

    public ReferenceExtractor(int contextWindow, int contextMaxLength) {
        if (contextWindow < 0) {
            throw new IllegalArgumentException("contextWindow must not be negative");
        }
        if (contextMaxLength <= 0) {
            throw new IllegalArgumentException("contextMaxLength must be positive");
        }
        this.contextWindow = contextWindow;
        this.contextMaxLength = contextMaxLength;
    }

    /** Returns references in pattern-priority order, one per distinct designator. */
    public List<Reference> extract(String text) {
        if (text == null || text.isEmpty()) return List.of();

        List<Reference> references = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (RefPattern refPattern : PATTERNS) {
            Matcher m = refPattern.pattern().matcher(text);
            while (m.find()) {
                for (int g = 1; g <= m.groupCount(); g++) {
                    String section = m.group(g);
                    if (section != null && seen.add(section)) {
                        references.add(
                                new Reference(section, contextOf(text, m), refPattern.type()));
                    }
                }
            }
        }
        return references;
    }

    private String contextOf(String text, Matcher m) {
        int start = Math.max(0, m.start() - contextWindow);
        int end = Math.min(text.length(), m.end() + contextWindow);
        String context = text.substring(start, end).strip();
        return context.length() > contextMaxLength
                ? context.substring(0, contextMaxLength)
                : context;
    }
}
