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
package net.boyechko.uslm.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Levels of the legal-code hierarchy, in order from the outermost container to the innermost
 * content unit. Each constant is bound to the USLM element name that produces it.
 */
public enum NodeType {
    TITLE("title"),
    SUBTITLE("subtitle"),
    CHAPTER("chapter"),
    SUBCHAPTER("subchapter"),
    PART("part"),
    SUBPART("subpart"),
    SECTION("section"),
    SUBSECTION("subsection"),
    PARAGRAPH("paragraph"),
    SUBPARAGRAPH("subparagraph"),
    CLAUSE("clause");

    private static final Map<String, NodeType> BY_TAG =
            Arrays.stream(values()).collect(Collectors.toMap(NodeType::tag, Function.identity()));

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    /** Element local name, which is also the lower-case wire value. */
    public String tag() {
        return tag;
    }

    /** Display name used in breadcrumbs, e.g. "Subsection". */
    public String label() {
        return Character.toUpperCase(tag.charAt(0)) + tag.substring(1);
    }

    /** Title through subpart: groups other nodes and carries no substantive text. */
    public boolean isContainer() {
        return compareTo(SUBPART) <= 0;
    }

    /** Section through clause. */
    public boolean isContent() {
        return !isContainer();
    }

    public static Optional<NodeType> fromTag(String localName) {
        if (localName == null) return Optional.empty();
        return Optional.ofNullable(BY_TAG.get(localName));
    }

    public static boolean isStructural(String localName) {
        return localName != null && BY_TAG.containsKey(localName);
    }
}
