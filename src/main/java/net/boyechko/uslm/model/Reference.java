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

import java.util.Objects;

/**
 * A cross-reference from a node's text to another section.
 *
 * <p>Two references are equal when they share target and type; the context excerpt is ignored,
 * so merging references from several sources keeps one entry per (target, type).
 *
 * @param targetSection section designator as written, e.g. "162" or "274(a)(3)"
 * @param context excerpt of the text surrounding the match
 * @param referenceType relationship expressed by the surrounding phrase
 */
public record Reference(String targetSection, String context, ReferenceType referenceType) {

    public Reference {
        Objects.requireNonNull(targetSection, "targetSection");
        Objects.requireNonNull(referenceType, "referenceType");
        context = context != null ? context : "";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reference other)) return false;
        return targetSection.equals(other.targetSection) && referenceType == other.referenceType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(targetSection, referenceType);
    }
}
