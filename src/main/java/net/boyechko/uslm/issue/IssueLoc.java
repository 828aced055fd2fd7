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
package net.boyechko.uslm.issue;

/**
 * Where in the source document an issue was noticed.
 *
 * @param citation citation id of the affected node, or null
 * @param structuralPath USLM identifier of the affected element, or null
 */
public record IssueLoc(String citation, String structuralPath) {

    public static IssueLoc none() {
        return new IssueLoc(null, null);
    }

    public static IssueLoc at(String citation, String structuralPath) {
        return new IssueLoc(citation, structuralPath);
    }

    public boolean isNone() {
        return citation == null && structuralPath == null;
    }

    @Override
    public String toString() {
        if (isNone()) return "";
        StringBuilder sb = new StringBuilder(" (");
        if (citation != null) sb.append(citation);
        if (structuralPath != null && !structuralPath.isEmpty()) {
            if (citation != null) sb.append(", ");
            sb.append(structuralPath);
        }
        return sb.append(')').toString();
    }
}
