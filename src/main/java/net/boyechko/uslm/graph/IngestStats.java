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
package net.boyechko.uslm.graph;

import java.util.Map;

/** Counts reported after loading a parsed document into a {@link GraphSink}. */
public record IngestStats(
        int nodesCreated,
        int parentRelationships,
        int referenceRelationships,
        int referencesNotFound,
        int totalNodes,
        Map<String, Integer> relationshipCounts) {

    public IngestStats {
        relationshipCounts = relationshipCounts != null ? Map.copyOf(relationshipCounts) : Map.of();
    }
}
