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

import java.util.List;
import java.util.Map;
import net.boyechko.uslm.model.LegalNode;
import net.boyechko.uslm.model.SourcedReference;

/**
 * Destination for a parsed tree. Implementations merge by citation id, so loading the same
 * document twice leaves one copy of each node and edge.
 */
public interface GraphSink {

    /** Inserts or replaces nodes; returns how many were written. */
    int upsertNodes(List<LegalNode> nodes);

    /** Creates PARENT_OF edges whose endpoints both exist; returns how many were linked. */
    int linkParents(List<ParentEdge> edges);

    /**
     * Creates REFERENCES edges. Each target section is resolved to a full citation; references
     * whose target is not loaded are counted as not found rather than failing.
     */
    ReferenceLinkResult linkReferences(List<SourcedReference> references);

    int nodeCount();

    /** Edge counts keyed by relationship name, e.g. "PARENT_OF". */
    Map<String, Integer> relationshipCounts();
}
