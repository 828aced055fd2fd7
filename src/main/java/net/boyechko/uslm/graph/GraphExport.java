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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.uslm.model.LegalNode;
import net.boyechko.uslm.model.Reference;
import net.boyechko.uslm.model.SourcedReference;

/** Flattens a node tree into the node and edge lists a graph store consumes. */
public final class GraphExport {
    private GraphExport() {}

    /** Every node in the tree, in pre-order. */
    public static List<LegalNode> flattenNodes(LegalNode root) {
        List<LegalNode> out = new ArrayList<>();
        flatten(root, out);
        return out;
    }

    /** One edge per parent/child pair, in pre-order of the parent. */
    public static List<ParentEdge> parentEdges(LegalNode root) {
        List<ParentEdge> out = new ArrayList<>();
        collectParentEdges(root, out);
        return out;
    }

    /** Every reference paired with the id of the node that contains it, in pre-order. */
    public static List<SourcedReference> references(LegalNode root) {
        List<SourcedReference> out = new ArrayList<>();
        collectReferences(root, out);
        return out;
    }

    private static void flatten(LegalNode node, List<LegalNode> out) {
        out.add(node);
        for (LegalNode child : node.children()) {
            flatten(child, out);
        }
    }

    private static void collectParentEdges(LegalNode node, List<ParentEdge> out) {
        for (LegalNode child : node.children()) {
            out.add(new ParentEdge(node.id(), child.id()));
            collectParentEdges(child, out);
        }
    }

    private static void collectReferences(LegalNode node, List<SourcedReference> out) {
        for (Reference ref : node.references()) {
            out.add(new SourcedReference(node.id(), ref));
        }
        for (LegalNode child : node.children()) {
            collectReferences(child, out);
        }
    }
}
