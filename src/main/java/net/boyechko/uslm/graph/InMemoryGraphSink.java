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
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import net.boyechko.uslm.model.LegalNode;
import net.boyechko.uslm.model.ReferenceType;
import net.boyechko.uslm.model.SourcedReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A {@link GraphSink} that keeps the graph in memory, for inspection and testing. */
public class InMemoryGraphSink implements GraphSink {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphSink.class);

    public static final String PARENT_OF = "PARENT_OF";
    public static final String REFERENCES = "REFERENCES";
    public static final int MAX_CONTEXT_LENGTH = 500;

    /** A stored REFERENCES edge; a later reference between the same pair replaces it. */
    public record ReferenceEdge(
            String sourceId, String targetId, ReferenceType type, String context) {}

    private record EdgeKey(String sourceId, String targetId) {}

    private final String codeLabel;
    private final Map<String, LegalNode> nodes = new LinkedHashMap<>();
    private final Set<ParentEdge> parentEdges = new LinkedHashSet<>();
    private final Map<EdgeKey, ReferenceEdge> referenceEdges = new LinkedHashMap<>();

    /** @param codeLabel prefix that turns a target section into a node id, e.g. "26 USC" */
    public InMemoryGraphSink(String codeLabel) {
        this.codeLabel = codeLabel;
    }

    @Override
    public int upsertNodes(List<LegalNode> batch) {
        for (LegalNode node : batch) {
            nodes.put(node.id(), node);
        }
        return batch.size();
    }

    @Override
    public int linkParents(List<ParentEdge> edges) {
        int linked = 0;
        for (ParentEdge edge : edges) {
            if (nodes.containsKey(edge.parentId()) && nodes.containsKey(edge.childId())) {
                parentEdges.add(edge);
                linked++;
            }
        }
        return linked;
    }

    @Override
    public ReferenceLinkResult linkReferences(List<SourcedReference> references) {
        int created = 0;
        int notFound = 0;
        for (SourcedReference sourced : references) {
            String targetId = targetIdFor(sourced.reference().targetSection());
            if (!nodes.containsKey(sourced.sourceId()) || !nodes.containsKey(targetId)) {
                notFound++;
                continue;
            }
            String context = sourced.reference().context();
            if (context.length() > MAX_CONTEXT_LENGTH) {
                context = context.substring(0, MAX_CONTEXT_LENGTH);
            }
            referenceEdges.put(
                    new EdgeKey(sourced.sourceId(), targetId),
                    new ReferenceEdge(
                            sourced.sourceId(),
                            targetId,
                            sourced.reference().referenceType(),
                            context));
            created++;
        }
        logger.debug("Linked {} references ({} targets not found)", created, notFound);
        return new ReferenceLinkResult(created, notFound);
    }

    /** "162" becomes "26 USC 162". */
    public String targetIdFor(String targetSection) {
        return codeLabel + " " + targetSection;
    }

    @Override
    public int nodeCount() {
        return nodes.size();
    }

    @Override
    public Map<String, Integer> relationshipCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (!parentEdges.isEmpty()) counts.put(PARENT_OF, parentEdges.size());
        if (!referenceEdges.isEmpty()) counts.put(REFERENCES, referenceEdges.size());
        return counts;
    }

    public Optional<LegalNode> getNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /** Child ids of {@code parentId}, in the order the edges were linked. */
    public List<String> childrenOf(String parentId) {
        List<String> out = new ArrayList<>();
        for (ParentEdge edge : parentEdges) {
            if (edge.parentId().equals(parentId)) out.add(edge.childId());
        }
        return out;
    }

    /** Outgoing REFERENCES edges of {@code sourceId}. */
    public List<ReferenceEdge> referencesFrom(String sourceId) {
        List<ReferenceEdge> out = new ArrayList<>();
        for (ReferenceEdge edge : referenceEdges.values()) {
            if (edge.sourceId().equals(sourceId)) out.add(edge);
        }
        return out;
    }

    /** Incoming REFERENCES edges of {@code targetId}: the nodes that cite it. */
    public List<ReferenceEdge> referencesTo(String targetId) {
        List<ReferenceEdge> out = new ArrayList<>();
        for (ReferenceEdge edge : referenceEdges.values()) {
            if (edge.targetId().equals(targetId)) out.add(edge);
        }
        return out;
    }
}
