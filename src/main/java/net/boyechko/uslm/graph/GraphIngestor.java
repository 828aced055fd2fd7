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
import java.util.function.ToIntFunction;
import net.boyechko.uslm.model.LegalNode;
import net.boyechko.uslm.model.ParsedDocument;
import net.boyechko.uslm.model.SourcedReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Loads a parsed document into a {@link GraphSink}: nodes first, then parent edges, then refs. */
public class GraphIngestor {
    private static final Logger logger = LoggerFactory.getLogger(GraphIngestor.class);

    private final GraphSink sink;
    private final int batchSize;

    public GraphIngestor(GraphSink sink, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.sink = sink;
        this.batchSize = batchSize;
    }

    public IngestStats ingest(ParsedDocument parsed) {
        List<LegalNode> nodes = GraphExport.flattenNodes(parsed.root());
        logger.info("Ingesting {} nodes", nodes.size());
        int nodesCreated = inBatches(nodes, sink::upsertNodes);

        List<ParentEdge> edges = GraphExport.parentEdges(parsed.root());
        logger.info("Creating {} PARENT_OF relationships", edges.size());
        int parentLinks = inBatches(edges, sink::linkParents);

        List<SourcedReference> refs = GraphExport.references(parsed.root());
        logger.info("Creating REFERENCES relationships for {} references", refs.size());
        ReferenceLinkResult refResult = new ReferenceLinkResult(0, 0);
        for (int i = 0; i < refs.size(); i += batchSize) {
            List<SourcedReference> batch = refs.subList(i, Math.min(refs.size(), i + batchSize));
            refResult = refResult.plus(sink.linkReferences(batch));
        }
        logger.info(
                "Created {} REFERENCES relationships ({} targets not found in graph)",
                refResult.created(),
                refResult.notFound());

        return new IngestStats(
                nodesCreated,
                parentLinks,
                refResult.created(),
                refResult.notFound(),
                sink.nodeCount(),
                sink.relationshipCounts());
    }

    private <T> int inBatches(List<T> items, ToIntFunction<List<T>> write) {
        int total = 0;
        for (int i = 0; i < items.size(); i += batchSize) {
            total += write.applyAsInt(items.subList(i, Math.min(items.size(), i + batchSize)));
        }
        return total;
    }
}
