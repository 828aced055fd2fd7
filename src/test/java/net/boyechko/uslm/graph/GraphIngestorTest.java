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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.boyechko.uslm.UslmTestBase;
import net.boyechko.uslm.building.DocumentTreeBuilder;
import net.boyechko.uslm.document.UslmElements;
import net.boyechko.uslm.model.LegalNode;
import net.boyechko.uslm.model.ParsedDocument;
import net.boyechko.uslm.model.SourcedReference;
import net.boyechko.uslm.rules.CitationResolver;
import net.boyechko.uslm.rules.ReferenceExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class GraphIngestorTest extends UslmTestBase {
    private ParsedDocument parsed;

    @BeforeEach
    void parseSample() throws Exception {
        parsed =
                new DocumentTreeBuilder(
                                new CitationResolver(), new ReferenceExtractor(), null, 64)
                        .build(UslmElements.findRootTitle(sampleDocument()));
    }

    @Test
    void loadsNodesEdgesAndReferences() {
        InMemoryGraphSink sink = new InMemoryGraphSink(parsed.codeLabel());

        IngestStats stats = new GraphIngestor(sink, 100).ingest(parsed);

        assertEquals(10, stats.nodesCreated());
        assertEquals(9, stats.parentRelationships());
        // 1(a) -> 2, 162 -> 1, 1401 -> 1 resolve; 7703 and 274 are not in the sample
        assertEquals(3, stats.referenceRelationships());
        assertEquals(2, stats.referencesNotFound());
        assertEquals(10, stats.totalNodes());
        assertEquals(
                Map.of(InMemoryGraphSink.PARENT_OF, 9, InMemoryGraphSink.REFERENCES, 3),
                stats.relationshipCounts());
    }

    @Test
    void writesInBatches() {
        BatchCountingSink sink = new BatchCountingSink(parsed.codeLabel());

        new GraphIngestor(sink, 3).ingest(parsed);

        // 10 nodes, 9 edges, 5 references
        assertEquals(List.of(3, 3, 3, 1), sink.nodeBatches);
        assertEquals(List.of(3, 3, 3), sink.edgeBatches);
        assertEquals(List.of(3, 2), sink.referenceBatches);
    }

    @Test
    void ingestingTwiceDoesNotDuplicate() {
        InMemoryGraphSink sink = new InMemoryGraphSink(parsed.codeLabel());
        GraphIngestor ingestor = new GraphIngestor(sink, 4);

        ingestor.ingest(parsed);
        IngestStats second = ingestor.ingest(parsed);

        assertEquals(10, second.totalNodes());
        assertEquals(9, second.relationshipCounts().get(InMemoryGraphSink.PARENT_OF));
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new GraphIngestor(new InMemoryGraphSink("26 USC"), 0));
    }

    private static class BatchCountingSink extends InMemoryGraphSink {
        final List<Integer> nodeBatches = new ArrayList<>();
        final List<Integer> edgeBatches = new ArrayList<>();
        final List<Integer> referenceBatches = new ArrayList<>();

        BatchCountingSink(String codeLabel) {
            super(codeLabel);
        }

        @Override
        public int upsertNodes(List<LegalNode> batch) {
            nodeBatches.add(batch.size());
            return super.upsertNodes(batch);
        }

        @Override
        public int linkParents(List<ParentEdge> edges) {
            edgeBatches.add(edges.size());
            return super.linkParents(edges);
        }

        @Override
        public ReferenceLinkResult linkReferences(List<SourcedReference> references) {
            referenceBatches.add(references.size());
            return super.linkReferences(references);
        }
    }
}
