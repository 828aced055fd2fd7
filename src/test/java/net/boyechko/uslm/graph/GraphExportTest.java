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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.uslm.UslmTestBase;
import net.boyechko.uslm.building.DocumentTreeBuilder;
import net.boyechko.uslm.document.UslmElements;
import net.boyechko.uslm.model.LegalNode;
import net.boyechko.uslm.model.ParsedDocument;
import net.boyechko.uslm.model.ReferenceType;
import net.boyechko.uslm.model.SourcedReference;
import net.boyechko.uslm.rules.CitationResolver;
import net.boyechko.uslm.rules.ReferenceExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class GraphExportTest extends UslmTestBase {
    private ParsedDocument parsed;

    @BeforeEach
    void parseSample() throws Exception {
        parsed =
                new DocumentTreeBuilder(
                                new CitationResolver(), new ReferenceExtractor(), null, 64)
                        .build(UslmElements.findRootTitle(sampleDocument()));
    }

    @Test
    void flattensInPreOrder() {
        List<String> ids =
                GraphExport.flattenNodes(parsed.root()).stream()
                        .map(LegalNode::id)
                        .collect(Collectors.toList());

        assertEquals(parsed.totalNodes(), ids.size());
        assertEquals(parsed.root().id(), ids.get(0));
        assertTrue(ids.indexOf("26 USC 1") < ids.indexOf("26 USC 1(a)"));
        assertTrue(ids.indexOf("26 USC 1(b)") < ids.indexOf("26 USC 2"));
    }

    @Test
    void oneParentEdgePerNonRootNode() {
        List<ParentEdge> edges = GraphExport.parentEdges(parsed.root());

        assertEquals(parsed.totalNodes() - 1, edges.size());
        assertTrue(edges.contains(new ParentEdge("26 USC 1", "26 USC 1(a)")));
        for (ParentEdge edge : edges) {
            assertEquals(
                    edge.parentId(), parsed.findById(edge.childId()).orElseThrow().parentId());
        }
    }

    @Test
    void pairsReferencesWithTheirSource() {
        List<SourcedReference> refs = GraphExport.references(parsed.root());

        assertEquals(5, refs.size());
        SourcedReference first = refs.get(0);
        assertEquals("26 USC 1(a)", first.sourceId());
        assertEquals("7703", first.reference().targetSection());
        assertEquals(ReferenceType.DEFINITION, first.reference().referenceType());
        assertEquals("26 USC 1401", refs.get(4).sourceId());
    }
}
