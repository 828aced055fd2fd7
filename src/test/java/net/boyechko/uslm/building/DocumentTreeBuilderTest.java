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
package net.boyechko.uslm.building;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import net.boyechko.uslm.UslmTestBase;
import net.boyechko.uslm.core.StructureException;
import net.boyechko.uslm.document.UslmElements;
import net.boyechko.uslm.issue.Issue;
import net.boyechko.uslm.issue.IssueSev;
import net.boyechko.uslm.issue.IssueType;
import net.boyechko.uslm.model.LegalNode;
import net.boyechko.uslm.model.NodeStatus;
import net.boyechko.uslm.model.NodeType;
import net.boyechko.uslm.model.ParsedDocument;
import net.boyechko.uslm.model.Reference;
import net.boyechko.uslm.rules.CitationResolver;
import net.boyechko.uslm.rules.ReferenceExtractor;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

public class DocumentTreeBuilderTest extends UslmTestBase {

    private static DocumentTreeBuilder builder(Integer maxSections) {
        return builder(maxSections, 64);
    }

    private static DocumentTreeBuilder builder(Integer maxSections, int maxDepth) {
        return new DocumentTreeBuilder(
                new CitationResolver(), new ReferenceExtractor(), maxSections, maxDepth);
    }

    private static Element sampleTitle() {
        return UslmElements.findRootTitle(sampleDocument());
    }

    private static List<String> ids(List<LegalNode> nodes) {
        return nodes.stream().map(LegalNode::id).collect(Collectors.toList());
    }

    @Test
    void threeLevelDocumentEndToEnd() throws Exception {
        Element chapter =
                element(
                        "<chapter identifier=\"/us/usc/t26/stA/ch1\"><num>CHAPTER 1—</num>"
                                + "<heading>Normal Taxes</heading>"
                                + section(
                                        "/us/usc/t26/stA/ch1/s1",
                                        "§ 1.",
                                        "Tax imposed",
                                        "<subsection identifier=\"/us/usc/t26/stA/ch1/s1/a\">"
                                                + "<num>(a)</num><content>Amounts referencing"
                                                + " section 162 are deductible.</content>"
                                                + "</subsection>")
                                + "</chapter>");

        ParsedDocument parsed = builder(null).build(chapter);

        assertEquals(3, parsed.totalNodes());
        assertEquals(1, parsed.totalSections());

        LegalNode root = parsed.root();
        LegalNode sec = root.children().get(0);
        LegalNode sub = sec.children().get(0);
        assertEquals(1, root.children().size());
        assertEquals(1, sec.children().size());
        assertEquals("26 USC 1", sec.id());
        assertEquals("26 USC 1(a)", sub.id());
        assertEquals(root.id(), sec.parentId());
        assertEquals(sec.id(), sub.parentId());
        assertNull(root.parentId());

        assertTrue(root.references().isEmpty());
        assertTrue(sec.references().isEmpty());
        assertEquals(List.of("162"), targets(sub.references()));
    }

    @Test
    void buildsSampleTitle() throws Exception {
        ParsedDocument parsed = builder(null).build(sampleTitle());

        assertEquals(10, parsed.totalNodes());
        assertEquals(4, parsed.totalSections());
        assertEquals("Title 26 - INTERNAL REVENUE CODE", parsed.title());
        assertEquals("26 USC", parsed.codeLabel());
        assertEquals(
                List.of("26 USC 1", "26 USC 2", "26 USC 162", "26 USC 1401"),
                ids(parsed.allSections()));
        assertTrue(parsed.issues().isEmpty());
    }

    @Test
    void resolvesNodeFieldsFromElement() throws Exception {
        ParsedDocument parsed = builder(null).build(sampleTitle());
        LegalNode sub = parsed.findById("26 USC 1(a)").orElseThrow();

        assertEquals(NodeType.SUBSECTION, sub.nodeType());
        assertEquals("/us/usc/t26/stA/ch1/s1/a", sub.structuralPath());
        assertEquals("(a)", sub.num());
        assertEquals("Married individuals", sub.heading());
        assertEquals(NodeStatus.ACTIVE, sub.status());
        assertEquals(
                "Title: INTERNAL REVENUE CODE > Subtitle: Income Taxes"
                        + " > Chapter: NORMAL TAXES AND SURTAXES > Section: Tax imposed"
                        + " > Subsection: Married individuals",
                sub.hierarchicalPath());
        assertTrue(sub.text().startsWith("There is hereby imposed"), sub.text());
        assertEquals(List.of("7703", "2"), targets(sub.references()));
    }

    @Test
    void marksRepealedSectionsFromText() throws Exception {
        ParsedDocument parsed = builder(null).build(sampleTitle());

        assertEquals(List.of("26 USC 2"), parsed.repealedSections());
        assertEquals(NodeStatus.REPEALED, parsed.getSection("2").orElseThrow().status());
        assertEquals(NodeStatus.ACTIVE, parsed.getSection("1401").orElseThrow().status());
    }

    @Test
    void sectionCutoffKeepsCompleteSections() throws Exception {
        ParsedDocument parsed = builder(2).build(sampleTitle());

        assertEquals(2, parsed.totalSections());
        assertEquals(List.of("26 USC 1", "26 USC 2"), ids(parsed.allSections()));
        // title, subtitle, chapter 1, section 1 with both subsections, section 2
        assertEquals(7, parsed.totalNodes());
        assertEquals(2, parsed.getSection("1").orElseThrow().children().size());
        assertTrue(parsed.findById("26 USC CHAPTER 2—").isEmpty());
    }

    @Test
    void zeroOrNullCutoffIsUnbounded() throws Exception {
        assertEquals(4, builder(0).build(sampleTitle()).totalSections());
        assertEquals(4, builder(null).build(sampleTitle()).totalSections());
    }

    @Test
    void totalsMatchTreeAfterCutoff() throws Exception {
        ParsedDocument parsed = builder(3).build(sampleTitle());
        int counted = parsed.nodeCountsByType().values().stream().mapToInt(Integer::intValue).sum();
        assertEquals(parsed.totalNodes(), counted);
        assertEquals(parsed.totalSections(), parsed.allSections().size());
    }

    @Test
    void duplicateCitationsAreReportedNotFatal() throws Exception {
        Element chapter =
                element(
                        "<chapter>"
                                + section("/us/usc/t26/s5", "§ 5.", "First", "")
                                + section("/us/usc/t26/s5", "§ 5.", "Second", "")
                                + "</chapter>");

        ParsedDocument parsed = builder(null).build(chapter);

        assertEquals(2, parsed.totalSections());
        assertEquals(1, parsed.issuesOfType(IssueType.DUPLICATE_CITATION).size());
        assertEquals("26 USC 5", parsed.issues().get(0).where().citation());
        assertEquals("First", parsed.findById("26 USC 5").orElseThrow().heading());
    }

    @Test
    void elementsBeyondDepthLimitAreSkipped() throws Exception {
        Element chapter =
                element(
                        "<chapter>"
                                + section(
                                        "/us/usc/t26/s9",
                                        "§ 9.",
                                        "Deep",
                                        "<subsection identifier=\"/us/usc/t26/s9/a\">"
                                                + "<paragraph identifier=\"/us/usc/t26/s9/a/1\"/>"
                                                + "</subsection>")
                                + "</chapter>");

        ParsedDocument parsed = builder(null, 3).build(chapter);

        assertEquals(3, parsed.totalNodes());
        assertTrue(parsed.findById("26 USC 9(a)").orElseThrow().isLeaf());
        assertEquals(
                "/us/usc/t26/s9/a/1",
                parsed.issuesOfType(IssueType.DEPTH_LIMIT_EXCEEDED).get(0).where()
                        .structuralPath());
    }

    @Test
    void issuesAreReadOnlyAfterBuild() throws Exception {
        ParsedDocument parsed = builder(null).build(sampleTitle());
        Issue extra =
                new Issue(IssueType.DUPLICATE_CITATION, IssueSev.WARNING, "added afterward");

        assertThrows(UnsupportedOperationException.class, () -> parsed.issues().add(extra));
        assertThrows(UnsupportedOperationException.class, () -> parsed.issues().clear());
        assertTrue(parsed.issues().isEmpty());
    }

    @Test
    void rebuildingSameElementYieldsSameIds() throws Exception {
        Element title = sampleTitle();

        List<String> first = preOrderIds(builder(null).build(title).root());
        List<String> second = preOrderIds(builder(null).build(title).root());

        assertEquals(10, first.size());
        assertEquals(first, second);
    }

    @Test
    void nonStructuralRootIsRejected() {
        assertThrows(StructureException.class, () -> builder(null).build(element("<main/>")));
        assertThrows(StructureException.class, () -> builder(null).build(null));
    }

    @Test
    void rejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class, () -> builder(null, 0));
    }

    @Test
    void buildsBreadcrumbs() {
        assertEquals(
                "Chapter: Normal Taxes",
                DocumentTreeBuilder.breadcrumb("", NodeType.CHAPTER, "1", "Normal Taxes"));
        assertEquals(
                "Chapter: Normal Taxes > Section 1",
                DocumentTreeBuilder.breadcrumb(
                        "Chapter: Normal Taxes", NodeType.SECTION, "1", null));
        assertEquals(
                "Parent", DocumentTreeBuilder.breadcrumb("Parent", NodeType.CLAUSE, null, null));
    }

    private static List<String> preOrderIds(LegalNode root) {
        List<String> out = new ArrayList<>();
        collectIds(root, out);
        return out;
    }

    private static void collectIds(LegalNode node, List<String> out) {
        out.add(node.id());
        for (LegalNode child : node.children()) {
            collectIds(child, out);
        }
    }

    private static List<String> targets(List<Reference> refs) {
        return refs.stream().map(Reference::targetSection).collect(Collectors.toList());
    }
}
