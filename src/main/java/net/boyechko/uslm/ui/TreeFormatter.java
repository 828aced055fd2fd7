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
package net.boyechko.uslm.ui;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.uslm.graph.GraphExport;
import net.boyechko.uslm.model.LegalNode;
import net.boyechko.uslm.model.NodeStatus;
import net.boyechko.uslm.model.NodeType;
import net.boyechko.uslm.model.ParsedDocument;
import net.boyechko.uslm.model.Reference;
import net.boyechko.uslm.model.SourcedReference;

/** Plain-text renderings of a parsed document: statistics, hierarchy, and section details. */
public final class TreeFormatter {
    private static final String INDENT = "  ";
    private static final int REFS_PER_NODE = 3;
    private static final int REPEALED_EXAMPLES = 5;
    private static final int DETAIL_TEXT_LIMIT = 500;

    private TreeFormatter() {}

    /** Summary lines: node counts, repealed sections, and references grouped by type. */
    public static List<String> statistics(ParsedDocument parsed) {
        List<String> lines = new ArrayList<>();
        lines.add("Total nodes parsed: " + parsed.totalNodes());
        lines.add("Total sections parsed: " + parsed.totalSections());
        lines.add("Repealed sections: " + parsed.repealedSections().size());
        if (!parsed.repealedSections().isEmpty()) {
            List<String> examples =
                    parsed.repealedSections()
                            .subList(
                                    0,
                                    Math.min(REPEALED_EXAMPLES, parsed.repealedSections().size()));
            lines.add("  Examples: " + String.join(", ", examples));
        }

        List<SourcedReference> refs = GraphExport.references(parsed.root());
        lines.add("Total cross-references found: " + refs.size());

        Map<String, Integer> byType = new LinkedHashMap<>();
        for (SourcedReference ref : refs) {
            byType.merge(ref.reference().referenceType().value(), 1, Integer::sum);
        }
        if (!byType.isEmpty()) {
            lines.add("Reference types:");
            byType.entrySet().stream()
                    .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()))
                    .forEach(e -> lines.add("  - " + e.getKey() + ": " + e.getValue()));
        }

        lines.add("Nodes by type:");
        for (Map.Entry<NodeType, Integer> e : parsed.nodeCountsByType().entrySet()) {
            lines.add("  - " + e.getKey().tag() + ": " + e.getValue());
        }
        return lines;
    }

    /** Indented outline of the tree down to {@code maxDepth} levels below {@code node}. */
    public static String hierarchy(LegalNode node, int maxDepth) {
        StringBuilder sb = new StringBuilder();
        appendHierarchy(sb, node, 0, maxDepth);
        return sb.toString();
    }

    private static void appendHierarchy(StringBuilder sb, LegalNode node, int depth, int maxDepth) {
        if (depth > maxDepth) return;

        String prefix = INDENT.repeat(depth);
        String repealed = node.status() == NodeStatus.REPEALED ? " [REPEALED]" : "";
        sb.append(prefix).append(node.nodeType().tag()).append(": ");
        if (node.heading() != null) {
            sb.append(node.num() != null ? node.num() : "").append(" - ").append(node.heading());
        } else {
            sb.append(node.num() != null ? node.num() : node.id());
        }
        sb.append(repealed).append('\n');

        List<Reference> refs = node.references();
        for (Reference ref : refs.subList(0, Math.min(REFS_PER_NODE, refs.size()))) {
            sb.append(prefix)
                    .append(INDENT)
                    .append("-> References: Section ")
                    .append(ref.targetSection())
                    .append(" (")
                    .append(ref.referenceType().value())
                    .append(")\n");
        }

        for (LegalNode child : node.children()) {
            appendHierarchy(sb, child, depth + 1, maxDepth);
        }
    }

    /** Heading, path, status, text, references, and immediate children of one node. */
    public static String sectionDetails(LegalNode node) {
        StringBuilder sb = new StringBuilder();
        sb.append("SECTION: ").append(node.id()).append('\n');
        sb.append("Heading: ").append(node.heading() != null ? node.heading() : "").append('\n');
        sb.append("Path: ").append(node.hierarchicalPath()).append('\n');
        sb.append("Status: ").append(node.status().value()).append('\n');

        if (!node.text().isEmpty()) {
            String text =
                    node.text().length() > DETAIL_TEXT_LIMIT
                            ? node.text().substring(0, DETAIL_TEXT_LIMIT) + "..."
                            : node.text();
            sb.append("\nText:\n").append(text).append('\n');
        }

        if (!node.references().isEmpty()) {
            sb.append("\nCross-references (").append(node.references().size()).append("):\n");
            for (Reference ref : node.references()) {
                sb.append("  - Section ")
                        .append(ref.targetSection())
                        .append(" (")
                        .append(ref.referenceType().value())
                        .append(")\n");
                sb.append("    Context: ").append(ref.context()).append('\n');
            }
        }

        if (!node.children().isEmpty()) {
            sb.append("\nSubsections (").append(node.children().size()).append("):\n");
            for (LegalNode child : node.children()) {
                sb.append("  - ")
                        .append(child.num() != null ? child.num() : child.id())
                        .append(": ")
                        .append(child.heading() != null ? child.heading() : "(no heading)")
                        .append('\n');
            }
        }
        return sb.toString();
    }
}
