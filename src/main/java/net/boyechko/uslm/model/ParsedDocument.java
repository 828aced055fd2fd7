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
package net.boyechko.uslm.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.boyechko.uslm.issue.Issue;
import net.boyechko.uslm.issue.IssueList;
import net.boyechko.uslm.issue.IssueType;

/**
 * Result of parsing one document: the node tree plus counts accumulated while building it.
 *
 * @param title document label, e.g. "Title 26 - Internal Revenue Code"
 * @param codeLabel citation prefix shared by every node id, e.g. "26 USC"
 * @param root root node of the hierarchy
 * @param totalNodes number of nodes created
 * @param totalSections number of section nodes created
 * @param repealedSections citation ids of repealed nodes, in the order they were found
 * @param issues non-fatal anomalies noticed while building; read-only
 */
public record ParsedDocument(
        String title,
        String codeLabel,
        LegalNode root,
        int totalNodes,
        int totalSections,
        List<String> repealedSections,
        List<Issue> issues) {

    public ParsedDocument {
        repealedSections = repealedSections != null ? List.copyOf(repealedSections) : List.of();
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    /** Looks up a section by its number, e.g. "162" finds "26 USC 162". */
    public Optional<LegalNode> getSection(String sectionNum) {
        return root.findById(codeLabel + " " + sectionNum);
    }

    /** Returns a new list holding the issues of the given type, in the order they were found. */
    public IssueList issuesOfType(IssueType type) {
        return new IssueList(issues).ofType(type);
    }

    public Optional<LegalNode> findById(String id) {
        return root.findById(id);
    }

    public List<LegalNode> allSections() {
        return root.allSections();
    }

    public Map<NodeType, Integer> nodeCountsByType() {
        Map<NodeType, Integer> counts = new EnumMap<>(NodeType.class);
        countByType(root, counts);
        return counts;
    }

    private static void countByType(LegalNode node, Map<NodeType, Integer> counts) {
        counts.merge(node.nodeType(), 1, Integer::sum);
        for (LegalNode child : node.children()) {
            countByType(child, counts);
        }
    }
}
