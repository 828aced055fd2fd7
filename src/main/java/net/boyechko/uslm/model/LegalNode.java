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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One provision or grouping in the legal-code hierarchy. Nodes are created once by the tree
 * builder and never modified; {@code children} and {@code references} are unmodifiable.
 *
 * @param id canonical citation, e.g. "26 USC 162(a)"
 * @param structuralPath USLM identifier path such as "/us/usc/t26/s162/a", or "" if absent
 * @param nodeType hierarchy level of the source element
 * @param num declared number label, or null
 * @param heading declared heading, or null
 * @param text normalized body text, possibly empty
 * @param status lifecycle status
 * @param hierarchicalPath breadcrumb of ancestor labels, e.g. "Chapter: Normal Taxes > Section 1"
 * @param parentId citation of the parent node, or null for the root
 * @param children child nodes in document order
 * @param references cross-references found in this node's own text
 */
public record LegalNode(
        String id,
        String structuralPath,
        NodeType nodeType,
        String num,
        String heading,
        String text,
        NodeStatus status,
        String hierarchicalPath,
        String parentId,
        List<LegalNode> children,
        List<Reference> references) {

    public LegalNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(nodeType, "nodeType");
        structuralPath = structuralPath != null ? structuralPath : "";
        text = text != null ? text : "";
        status = status != null ? status : NodeStatus.ACTIVE;
        hierarchicalPath = hierarchicalPath != null ? hierarchicalPath : "";
        children = children != null ? List.copyOf(children) : List.of();
        references = references != null ? List.copyOf(references) : List.of();
    }

    public boolean isContainer() {
        return nodeType.isContainer();
    }

    public boolean isContent() {
        return nodeType.isContent();
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    public boolean isRoot() {
        return parentId == null;
    }

    /** Heading and text joined with " - ", skipping whichever is missing. */
    public String fullText() {
        List<String> parts = new ArrayList<>(2);
        if (heading != null && !heading.isEmpty()) parts.add(heading);
        if (!text.isEmpty()) parts.add(text);
        return String.join(" - ", parts);
    }

    /** Text with its breadcrumb and heading in front, for semantic indexing. */
    public String embeddingText() {
        List<String> context = new ArrayList<>(3);
        if (!hierarchicalPath.isEmpty()) context.add(hierarchicalPath);
        if (heading != null && !heading.isEmpty()) context.add(heading);
        if (!text.isEmpty()) context.add(text);

        String lead = String.join(" > ", context.subList(0, Math.min(2, context.size())));
        String body = context.size() > 2 ? context.get(2) : "";
        return lead + ": " + body;
    }

    public Optional<LegalNode> findById(String targetId) {
        if (id.equals(targetId)) return Optional.of(this);
        for (LegalNode child : children) {
            Optional<LegalNode> found = child.findById(targetId);
            if (found.isPresent()) return found;
        }
        return Optional.empty();
    }

    /** All section nodes in this subtree, in pre-order. */
    public List<LegalNode> allSections() {
        List<LegalNode> out = new ArrayList<>();
        collect(this, out, true);
        return out;
    }

    /** All leaf nodes in this subtree, in document order. */
    public List<LegalNode> leafNodes() {
        List<LegalNode> out = new ArrayList<>();
        collect(this, out, false);
        return out;
    }

    private static void collect(LegalNode node, List<LegalNode> out, boolean sections) {
        if (sections ? node.nodeType == NodeType.SECTION : node.isLeaf()) {
            out.add(node);
        }
        for (LegalNode child : node.children) {
            collect(child, out, sections);
        }
    }
}
