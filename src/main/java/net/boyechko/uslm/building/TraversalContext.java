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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.uslm.issue.Issue;
import net.boyechko.uslm.issue.IssueList;
import net.boyechko.uslm.issue.IssueLoc;
import net.boyechko.uslm.issue.IssueSev;
import net.boyechko.uslm.issue.IssueType;
import net.boyechko.uslm.model.NodeStatus;
import net.boyechko.uslm.model.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Counters and findings accumulated over one build. A fresh context is used for every parse. */
final class TraversalContext {
    private static final Logger logger = LoggerFactory.getLogger(TraversalContext.class);

    private final Integer maxSections;
    private final Set<String> seenIds = new HashSet<>();
    private final List<String> repealedSections = new ArrayList<>();
    private final IssueList issues = new IssueList();

    private int sectionsParsed;
    private int totalNodes;
    private boolean cutoffLogged;

    TraversalContext(Integer maxSections) {
        this.maxSections = maxSections;
    }

    /** True once the configured number of sections has been built. */
    boolean cutoffReached() {
        boolean reached = maxSections != null && maxSections > 0 && sectionsParsed >= maxSections;
        if (reached && !cutoffLogged) {
            cutoffLogged = true;
            logger.debug("Section cutoff of {} reached; skipping the rest", maxSections);
        }
        return reached;
    }

    /** Records a newly created node. */
    void recordNode(String id, String structuralPath, NodeType type, NodeStatus status) {
        totalNodes++;
        if (type == NodeType.SECTION) {
            sectionsParsed++;
        }
        if (status == NodeStatus.REPEALED) {
            repealedSections.add(id);
        }
        if (!seenIds.add(id)) {
            logger.debug("Duplicate citation id {} at {}", id, structuralPath);
            issues.add(
                    new Issue(
                            IssueType.DUPLICATE_CITATION,
                            IssueSev.WARNING,
                            IssueLoc.at(id, structuralPath),
                            "Citation " + id + " is shared by more than one node"));
        }
    }

    void recordDepthExceeded(String tag, String structuralPath, int depth) {
        logger.debug("Skipping <{}> at depth {}: {}", tag, depth, structuralPath);
        issues.add(
                new Issue(
                        IssueType.DEPTH_LIMIT_EXCEEDED,
                        IssueSev.WARNING,
                        IssueLoc.at(null, structuralPath),
                        "Skipped <" + tag + "> nested " + depth + " levels deep"));
    }

    int sectionsParsed() {
        return sectionsParsed;
    }

    int totalNodes() {
        return totalNodes;
    }

    List<String> repealedSections() {
        return repealedSections;
    }

    IssueList issues() {
        return issues;
    }
}
