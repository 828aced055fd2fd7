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

/**
 * Outcome of linking a batch of references.
 *
 * @param created references whose source and target both exist in the sink
 * @param notFound references skipped because an endpoint is missing
 */
public record ReferenceLinkResult(int created, int notFound) {

    public ReferenceLinkResult plus(ReferenceLinkResult other) {
        return new ReferenceLinkResult(created + other.created, notFound + other.notFound);
    }
}
