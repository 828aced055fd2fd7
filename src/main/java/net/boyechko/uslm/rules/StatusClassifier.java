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
package net.boyechko.uslm.rules;

import java.util.Locale;
import net.boyechko.uslm.document.UslmElements;
import net.boyechko.uslm.model.NodeStatus;
import org.w3c.dom.Element;

/**
 * Assigns a lifecycle status. An explicit {@code status} attribute outranks markers in the text;
 * with neither, the node is active.
 */
public final class StatusClassifier {
    private StatusClassifier() {}

    public static NodeStatus classify(Element elem, String normalizedText) {
        return classify(UslmElements.attribute(elem, "status"), normalizedText);
    }

    public static NodeStatus classify(String statusAttribute, String normalizedText) {
        String attr = statusAttribute != null ? statusAttribute.toLowerCase(Locale.ROOT) : "";
        if (attr.contains("repeal")) return NodeStatus.REPEALED;
        if (attr.contains("expired")) return NodeStatus.EXPIRED;
        if (attr.contains("reserved")) return NodeStatus.RESERVED;

        String text = normalizedText != null ? normalizedText.toLowerCase(Locale.ROOT) : "";
        if (text.contains("[repealed") || text.contains("repealed.")) return NodeStatus.REPEALED;
        if (text.contains("[expired")) return NodeStatus.EXPIRED;

        return NodeStatus.ACTIVE;
    }
}
