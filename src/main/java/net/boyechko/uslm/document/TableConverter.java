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
package net.boyechko.uslm.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.w3c.dom.Element;

/**
 * Renders an XHTML-style table as pipe-delimited rows: a header line, a separator line, then the
 * remaining rows padded to the header's column count.
 */
public final class TableConverter {
    private static final String SEPARATOR_CELL = "---";

    private TableConverter() {}

    /** Converts a {@code table} element; returns "" if it has no rows with cells. */
    public static String toText(Element table) {
        List<List<String>> rows = new ArrayList<>();
        for (Element tr : UslmElements.descendants(table, "tr")) {
            List<String> cells = new ArrayList<>();
            for (Element cell : UslmElements.childElements(tr)) {
                String tag = UslmElements.localName(cell);
                if ("th".equals(tag) || "td".equals(tag)) {
                    cells.add(escapeCell(UslmElements.allText(cell).strip()));
                }
            }
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        return render(rows);
    }

    /** Renders already-extracted cell rows; the first row is treated as the header. */
    public static String render(List<List<String>> rows) {
        if (rows.isEmpty()) return "";

        List<String> header = rows.get(0);
        int width = header.size();

        List<String> lines = new ArrayList<>(rows.size() + 1);
        lines.add(line(header));
        lines.add(line(Collections.nCopies(width, SEPARATOR_CELL)));
        for (List<String> row : rows.subList(1, rows.size())) {
            List<String> padded = new ArrayList<>(row);
            while (padded.size() < width) {
                padded.add("");
            }
            lines.add(line(padded));
        }
        return String.join("\n", lines);
    }

    /** Escapes literal pipes so they are not read as column delimiters. */
    public static String escapeCell(String text) {
        return text.replace("|", "\\|");
    }

    private static String line(List<String> cells) {
        return "| " + String.join(" | ", cells) + " |";
    }
}
