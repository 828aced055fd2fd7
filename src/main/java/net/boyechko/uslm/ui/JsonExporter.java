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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.uslm.model.LegalNode;
import net.boyechko.uslm.model.ParsedDocument;
import net.boyechko.uslm.model.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes a parsed document as nested JSON for inspection. Long node text is shortened. */
public class JsonExporter {
    private static final Logger logger = LoggerFactory.getLogger(JsonExporter.class);

    static final int TEXT_PREVIEW_LENGTH = 200;

    private final ObjectMapper mapper;

    public JsonExporter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(ParsedDocument parsed) throws JsonProcessingException {
        return mapper.writeValueAsString(toTree(parsed));
    }

    public void export(ParsedDocument parsed, Path outputPath) throws IOException {
        Path parent = outputPath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(outputPath.toFile(), toTree(parsed));
        logger.info("Exported {} nodes to {}", parsed.totalNodes(), outputPath);
    }

    ObjectNode toTree(ParsedDocument parsed) {
        ObjectNode root = mapper.createObjectNode();
        root.put("title", parsed.title());
        root.put("total_sections", parsed.totalSections());
        root.put("total_nodes", parsed.totalNodes());
        ArrayNode repealed = root.putArray("repealed_sections");
        parsed.repealedSections().forEach(repealed::add);
        root.set("root", nodeToJson(parsed.root()));
        return root;
    }

    private ObjectNode nodeToJson(LegalNode node) {
        ObjectNode json = mapper.createObjectNode();
        json.put("id", node.id());
        json.put("identifier", node.structuralPath());
        json.put("type", node.nodeType().tag());
        json.put("num", node.num());
        json.put("heading", node.heading());
        json.put("text", preview(node.text()));
        json.put("status", node.status().value());
        json.put("hierarchical_path", node.hierarchicalPath());

        ArrayNode refs = json.putArray("references");
        for (Reference ref : node.references()) {
            ObjectNode r = refs.addObject();
            r.put("target", ref.targetSection());
            r.put("type", ref.referenceType().value());
        }

        ArrayNode children = json.putArray("children");
        for (LegalNode child : node.children()) {
            children.add(nodeToJson(child));
        }
        return json;
    }

    static String preview(String text) {
        return text.length() > TEXT_PREVIEW_LENGTH
                ? text.substring(0, TEXT_PREVIEW_LENGTH) + "..."
                : text;
    }
}
