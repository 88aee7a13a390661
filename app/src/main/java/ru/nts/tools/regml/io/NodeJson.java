/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.regml.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.regml.core.Json;
import ru.nts.tools.regml.diff.Snapshot;
import ru.nts.tools.regml.tree.Content;
import ru.nts.tools.regml.tree.Content.Definition;
import ru.nts.tools.regml.tree.Content.Reference;
import ru.nts.tools.regml.tree.Content.ReferenceType;
import ru.nts.tools.regml.tree.LabelIndex;
import ru.nts.tools.regml.tree.Node;
import ru.nts.tools.regml.tree.NodeId;
import ru.nts.tools.regml.tree.NodeKind;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Преобразование узлов в JSON и обратно.
 *
 * <p>Формат узла:
 * <pre>
 * {
 *   "label": "1003-1-a",
 *   "kind": "paragraph",
 *   "marker": "a",
 *   "reserved": false,
 *   "attributes": {"title": "..."},
 *   "content": {"text": "...", "definitions": [...], "references": [...]},
 *   "children": [...]
 * }
 * </pre>
 * {@code label} при чтении не используется для построения дерева: метки вычисляет индекс.
 * {@code marker} обязателен для идентификаторных видов. У секции он необязателен и
 * сохраняется, только если секция лежит в подразделе.
 */
public final class NodeJson {

    private NodeJson() {
    }

    /**
     * Читает узел и его поддерево.
     *
     * @param authoredLabels сюда собираются авторские метки узлов (может быть {@code null})
     * @throws IllegalArgumentException при нарушении формата; сообщение указывает путь в JSON
     */
    public static Node read(JsonNode json, String path, Map<NodeId, String> authoredLabels) {
        if (json == null || !json.isObject()) {
            throw new IllegalArgumentException(path + " is not an object");
        }
        String kindName = json.path("kind").asText(null);
        if (kindName == null) {
            throw new IllegalArgumentException(path + ".kind is missing");
        }
        NodeKind kind;
        try {
            kind = NodeKind.fromJson(kindName);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(path + ".kind: " + e.getMessage(), e);
        }

        Node.Builder builder = Node.builder(kind)
                .reserved(json.path("reserved").asBoolean(false))
                .content(readContent(json.path("content"), path + ".content"));
        if (!kind.isOrdinal()) {
            String marker = json.path("marker").asText(null);
            if (marker == null || marker.isBlank()) {
                throw new IllegalArgumentException(path + ".marker is required for " + kindName);
            }
            builder.marker(marker);
        } else if (kind == NodeKind.SECTION) {
            builder.marker(json.path("marker").asText(null));
        }
        JsonNode attributes = json.path("attributes");
        if (attributes.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = attributes.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isNull()) {
                    builder.attribute(field.getKey(), field.getValue().asText());
                }
            }
        }
        JsonNode children = json.path("children");
        if (children.isArray()) {
            for (int i = 0; i < children.size(); i++) {
                builder.child(read(children.get(i), path + ".children[" + i + "]", authoredLabels));
            }
        }
        Node node = builder.build();
        String label = json.path("label").asText(null);
        if (authoredLabels != null && label != null) {
            authoredLabels.put(node.id(), label);
        }
        return node;
    }

    private static Content readContent(JsonNode json, String path) {
        if (json.isMissingNode() || json.isNull()) {
            return Content.EMPTY;
        }
        if (json.isTextual()) {
            return Content.of(json.asText());
        }
        List<Definition> definitions = new ArrayList<>();
        for (JsonNode def : json.path("definitions")) {
            definitions.add(new Definition(def.path("term").asText(), def.path("offset").asInt(0)));
        }
        List<Reference> references = new ArrayList<>();
        for (JsonNode ref : json.path("references")) {
            String type = ref.path("type").asText("internal");
            try {
                references.add(new Reference(ReferenceType.fromJson(type), ref.path("target").asText(),
                        ref.path("offset").asInt(0), ref.path("text").asText("")));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(path + ".references: " + e.getMessage(), e);
            }
        }
        return new Content(json.path("text").asText(""), definitions, references);
    }

    /**
     * Узел с вычисленными метками и маркерами всего поддерева.
     */
    public static ObjectNode write(Node node, LabelIndex index) {
        ObjectNode json = Json.mapper().createObjectNode();
        json.put("label", index.labelOf(node.id()));
        json.put("kind", node.kind().jsonName());
        json.put("marker", index.markerOf(node.id()));
        writeOwnData(json, node.isReserved(), node.attributes(), node.content());
        ArrayNode children = json.putArray("children");
        for (Node child : node.children()) {
            children.add(write(child, index));
        }
        return json;
    }

    /**
     * Узел без меток (например, полезная нагрузка операции).
     */
    public static ObjectNode writeUnlabeled(Node node) {
        ObjectNode json = Json.mapper().createObjectNode();
        json.put("kind", node.kind().jsonName());
        if (node.marker() != null) {
            json.put("marker", node.marker());
        }
        writeOwnData(json, node.isReserved(), node.attributes(), node.content());
        ArrayNode children = json.putArray("children");
        for (Node child : node.children()) {
            children.add(writeUnlabeled(child));
        }
        return json;
    }

    public static ObjectNode write(Snapshot snapshot) {
        ObjectNode json = Json.mapper().createObjectNode();
        json.put("label", snapshot.label());
        json.put("kind", snapshot.kind().jsonName());
        json.put("marker", snapshot.marker());
        writeOwnData(json, snapshot.reserved(), snapshot.attributes(), snapshot.content());
        ArrayNode children = json.putArray("children");
        for (Snapshot child : snapshot.children()) {
            children.add(write(child));
        }
        return json;
    }

    private static void writeOwnData(ObjectNode json, boolean reserved, Map<String, String> attributes,
                                     Content content) {
        if (reserved) {
            json.put("reserved", true);
        }
        if (!attributes.isEmpty()) {
            ObjectNode attrs = json.putObject("attributes");
            attributes.forEach(attrs::put);
        }
        ObjectNode contentJson = json.putObject("content");
        contentJson.put("text", content.text());
        if (!content.definitions().isEmpty()) {
            ArrayNode defs = contentJson.putArray("definitions");
            for (Definition def : content.definitions()) {
                defs.addObject().put("term", def.term()).put("offset", def.offset());
            }
        }
        if (!content.references().isEmpty()) {
            ArrayNode refs = contentJson.putArray("references");
            for (Reference ref : content.references()) {
                refs.addObject()
                        .put("type", ref.type().jsonName())
                        .put("target", ref.target())
                        .put("offset", ref.offset())
                        .put("text", ref.text());
            }
        }
    }
}
