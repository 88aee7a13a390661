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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.regml.core.EncodingUtils;
import ru.nts.tools.regml.core.Json;
import ru.nts.tools.regml.core.RegmlErrorCode;
import ru.nts.tools.regml.core.RegmlException;
import ru.nts.tools.regml.core.RegmlFileException;
import ru.nts.tools.regml.tree.DocumentTree;
import ru.nts.tools.regml.tree.Node;
import ru.nts.tools.regml.tree.NodeId;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Загрузка файла версии регуляции.
 *
 * <p>Формат: {@code {title, part, version, effectiveDate, tree}}. Авторские метки узлов
 * сверяются с вычисленными; расхождения не ошибка, а предупреждение загрузки.
 */
public final class DocumentReader {

    private static final Logger log = LoggerFactory.getLogger(DocumentReader.class);

    /**
     * Загруженная версия и предупреждения о несовпавших метках.
     */
    public record Loaded(DocumentTree tree, List<String> warnings) {
    }

    public DocumentTree read(Path path) {
        return load(path).tree();
    }

    public Loaded load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw RegmlFileException.notFound(path);
        }
        String text;
        try {
            text = EncodingUtils.readTextFile(path).content();
        } catch (IOException e) {
            throw RegmlFileException.notReadable(path, e);
        }
        return parse(text, path.toString());
    }

    /**
     * Разбор JSON версии.
     *
     * @param source имя источника для сообщений об ошибках
     */
    public Loaded parse(String text, String source) {
        JsonNode json;
        try {
            json = Json.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw RegmlFileException.malformed(source, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (json == null || !json.isObject()) {
            throw RegmlFileException.malformed(source, "top level is not an object");
        }
        String part = required(json, "part", source);
        String version = required(json, "version", source);
        String title = json.path("title").asText(null);
        LocalDate effectiveDate = parseDate(json.path("effectiveDate").asText(null), source);

        Map<NodeId, String> authored = new HashMap<>();
        Node root;
        try {
            root = NodeJson.read(json.get("tree"), "tree", authored);
        } catch (IllegalArgumentException e) {
            throw RegmlFileException.malformed(source, e.getMessage(), e);
        }

        DocumentTree tree;
        try {
            tree = DocumentTree.of(title, part, version, effectiveDate, root);
        } catch (RegmlException e) {
            if (e.getCode() == RegmlErrorCode.DUPLICATE_LABEL) {
                throw RegmlFileException.malformed(source, "duplicate label " + e.getContext().get("label"), e);
            }
            throw e;
        }

        List<String> warnings = new ArrayList<>();
        for (Node node : tree.nodes()) {
            String expected = authored.get(node.id());
            String actual = tree.labelOf(node);
            if (expected != null && !expected.equals(actual)) {
                String warning = "authored label " + expected + " does not match computed label " + actual;
                log.warn("{}: {}", source, warning);
                warnings.add(warning);
            }
        }
        log.debug("Loaded {} ({} nodes)", tree, tree.index().size());
        return new Loaded(tree, warnings);
    }

    static String required(JsonNode json, String field, String source) {
        String value = json.path(field).asText(null);
        if (value == null || value.isBlank()) {
            throw RegmlFileException.malformed(source, "'" + field + "' is missing");
        }
        return value;
    }

    static LocalDate parseDate(String value, String source) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw RegmlFileException.malformed(source, "invalid date '" + value + "'", e);
        }
    }
}
