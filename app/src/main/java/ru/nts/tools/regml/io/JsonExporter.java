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

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.regml.core.FileUtils;
import ru.nts.tools.regml.core.Json;
import ru.nts.tools.regml.core.RegmlFileException;
import ru.nts.tools.regml.diff.Change;
import ru.nts.tools.regml.diff.TreeDiff;
import ru.nts.tools.regml.tree.DocumentTree;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Экспорт версий в JSON для последующего отображения.
 *
 * <p>Для каждой версии создается объект {@code {title, part, version, effectiveDate, tree}}.
 * Если версий несколько, объект версии получает массив {@code diffs} с изменениями
 * к следующей версии: {@code [{from, to, changes: [...]}]}.
 */
public final class JsonExporter {

    private static final Logger log = LoggerFactory.getLogger(JsonExporter.class);

    private final DocumentWriter writer = new DocumentWriter();

    /**
     * @param trees версии в порядке цепочки
     * @param diffs попарные diff соседних версий ({@code trees.size() - 1} штук)
     */
    public List<ObjectNode> export(List<DocumentTree> trees, List<TreeDiff> diffs) {
        if (trees.size() > 1 && diffs.size() != trees.size() - 1) {
            throw new IllegalArgumentException("Expected " + (trees.size() - 1) + " diffs, got " + diffs.size());
        }
        List<ObjectNode> documents = new ArrayList<>(trees.size());
        for (int i = 0; i < trees.size(); i++) {
            ObjectNode json = writer.toJson(trees.get(i));
            if (trees.size() > 1) {
                ArrayNode diffArray = json.putArray("diffs");
                if (i < diffs.size()) {
                    diffArray.add(toJson(diffs.get(i)));
                }
            }
            documents.add(json);
        }
        return documents;
    }

    /**
     * Записывает экспорт в {@code <dir>/<part>/<version>.json}.
     *
     * @return пути записанных файлов
     */
    public List<Path> write(Path dir, List<DocumentTree> trees, List<TreeDiff> diffs) {
        List<ObjectNode> documents = export(trees, diffs);
        List<Path> written = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            DocumentTree tree = trees.get(i);
            Path path = dir.resolve(tree.part()).resolve(tree.version() + ".json");
            try {
                FileUtils.safeWrite(path, Json.pretty(documents.get(i)));
            } catch (IOException e) {
                throw RegmlFileException.ioError(path, e);
            }
            written.add(path);
        }
        log.info("Exported {} versions to {}", written.size(), dir);
        return written;
    }

    public ObjectNode toJson(TreeDiff diff) {
        ObjectNode json = Json.mapper().createObjectNode();
        json.put("from", diff.fromVersion());
        json.put("to", diff.toVersion());
        ArrayNode changes = json.putArray("changes");
        for (Change change : diff.changes()) {
            ObjectNode item = changes.addObject();
            item.put("kind", change.kind().jsonName());
            item.put("label", change.label());
            if (change.previousLabel() != null) {
                item.put("previousLabel", change.previousLabel());
            }
            if (change.before() != null) {
                item.set("before", NodeJson.write(change.before()));
            }
            if (change.after() != null) {
                item.set("after", NodeJson.write(change.after()));
            }
        }
        return json;
    }
}
