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

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.regml.core.FileUtils;
import ru.nts.tools.regml.core.Json;
import ru.nts.tools.regml.core.RegmlFileException;
import ru.nts.tools.regml.tree.DocumentTree;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Запись версии регуляции в формате, который читает {@link DocumentReader}.
 */
public final class DocumentWriter {

    private static final Logger log = LoggerFactory.getLogger(DocumentWriter.class);

    public ObjectNode toJson(DocumentTree tree) {
        ObjectNode json = Json.mapper().createObjectNode();
        json.put("title", tree.title());
        json.put("part", tree.part());
        json.put("version", tree.version());
        json.put("effectiveDate", tree.effectiveDate() != null ? tree.effectiveDate().toString() : null);
        json.set("tree", NodeJson.write(tree.root(), tree.index()));
        return json;
    }

    public String toString(DocumentTree tree) {
        return Json.pretty(toJson(tree));
    }

    public void write(DocumentTree tree, Path path) {
        try {
            FileUtils.safeWrite(path, toString(tree));
        } catch (IOException e) {
            throw RegmlFileException.ioError(path, e);
        }
        log.info("Wrote version {} to {}", tree.version(), path);
    }
}
