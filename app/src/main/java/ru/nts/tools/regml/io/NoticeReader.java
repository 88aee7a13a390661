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
import ru.nts.tools.regml.changes.Notice;
import ru.nts.tools.regml.changes.Operation;
import ru.nts.tools.regml.changes.OperationKind;
import ru.nts.tools.regml.changes.Placement;
import ru.nts.tools.regml.changes.Position;
import ru.nts.tools.regml.core.EncodingUtils;
import ru.nts.tools.regml.core.Json;
import ru.nts.tools.regml.core.RegmlChangeException;
import ru.nts.tools.regml.core.RegmlFileException;
import ru.nts.tools.regml.tree.Node;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Загрузка файла уведомления.
 *
 * <p>Формат: {@code {documentNumber, effectiveDate, appliesToVersion, operations: [...]}}.
 * Операции читаются как есть: проверку их формы выполняет
 * {@link ru.nts.tools.regml.changes.ChangesetParser}, чтобы ошибка называла индекс операции.
 */
public final class NoticeReader {

    private static final Logger log = LoggerFactory.getLogger(NoticeReader.class);

    public Notice read(Path path) {
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

    public Notice parse(String text, String source) {
        JsonNode json;
        try {
            json = Json.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw RegmlFileException.malformed(source, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (json == null || !json.isObject()) {
            throw RegmlFileException.malformed(source, "top level is not an object");
        }
        String documentNumber = DocumentReader.required(json, "documentNumber", source);
        String appliesTo = DocumentReader.required(json, "appliesToVersion", source);
        LocalDate effectiveDate = DocumentReader.parseDate(json.path("effectiveDate").asText(null), source);

        JsonNode operationsJson = json.path("operations");
        if (!operationsJson.isMissingNode() && !operationsJson.isArray()) {
            throw RegmlFileException.malformed(source, "'operations' is not an array");
        }
        List<Operation> operations = new ArrayList<>();
        for (int i = 0; i < operationsJson.size(); i++) {
            operations.add(readOperation(i, operationsJson.get(i)));
        }
        log.debug("Loaded notice {} with {} operations from {}", documentNumber, operations.size(), source);
        return new Notice(documentNumber, effectiveDate, appliesTo, operations);
    }

    private static Operation readOperation(int index, JsonNode json) {
        OperationKind kind = OperationKind.fromJson(json.path("kind").asText(""));
        String kindName = kind != null ? kind.jsonName() : json.path("kind").asText("?");
        String target = json.path("targetLabel").asText(null);

        Position position = null;
        JsonNode positionJson = json.get("position");
        if (positionJson != null && !positionJson.isNull()) {
            if (positionJson.isTextual()) {
                position = new Position(Placement.fromJson(positionJson.asText()), null);
            } else if (positionJson.isObject()) {
                position = new Position(Placement.fromJson(positionJson.path("placement").asText("")),
                        positionJson.path("anchor").asText(null));
            } else {
                throw RegmlChangeException.malformed(index, kindName, "position");
            }
        }

        Node payload = null;
        JsonNode payloadJson = json.get("payload");
        if (payloadJson != null && !payloadJson.isNull()) {
            try {
                payload = NodeJson.read(payloadJson, "payload", null);
            } catch (IllegalArgumentException e) {
                throw RegmlChangeException.malformed(index, kindName, e.getMessage());
            }
        }
        return new Operation(index, kind, target, position, payload);
    }
}
