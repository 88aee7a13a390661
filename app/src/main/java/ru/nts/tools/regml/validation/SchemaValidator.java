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
package ru.nts.tools.regml.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.regml.core.EncodingUtils;
import ru.nts.tools.regml.core.Json;
import ru.nts.tools.regml.core.RegmlErrorCode;
import ru.nts.tools.regml.core.RegmlException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Проверка файлов версий и уведомлений по встроенным JSON-схемам (Draft-07).
 * Никогда не выбрасывает исключений для некорректного ввода: только диагностики.
 */
public final class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);

    public static final String DOCUMENT_SCHEMA = "/schema/document.schema.json";
    public static final String NOTICE_SCHEMA = "/schema/notice.schema.json";

    private final JsonSchema documentSchema;
    private final JsonSchema noticeSchema;

    public SchemaValidator() {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        this.documentSchema = load(factory, DOCUMENT_SCHEMA);
        this.noticeSchema = load(factory, NOTICE_SCHEMA);
    }

    private static JsonSchema load(JsonSchemaFactory factory, String resource) {
        try (InputStream in = SchemaValidator.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new RegmlException(RegmlErrorCode.INTERNAL_ERROR, "schema", resource);
            }
            return factory.getSchema(Json.mapper().readTree(in));
        } catch (IOException e) {
            throw new RegmlException(RegmlErrorCode.INTERNAL_ERROR, Map.of("schema", resource), e);
        }
    }

    public List<Diagnostic> validateDocument(JsonNode json) {
        return validate(documentSchema, json, "Document");
    }

    public List<Diagnostic> validateNotice(JsonNode json) {
        return validate(noticeSchema, json, "Notice");
    }

    /**
     * Проверка файла. Нечитаемый файл или некорректный JSON дают диагностику CRITICAL.
     */
    public List<Diagnostic> validateFile(Path path, boolean notice) {
        JsonNode json;
        try {
            json = Json.mapper().readTree(EncodingUtils.readTextFile(path).content());
        } catch (JsonProcessingException e) {
            return List.of(new Diagnostic(Severity.CRITICAL, "Invalid JSON: " + e.getOriginalMessage(),
                    path.toString()));
        } catch (IOException e) {
            return List.of(new Diagnostic(Severity.CRITICAL, "Cannot read file: " + e.getMessage(),
                    path.toString()));
        }
        return notice ? validateNotice(json) : validateDocument(json);
    }

    private static List<Diagnostic> validate(JsonSchema schema, JsonNode json, String what) {
        Set<ValidationMessage> messages = schema.validate(json);
        List<Diagnostic> diagnostics = new ArrayList<>();
        messages.stream()
                .sorted(Comparator.comparing(ValidationMessage::getMessage))
                .forEach(m -> diagnostics.add(new Diagnostic(Severity.CRITICAL, m.getMessage(),
                        String.valueOf(m.getInstanceLocation()))));
        if (diagnostics.isEmpty()) {
            diagnostics.add(Diagnostic.ok(what + " validated against schema"));
        } else {
            log.debug("{} failed schema validation with {} messages", what, diagnostics.size());
        }
        return diagnostics;
    }
}
