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
package ru.nts.tools.regml.tree;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Содержимое узла: текст, определения терминов и ссылки.
 * Смещения определений и ссылок указывают на позицию в {@link #text()}.
 */
public record Content(String text, List<Definition> definitions, List<Reference> references) {

    public static final Content EMPTY = new Content("", List.of(), List.of());

    public Content {
        text = text == null ? "" : text;
        definitions = definitions == null ? List.of() : List.copyOf(definitions);
        references = references == null ? List.of() : List.copyOf(references);
    }

    public static Content of(String text) {
        return new Content(text, List.of(), List.of());
    }

    public boolean isEmpty() {
        return text.isEmpty() && definitions.isEmpty() && references.isEmpty();
    }

    /**
     * Возвращает копию с добавленной ссылкой; ссылки упорядочены по смещению.
     */
    public Content withReference(Reference reference) {
        List<Reference> updated = new ArrayList<>(references);
        updated.add(reference);
        updated.sort(Comparator.comparingInt(Reference::offset));
        return new Content(text, definitions, updated);
    }

    /**
     * Определение термина в тексте узла.
     */
    public record Definition(String term, int offset) {
    }

    /**
     * Ссылка из текста узла на термин, другую метку или внешний источник.
     */
    public record Reference(ReferenceType type, String target, int offset, String text) {
    }

    public enum ReferenceType {
        TERM("term"),
        INTERNAL("internal"),
        EXTERNAL("external");

        private final String jsonName;

        ReferenceType(String jsonName) {
            this.jsonName = jsonName;
        }

        public String jsonName() {
            return jsonName;
        }

        public static ReferenceType fromJson(String name) {
            for (ReferenceType type : values()) {
                if (type.jsonName.equals(name)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown reference type: " + name);
        }
    }
}
