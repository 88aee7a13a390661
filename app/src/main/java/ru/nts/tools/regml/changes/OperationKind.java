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
package ru.nts.tools.regml.changes;

/**
 * Вид структурной правки.
 */
public enum OperationKind {

    INSERT("insert"),
    REPLACE("replace"),
    DELETE("delete"),
    MOVE("move"),
    DESIGNATE_RESERVED("designate-reserved");

    private final String jsonName;

    OperationKind(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    public boolean requiresPayload() {
        return this == INSERT || this == REPLACE;
    }

    public boolean requiresPosition() {
        return this == INSERT || this == MOVE;
    }

    /**
     * Удаляет или полностью переписывает поддерево цели.
     */
    public boolean discardsSubtree() {
        return this == DELETE || this == REPLACE || this == DESIGNATE_RESERVED;
    }

    public static OperationKind fromJson(String name) {
        for (OperationKind kind : values()) {
            if (kind.jsonName.equals(name)) {
                return kind;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return jsonName;
    }
}
