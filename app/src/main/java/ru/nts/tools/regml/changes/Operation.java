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

import ru.nts.tools.regml.tree.Node;

/**
 * Одна структурная правка уведомления в авторском виде.
 *
 * <p>Поля могут отсутствовать ({@code null}), пока операция не прошла
 * проверку {@link ChangesetParser}. После проверки:
 * <ul>
 *     <li>{@code insert} и {@code move} имеют {@code position};</li>
 *     <li>{@code insert} и {@code replace} имеют {@code payload} без меток;</li>
 *     <li>{@code move} имеет якорь назначения.</li>
 * </ul>
 *
 * @param index       индекс в авторском порядке (с 0)
 * @param kind        вид правки
 * @param targetLabel метка узла, над которым выполняется правка (для вставки - якорь по умолчанию)
 * @param position    размещение для insert/move
 * @param payload     поддерево для insert/replace
 */
public record Operation(int index, OperationKind kind, String targetLabel, Position position, Node payload) {

    public static Operation insert(int index, String targetLabel, Position position, Node payload) {
        return new Operation(index, OperationKind.INSERT, targetLabel, position, payload);
    }

    public static Operation replace(int index, String targetLabel, Node payload) {
        return new Operation(index, OperationKind.REPLACE, targetLabel, null, payload);
    }

    public static Operation delete(int index, String targetLabel) {
        return new Operation(index, OperationKind.DELETE, targetLabel, null, null);
    }

    public static Operation move(int index, String targetLabel, Position position) {
        return new Operation(index, OperationKind.MOVE, targetLabel, position, null);
    }

    public static Operation reserve(int index, String targetLabel) {
        return new Operation(index, OperationKind.DESIGNATE_RESERVED, targetLabel, null, null);
    }

    /**
     * Метка якоря размещения. Для вставки без явного якоря совпадает с целью.
     */
    public String anchorLabel() {
        if (position != null && position.hasAnchor()) {
            return position.anchor();
        }
        return kind == OperationKind.INSERT ? targetLabel : null;
    }

    public Placement placement() {
        return position != null ? position.placement() : null;
    }

    public String kindName() {
        return kind != null ? kind.jsonName() : "?";
    }

    /**
     * Краткое описание для листинга уведомления.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append('#').append(index).append(' ').append(kindName()).append(' ').append(targetLabel);
        if (kind == OperationKind.INSERT || kind == OperationKind.MOVE) {
            sb.append(' ').append(placement()).append(' ').append(anchorLabel());
        }
        if (payload != null) {
            sb.append(" [").append(payload.kind().jsonName());
            if (payload.marker() != null) {
                sb.append(' ').append(payload.marker());
            }
            int size = payload.subtreeSize();
            sb.append(", ").append(size).append(size == 1 ? " node]" : " nodes]");
        }
        return sb.toString();
    }
}
