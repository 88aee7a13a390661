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

import java.util.concurrent.atomic.AtomicLong;

/**
 * Непрозрачная идентичность узла.
 * Сохраняется между версиями, пока узел логически тот же (copy-on-write пересборка
 * предков не меняет их идентичность). Узлы, загруженные из разных файлов,
 * никогда не разделяют идентичность.
 */
public record NodeId(long value) implements Comparable<NodeId> {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    /**
     * Выдает новую уникальную в пределах процесса идентичность.
     */
    public static NodeId next() {
        return new NodeId(SEQUENCE.incrementAndGet());
    }

    @Override
    public int compareTo(NodeId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
