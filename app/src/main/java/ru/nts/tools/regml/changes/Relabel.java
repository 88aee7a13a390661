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

import ru.nts.tools.regml.tree.NodeId;

/**
 * Запись журнала перенумерации: метка узла до и после применения уведомления.
 * {@code before == null} для добавленного узла, {@code after == null} для удаленного.
 */
public record Relabel(NodeId id, String before, String after) {

    public boolean isAdded() {
        return before == null;
    }

    public boolean isRemoved() {
        return after == null;
    }

    @Override
    public String toString() {
        return (before != null ? before : "(new)") + " -> " + (after != null ? after : "(removed)");
    }
}
