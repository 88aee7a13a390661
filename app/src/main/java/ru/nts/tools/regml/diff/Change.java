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
package ru.nts.tools.regml.diff;

/**
 * Одно структурное изменение между версиями.
 *
 * @param kind          вид изменения
 * @param label         метка в новой версии (для удаленного узла - в старой)
 * @param previousLabel метка в старой версии; {@code null} для добавленного узла
 * @param before        снимок в старой версии; {@code null} для добавленного узла
 * @param after         снимок в новой версии; {@code null} для удаленного узла
 */
public record Change(ChangeKind kind, String label, String previousLabel, Snapshot before, Snapshot after) {

    public static Change added(Snapshot after) {
        return new Change(ChangeKind.ADDED, after.label(), null, null, after);
    }

    public static Change removed(Snapshot before) {
        return new Change(ChangeKind.REMOVED, before.label(), before.label(), before, null);
    }

    public static Change modified(Snapshot before, Snapshot after) {
        return new Change(ChangeKind.MODIFIED, after.label(), before.label(), before, after);
    }

    public static Change moved(Snapshot before, Snapshot after) {
        return new Change(ChangeKind.MOVED, after.label(), before.label(), before, after);
    }

    /**
     * То же изменение, увиденное в обратном направлении.
     */
    public Change inverse() {
        return switch (kind) {
            case ADDED -> removed(after);
            case REMOVED -> added(before);
            case MODIFIED -> modified(after, before);
            case MOVED -> moved(after, before);
        };
    }

    @Override
    public String toString() {
        if (previousLabel != null && !previousLabel.equals(label)) {
            return kind.jsonName() + " " + previousLabel + " -> " + label;
        }
        return kind.jsonName() + " " + label;
    }
}
