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

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Упорядоченный список изменений от версии {@code fromVersion} к {@code toVersion}.
 * Сначала удаленные узлы в порядке старой версии, затем остальные в порядке новой.
 */
public record TreeDiff(String fromVersion, String toVersion, List<Change> changes) {

    public TreeDiff {
        changes = List.copyOf(changes);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    public List<Change> ofKind(ChangeKind kind) {
        return changes.stream().filter(c -> c.kind() == kind).toList();
    }

    /**
     * Метки изменений заданного вида, отсортированные.
     */
    public Set<String> labels(ChangeKind kind) {
        Set<String> labels = new TreeSet<>();
        for (Change change : changes) {
            if (change.kind() == kind) {
                labels.add(change.label());
            }
        }
        return labels;
    }

    /**
     * Обратный diff: добавленное становится удаленным и наоборот, снимки меняются местами.
     */
    public TreeDiff inverse() {
        List<Change> inverted = new ArrayList<>(changes.size());
        for (Change change : changes) {
            inverted.add(change.inverse());
        }
        return new TreeDiff(toVersion, fromVersion, inverted);
    }
}
