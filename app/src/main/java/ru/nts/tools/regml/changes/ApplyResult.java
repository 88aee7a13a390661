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

import ru.nts.tools.regml.tree.DocumentTree;

import java.util.List;

/**
 * Результат применения уведомления: новое дерево и журнал перенумерации.
 * Журнал содержит только узлы, чья метка изменилась, появилась или исчезла.
 */
public record ApplyResult(DocumentTree tree, List<Relabel> relabels) {

    public ApplyResult {
        relabels = List.copyOf(relabels);
    }
}
