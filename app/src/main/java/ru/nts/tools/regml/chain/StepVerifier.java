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
package ru.nts.tools.regml.chain;

import ru.nts.tools.regml.changes.Notice;
import ru.nts.tools.regml.diff.VersionDiffer;
import ru.nts.tools.regml.tree.DocumentTree;

import java.util.Optional;
import java.util.function.Function;

/**
 * Проверка шага цепочки: сравнение результата применения уведомления с ожидаемой версией.
 */
@FunctionalInterface
public interface StepVerifier {

    StepVerifier NONE = (produced, notice) -> {
    };

    /**
     * @throws ru.nts.tools.regml.core.RegmlChainException VERIFICATION_FAILED при расхождении
     */
    void verify(DocumentTree produced, Notice notice);

    /**
     * Сверка с независимо загруженной версией, если она доступна.
     * Без ожидаемой версии шаг принимается.
     */
    static StepVerifier against(VersionDiffer differ, Function<String, Optional<DocumentTree>> expected) {
        return (produced, notice) -> expected.apply(produced.version())
                .ifPresent(tree -> differ.verify(produced, tree, notice.documentNumber()));
    }
}
