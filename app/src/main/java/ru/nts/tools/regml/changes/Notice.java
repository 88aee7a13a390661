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

import java.time.LocalDate;
import java.util.List;

/**
 * Датированный набор правок, превращающий версию {@code appliesToVersion}
 * в версию {@code documentNumber}. Операции хранятся в авторском порядке.
 */
public record Notice(String documentNumber, LocalDate effectiveDate, String appliesToVersion,
                     List<Operation> operations) {

    public Notice {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
