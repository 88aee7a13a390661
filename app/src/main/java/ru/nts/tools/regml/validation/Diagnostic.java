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
package ru.nts.tools.regml.validation;

import java.util.Collection;

/**
 * Результат одной проверки.
 *
 * @param location метка узла или путь JSON; {@code null} для итоговых сообщений
 */
public record Diagnostic(Severity severity, String message, String location) {

    public static Diagnostic ok(String message) {
        return new Diagnostic(Severity.OK, message, null);
    }

    public static Diagnostic info(String message, String location) {
        return new Diagnostic(Severity.INFO, message, location);
    }

    public static Diagnostic warning(String message, String location) {
        return new Diagnostic(Severity.WARNING, message, location);
    }

    public static Diagnostic error(String message, String location) {
        return new Diagnostic(Severity.ERROR, message, location);
    }

    /**
     * Нет ни одной диагностики уровня WARNING и выше.
     */
    public static boolean isValid(Collection<Diagnostic> diagnostics) {
        return diagnostics.stream().noneMatch(d -> d.severity().isProblem());
    }

    @Override
    public String toString() {
        return severity + ": " + message + (location != null ? " [" + location + "]" : "");
    }
}
