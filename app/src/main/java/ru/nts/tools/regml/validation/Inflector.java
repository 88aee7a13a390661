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

import java.util.Locale;
import java.util.Set;

/**
 * Упрощенное склонение английских существительных по числу.
 * Слова из списка исключений (настройка {@code regml.singular.exceptions}) не изменяются.
 */
final class Inflector {

    private final Set<String> exceptions;

    Inflector(Set<String> exceptions) {
        this.exceptions = exceptions;
    }

    String singular(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (exceptions.contains(lower) || lower.length() < 3) {
            return lower;
        }
        if (lower.endsWith("ies")) {
            return lower.substring(0, lower.length() - 3) + "y";
        }
        if (lower.endsWith("sses") || lower.endsWith("ches") || lower.endsWith("shes")
                || lower.endsWith("xes") || lower.endsWith("zes")) {
            return lower.substring(0, lower.length() - 2);
        }
        if (lower.endsWith("s") && !lower.endsWith("ss") && !lower.endsWith("us") && !lower.endsWith("is")) {
            return lower.substring(0, lower.length() - 1);
        }
        return lower;
    }

    String plural(String word) {
        String lower = word.toLowerCase(Locale.ROOT);
        if (exceptions.contains(lower)) {
            return lower;
        }
        if (lower.endsWith("y") && lower.length() > 1 && "aeiou".indexOf(lower.charAt(lower.length() - 2)) < 0) {
            return lower.substring(0, lower.length() - 1) + "ies";
        }
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")
                || lower.endsWith("ch") || lower.endsWith("sh")) {
            return lower + "es";
        }
        return lower + "s";
    }
}
