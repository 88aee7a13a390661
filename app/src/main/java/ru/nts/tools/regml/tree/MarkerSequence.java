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

/**
 * Порядковые последовательности маркеров.
 * Буквы после {@code z} удваиваются: {@code aa, bb, ...}, как в исходных регуляциях.
 */
public enum MarkerSequence {

    ARABIC {
        @Override
        public String marker(int ordinal) {
            checkOrdinal(ordinal);
            return Integer.toString(ordinal);
        }
    },

    LOWER_ALPHA {
        @Override
        public String marker(int ordinal) {
            return alpha(ordinal, 'a');
        }
    },

    UPPER_ALPHA {
        @Override
        public String marker(int ordinal) {
            return alpha(ordinal, 'A');
        }
    },

    LOWER_ROMAN {
        @Override
        public String marker(int ordinal) {
            checkOrdinal(ordinal);
            StringBuilder sb = new StringBuilder();
            int rest = ordinal;
            for (int i = 0; i < ROMAN_VALUES.length; i++) {
                while (rest >= ROMAN_VALUES[i]) {
                    sb.append(ROMAN_SYMBOLS[i]);
                    rest -= ROMAN_VALUES[i];
                }
            }
            return sb.toString();
        }
    };

    private static final int[] ROMAN_VALUES = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
    private static final String[] ROMAN_SYMBOLS = {"m", "cm", "d", "cd", "c", "xc", "l", "xl", "x", "ix", "v", "iv", "i"};

    /**
     * Маркер для порядковой позиции (нумерация с 1).
     */
    public abstract String marker(int ordinal);

    private static String alpha(int ordinal, char base) {
        checkOrdinal(ordinal);
        char letter = (char) (base + (ordinal - 1) % 26);
        int repeat = (ordinal - 1) / 26 + 1;
        return String.valueOf(letter).repeat(repeat);
    }

    private static void checkOrdinal(int ordinal) {
        if (ordinal < 1) {
            throw new IllegalArgumentException("Ordinal must be positive: " + ordinal);
        }
    }
}
