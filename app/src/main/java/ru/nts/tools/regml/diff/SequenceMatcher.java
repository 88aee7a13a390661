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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Наибольшая общая подпоследовательность двух списков (классическая LCS-матрица).
 * Используется для поиска детей, сменивших относительный порядок.
 */
public final class SequenceMatcher {

    private SequenceMatcher() {
    }

    /**
     * Индексы элементов {@code b}, входящих в одну из наибольших общих подпоследовательностей.
     */
    public static <T> Set<Integer> commonIndices(List<T> a, List<T> b) {
        int[][] matrix = computeLcsMatrix(a, b);
        Set<Integer> common = new HashSet<>();
        int i = a.size();
        int j = b.size();
        // Обратный проход по матрице, итеративно
        while (i > 0 && j > 0) {
            if (a.get(i - 1).equals(b.get(j - 1))) {
                common.add(j - 1);
                i--;
                j--;
            } else if (matrix[i][j - 1] >= matrix[i - 1][j]) {
                j--;
            } else {
                i--;
            }
        }
        return common;
    }

    private static <T> int[][] computeLcsMatrix(List<T> a, List<T> b) {
        int[][] matrix = new int[a.size() + 1][b.size() + 1];
        for (int i = 1; i <= a.size(); i++) {
            for (int j = 1; j <= b.size(); j++) {
                if (a.get(i - 1).equals(b.get(j - 1))) {
                    matrix[i][j] = matrix[i - 1][j - 1] + 1;
                } else {
                    matrix[i][j] = Math.max(matrix[i - 1][j], matrix[i][j - 1]);
                }
            }
        }
        return matrix;
    }
}
