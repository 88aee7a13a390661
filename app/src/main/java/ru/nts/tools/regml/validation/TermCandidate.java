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

import ru.nts.tools.regml.tree.Content.Reference;

/**
 * Вхождение определенного термина, не оформленное ссылкой.
 *
 * @param term            термин в форме определения
 * @param definedIn       метка узла с определением
 * @param occurrenceLabel метка узла с вхождением
 * @param offset          позиция вхождения в тексте узла
 * @param text            найденный текст (может быть во множественном числе)
 * @param suggestedEdit   ссылка, которую предлагается добавить
 */
public record TermCandidate(String term, String definedIn, String occurrenceLabel, int offset, String text,
                            Reference suggestedEdit) {
}
