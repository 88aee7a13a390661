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

import java.time.LocalDate;
import java.util.Comparator;

/**
 * Запись списка уведомлений части: номер документа, дата вступления в силу
 * и версия, к которой уведомление применяется.
 */
public record NoticeListing(String documentNumber, LocalDate effectiveDate, String appliesToVersion) {

    /**
     * Хронологический порядок: дата вступления в силу, затем номер документа.
     */
    public static final Comparator<NoticeListing> CHRONOLOGICAL = Comparator
            .comparing(NoticeListing::effectiveDate, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(NoticeListing::documentNumber);

    public static NoticeListing from(Notice notice) {
        return new NoticeListing(notice.documentNumber(), notice.effectiveDate(), notice.appliesToVersion());
    }

    @Override
    public String toString() {
        return documentNumber + " (" + effectiveDate + ", applies to " + appliesToVersion + ")";
    }
}
