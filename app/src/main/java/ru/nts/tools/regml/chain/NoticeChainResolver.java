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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.regml.core.RegmlChainException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Строит цепочку версий части по набору уведомлений.
 *
 * <p>Уведомления сортируются по дате вступления в силу, при равенстве - по номеру документа.
 * Если базовая версия сама является номером одного из уведомлений, цепочка начинается
 * сразу после него. Каждое следующее уведомление обязано применяться к версии,
 * полученной на предыдущем шаге.
 */
public final class NoticeChainResolver {

    private static final Logger log = LoggerFactory.getLogger(NoticeChainResolver.class);

    public VersionChain resolve(String part, String baselineVersion, Collection<NoticeListing> notices) {
        return resolve(part, baselineVersion, notices, null);
    }

    /**
     * Цепочка до уведомления {@code through} включительно ({@code null} - до конца).
     *
     * @throws RegmlChainException CHAIN_BROKEN при разрыве, UNKNOWN_NOTICE если {@code through} не найден
     */
    public VersionChain resolve(String part, String baselineVersion, Collection<NoticeListing> notices,
                                String through) {
        List<NoticeListing> sorted = new ArrayList<>(notices);
        sorted.sort(NoticeListing.CHRONOLOGICAL);

        int start = 0;
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).documentNumber().equals(baselineVersion)) {
                start = i + 1;
            }
        }
        int end = sorted.size();
        if (through != null) {
            end = -1;
            for (int i = 0; i < sorted.size(); i++) {
                if (sorted.get(i).documentNumber().equals(through)) {
                    end = i + 1;
                }
            }
            if (end < 0) {
                throw RegmlChainException.unknownNotice(through, part);
            }
            if (end <= start) {
                log.warn("Notice {} precedes baseline {} of part {}; nothing to apply", through, baselineVersion,
                        part);
                return new VersionChain(part, baselineVersion, List.of());
            }
        }

        List<NoticeListing> links = new ArrayList<>(end - start);
        String expected = baselineVersion;
        for (NoticeListing listing : sorted.subList(start, end)) {
            if (!listing.appliesToVersion().equals(expected)) {
                throw RegmlChainException.broken(expected, listing.documentNumber(), listing.appliesToVersion());
            }
            links.add(listing);
            expected = listing.documentNumber();
        }
        log.debug("Resolved chain for part {}: {} -> {} ({} notices)", part, baselineVersion, expected, links.size());
        return new VersionChain(part, baselineVersion, links);
    }

    /**
     * Нарушенные связи между соседними уведомлениями, без исключения (для листинга версий).
     */
    public List<String> inspect(Collection<NoticeListing> notices) {
        List<NoticeListing> sorted = new ArrayList<>(notices);
        sorted.sort(NoticeListing.CHRONOLOGICAL);
        List<String> warnings = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            NoticeListing previous = sorted.get(i - 1);
            NoticeListing listing = sorted.get(i);
            if (!listing.appliesToVersion().equals(previous.documentNumber())) {
                warnings.add(listing.documentNumber() + " applies to " + listing.appliesToVersion()
                        + ", but the preceding version is " + previous.documentNumber());
            }
        }
        return warnings;
    }
}
