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
import ru.nts.tools.regml.changes.ChangesetApplier;
import ru.nts.tools.regml.changes.Notice;
import ru.nts.tools.regml.tree.DocumentTree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Упорядоченная цепочка уведомлений от базовой версии.
 * Версия, получаемая после звена, равна номеру документа уведомления.
 * Строится заново при каждом разрешении и не изменяется.
 */
public record VersionChain(String part, String baselineVersion, List<NoticeListing> links) {

    private static final Logger log = LoggerFactory.getLogger(VersionChain.class);

    public VersionChain {
        links = List.copyOf(links);
    }

    public boolean isEmpty() {
        return links.isEmpty();
    }

    /**
     * Версия после последнего звена (базовая для пустой цепочки).
     */
    public String finalVersion() {
        return links.isEmpty() ? baselineVersion : links.get(links.size() - 1).documentNumber();
    }

    public List<String> versions() {
        List<String> versions = new ArrayList<>(links.size() + 1);
        versions.add(baselineVersion);
        for (NoticeListing link : links) {
            versions.add(link.documentNumber());
        }
        return versions;
    }

    /**
     * Последовательно применяет звенья к базовой версии.
     *
     * @return базовая версия и все полученные версии по порядку
     */
    public List<DocumentTree> materialize(DocumentTree baseline, ChangesetApplier applier,
                                         Function<NoticeListing, Notice> loader) {
        List<DocumentTree> versions = new ArrayList<>();
        materialize(baseline, applier, loader, StepVerifier.NONE, versions::add);
        return versions;
    }

    /**
     * Последовательная свертка цепочки. Каждая версия передается в {@code sink} сразу
     * после получения, поэтому при ошибке на шаге k потребитель уже получил шаги до k.
     * Ошибка шага прерывает свертку.
     */
    public void materialize(DocumentTree baseline, ChangesetApplier applier, Function<NoticeListing, Notice> loader,
                            StepVerifier verifier, Consumer<DocumentTree> sink) {
        DocumentTree current = baseline;
        sink.accept(current);
        for (NoticeListing link : links) {
            Notice notice = loader.apply(link);
            DocumentTree next = applier.apply(current, notice).tree();
            verifier.verify(next, notice);
            log.info("Part {}: {} -> {}", part, current.version(), next.version());
            sink.accept(next);
            current = next;
        }
    }
}
