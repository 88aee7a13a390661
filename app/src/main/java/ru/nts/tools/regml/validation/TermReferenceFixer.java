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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.regml.tree.Content.Reference;
import ru.nts.tools.regml.tree.DocumentTree;
import ru.nts.tools.regml.tree.NodeId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Добавляет ссылки на термины по решениям {@link TermFixPolicy}.
 * Версия дерева не меняется: правка касается только содержимого узлов.
 */
public final class TermReferenceFixer {

    private static final Logger log = LoggerFactory.getLogger(TermReferenceFixer.class);

    /**
     * @param tree    исправленное дерево
     * @param applied число добавленных ссылок
     * @param skipped число отклоненных кандидатов
     */
    public record FixResult(DocumentTree tree, int applied, int skipped) {
    }

    public FixResult apply(DocumentTree tree, List<TermCandidate> candidates, TermFixPolicy policy) {
        Map<String, TermFixPolicy.Decision> remembered = new HashMap<>();
        Map<String, List<Reference>> accepted = new LinkedHashMap<>();
        int skipped = 0;

        for (TermCandidate candidate : candidates) {
            TermFixPolicy.Decision decision = remembered.get(candidate.term());
            if (decision == null) {
                decision = policy.decide(candidate);
                if (decision == TermFixPolicy.Decision.ALWAYS || decision == TermFixPolicy.Decision.NEVER) {
                    remembered.put(candidate.term(), decision);
                }
            }
            if (decision == TermFixPolicy.Decision.APPLY || decision == TermFixPolicy.Decision.ALWAYS) {
                accepted.computeIfAbsent(candidate.occurrenceLabel(), k -> new ArrayList<>())
                        .add(candidate.suggestedEdit());
            } else {
                skipped++;
            }
        }

        DocumentTree result = tree;
        int applied = 0;
        for (Map.Entry<String, List<Reference>> entry : accepted.entrySet()) {
            NodeId id = tree.index().resolve(entry.getKey());
            List<Reference> refs = entry.getValue();
            result = result.withNodeReplaced(id, node -> {
                var content = node.content();
                for (Reference ref : refs) {
                    content = content.withReference(ref);
                }
                return node.withContent(content);
            });
            applied += refs.size();
        }
        log.info("Term references: {} added, {} skipped", applied, skipped);
        return new FixResult(result, applied, skipped);
    }
}
