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
import ru.nts.tools.regml.tree.Content;
import ru.nts.tools.regml.tree.Content.Definition;
import ru.nts.tools.regml.tree.Content.Reference;
import ru.nts.tools.regml.tree.Content.ReferenceType;
import ru.nts.tools.regml.tree.DocumentTree;
import ru.nts.tools.regml.tree.Node;
import ru.nts.tools.regml.tree.NodeKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Поиск вхождений определенных терминов, которые не оформлены ссылками.
 *
 * <p>Чистая функция: дерево не изменяется, результат - список кандидатов.
 * Ищутся вхождения по границам слов, без учета регистра, включая простое
 * множественное число. Пропускаются:
 * <ul>
 *     <li>места, уже покрытые ссылкой;</li>
 *     <li>само определение термина;</li>
 *     <li>части более длинного найденного термина.</li>
 * </ul>
 */
public final class TermScanner {

    private static final Logger log = LoggerFactory.getLogger(TermScanner.class);

    private final Inflector inflector;

    public TermScanner(Set<String> singularExceptions) {
        this.inflector = new Inflector(singularExceptions);
    }

    public List<TermCandidate> scan(DocumentTree tree) {
        return scan(tree, null, null);
    }

    /**
     * @param labelFilter только узлы с этой меткой или внутри нее ({@code null} - все)
     * @param termFilter  только этот термин ({@code null} - все)
     */
    public List<TermCandidate> scan(DocumentTree tree, String labelFilter, String termFilter) {
        Map<String, String> terms = definedTerms(tree);
        if (termFilter != null) {
            String key = inflector.singular(termFilter);
            terms.keySet().retainAll(Set.of(key));
        }
        // Длинные термины первыми, чтобы "escrow account" не дробился на "account"
        List<String> ordered = new ArrayList<>(terms.keySet());
        ordered.sort(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));

        List<TermCandidate> candidates = new ArrayList<>();
        for (Node node : tree.nodes()) {
            if (node.kind() != NodeKind.PARAGRAPH && node.kind() != NodeKind.INTERP_PARAGRAPH) {
                continue;
            }
            String label = tree.labelOf(node);
            if (labelFilter != null && !label.equals(labelFilter) && !label.startsWith(labelFilter + "-")) {
                continue;
            }
            scanNode(node.content(), label, ordered, terms, candidates);
        }
        log.debug("Found {} unreferenced term occurrences", candidates.size());
        return candidates;
    }

    private void scanNode(Content content, String label, List<String> ordered, Map<String, String> terms,
                          List<TermCandidate> out) {
        String text = content.text();
        List<int[]> taken = new ArrayList<>();
        for (Reference ref : content.references()) {
            int length = ref.text() != null ? ref.text().length() : 0;
            taken.add(new int[]{ref.offset(), ref.offset() + Math.max(length, 1)});
        }
        for (Definition def : content.definitions()) {
            taken.add(new int[]{def.offset(), def.offset() + def.term().length()});
        }

        List<TermCandidate> found = new ArrayList<>();
        for (String term : ordered) {
            String definedIn = terms.get(term);
            String plural = inflector.plural(term);
            Pattern pattern = Pattern.compile("\\b(" + Pattern.quote(plural) + "|" + Pattern.quote(term) + ")\\b",
                    Pattern.CASE_INSENSITIVE);
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                int start = matcher.start();
                int end = matcher.end();
                if (overlaps(taken, start, end)) {
                    continue;
                }
                taken.add(new int[]{start, end});
                String matched = matcher.group();
                found.add(new TermCandidate(term, definedIn, label, start, matched,
                        new Reference(ReferenceType.TERM, definedIn, start, matched)));
            }
        }
        found.sort(Comparator.comparingInt(TermCandidate::offset));
        out.addAll(found);
    }

    private static boolean overlaps(List<int[]> spans, int start, int end) {
        for (int[] span : spans) {
            if (start < span[1] && span[0] < end) {
                return true;
            }
        }
        return false;
    }

    /**
     * Термин (нижний регистр, единственное число) - метка первого определения.
     */
    private Map<String, String> definedTerms(DocumentTree tree) {
        Map<String, String> terms = new LinkedHashMap<>();
        for (Node node : tree.nodes()) {
            for (Definition def : node.content().definitions()) {
                terms.putIfAbsent(inflector.singular(def.term()), tree.labelOf(node));
            }
        }
        return terms;
    }
}
