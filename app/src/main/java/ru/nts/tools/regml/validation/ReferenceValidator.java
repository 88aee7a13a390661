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

import ru.nts.tools.regml.tree.Content.Definition;
import ru.nts.tools.regml.tree.Content.Reference;
import ru.nts.tools.regml.tree.Content.ReferenceType;
import ru.nts.tools.regml.tree.DocumentTree;
import ru.nts.tools.regml.tree.LabelIndex;
import ru.nts.tools.regml.tree.Node;
import ru.nts.tools.regml.tree.NodeId;
import ru.nts.tools.regml.tree.NodeKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Проверка ссылок внутри версии: внутренние цитаты, ссылки на термины, ключевые термины
 * абзацев и цели толкований. Каждая проверка завершается итоговой диагностикой
 * OK, WARNING или ERROR.
 */
public final class ReferenceValidator {

    /**
     * Атрибут абзаца: ключевой термин, который выводится курсивом перед текстом.
     */
    public static final String KEYTERM = "keyterm";

    /**
     * Атрибут толкования: метка толкуемого узла.
     */
    public static final String TARGET = "target";

    private final Inflector inflector;

    public ReferenceValidator(Set<String> singularExceptions) {
        this.inflector = new Inflector(singularExceptions);
    }

    /**
     * Каждая внутренняя ссылка должна указывать на существующую метку.
     */
    public List<Diagnostic> validateInternalCitations(DocumentTree tree) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Node node : tree.nodes()) {
            String label = tree.labelOf(node);
            for (Reference ref : node.content().references()) {
                if (ref.type() == ReferenceType.INTERNAL && !tree.index().contains(ref.target())) {
                    diagnostics.add(Diagnostic.error("NONEXISTENT CITATION: there is a reference to label "
                            + ref.target() + " in " + label + " but that label does not exist", label));
                }
            }
        }
        if (diagnostics.isEmpty()) {
            diagnostics.add(Diagnostic.ok("All internal references in the text point to existing labels."));
        } else {
            diagnostics.add(new Diagnostic(Severity.ERROR, "There were some problems with the internal citations. "
                    + "They can result in non-functioning links.", null));
        }
        return diagnostics;
    }

    /**
     * Каждая ссылка на термин должна вести к метке, где этот термин определен
     * (сравнение в единственном числе без учета регистра).
     */
    public List<Diagnostic> validateTerms(DocumentTree tree) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, String> definitions = new LinkedHashMap<>();
        for (Node node : tree.nodes()) {
            String label = tree.labelOf(node);
            for (Definition def : node.content().definitions()) {
                String term = inflector.singular(def.term());
                definitions.put(term + ":" + label, def.term());
                diagnostics.add(Diagnostic.info("TERM: \"" + def.term() + "\" defined in: " + label, label));
            }
        }

        boolean problems = false;
        for (Node node : tree.nodes()) {
            if (node.kind() != NodeKind.PARAGRAPH && node.kind() != NodeKind.INTERP_PARAGRAPH) {
                continue;
            }
            String label = tree.labelOf(node);
            for (Reference ref : node.content().references()) {
                if (ref.type() != ReferenceType.TERM) {
                    continue;
                }
                String term = inflector.singular(ref.text() != null ? ref.text() : "");
                String target = ref.target() != null ? ref.target() : "";
                if (!definitions.containsKey(term + ":" + target)) {
                    diagnostics.add(Diagnostic.warning("MISSING DEFINITION: in " + label + " the term \"" + term
                            + "\" was referenced; it is expected to be defined in " + target + " but is not.", label));
                    problems = true;
                }
            }
        }
        if (problems) {
            diagnostics.add(new Diagnostic(Severity.WARNING, "There were some problems with references to terms. "
                    + "They can result in the wrong text being highlighted or incorrect links.", null));
        } else {
            diagnostics.add(Diagnostic.ok("All term references in the text point to existent definitions."));
        }
        return diagnostics;
    }

    /**
     * Ключевой термин выводится перед текстом абзаца, поэтому текст не должен повторять его
     * в начале, а сам термин не должен быть пустым.
     */
    public List<Diagnostic> validateKeyterms(DocumentTree tree) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Node node : tree.nodes()) {
            if (node.kind() != NodeKind.PARAGRAPH && node.kind() != NodeKind.INTERP_PARAGRAPH) {
                continue;
            }
            String keyterm = node.attribute(KEYTERM);
            if (keyterm == null) {
                continue;
            }
            String label = tree.labelOf(node);
            String text = node.content().text().strip();
            if (keyterm.isBlank()) {
                diagnostics.add(Diagnostic.warning("EMPTY KEYTERM: paragraph " + label
                        + " declares a keyterm without text", label));
            } else if (text.regionMatches(true, 0, keyterm.strip(), 0, keyterm.strip().length())) {
                diagnostics.add(Diagnostic.warning("DUPLICATE KEYTERM: the keyterm \"" + keyterm.strip()
                        + "\" of " + label + " is repeated at the start of its text", label));
            }
        }
        if (diagnostics.isEmpty()) {
            diagnostics.add(Diagnostic.ok("All keyterms are distinct from their paragraph text."));
        } else {
            diagnostics.add(new Diagnostic(Severity.WARNING, "There were some problems with keyterms. "
                    + "They can result in a keyterm being displayed twice.", null));
        }
        return diagnostics;
    }

    /**
     * Цель каждого толкования должна существовать и не быть толкованием.
     *
     * @param label проверять только толкования с этой меткой и их потомков ({@code null} - все)
     */
    public List<Diagnostic> validateInterpTargets(DocumentTree tree, String label) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        boolean problems = false;
        for (Node node : tree.nodes()) {
            if (node.kind() != NodeKind.INTERPRETATION && node.kind() != NodeKind.INTERP_PARAGRAPH) {
                continue;
            }
            String interpLabel = tree.labelOf(node);
            if (label != null && !interpLabel.equals(label)
                    && !interpLabel.startsWith(label + LabelIndex.SEPARATOR)) {
                continue;
            }
            String target = node.attribute(TARGET);
            if (target == null) {
                continue;
            }
            Optional<NodeId> targetId = tree.index().find(target);
            if (targetId.isEmpty()) {
                diagnostics.add(Diagnostic.error("NONEXISTENT INTERP TARGET: " + interpLabel + " interprets "
                        + target + " but that label does not exist", interpLabel));
                problems = true;
                continue;
            }
            NodeKind targetKind = tree.index().nodeOf(targetId.get()).kind();
            if (targetKind == NodeKind.INTERPRETATION || targetKind == NodeKind.INTERP_PARAGRAPH) {
                diagnostics.add(Diagnostic.warning("INTERP TARGET IS AN INTERPRETATION: " + interpLabel
                        + " interprets " + target + ", which is itself an interpretation", interpLabel));
                problems = true;
            } else {
                diagnostics.add(Diagnostic.info("INTERP: " + interpLabel + " interprets " + target, interpLabel));
            }
        }
        if (!problems) {
            diagnostics.add(Diagnostic.ok("All interpretation targets point to existing labels."));
        } else {
            Severity worst = diagnostics.stream().anyMatch(d -> d.severity() == Severity.ERROR)
                    ? Severity.ERROR : Severity.WARNING;
            diagnostics.add(new Diagnostic(worst, "There were some problems with interpretation targets. "
                    + "They can result in interpretations attached to the wrong text.", null));
        }
        return diagnostics;
    }
}
