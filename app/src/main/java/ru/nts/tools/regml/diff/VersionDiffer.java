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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.regml.core.RegmlChainException;
import ru.nts.tools.regml.tree.DocumentTree;
import ru.nts.tools.regml.tree.LabelIndex;
import ru.nts.tools.regml.tree.Node;
import ru.nts.tools.regml.tree.NodeId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Структурное сравнение двух версий одной регуляции.
 *
 * <p>Сопоставление узлов:
 * <ul>
 *     <li>если версии связаны copy-on-write (общий корень), узлы сопоставляются
 *         по идентичности;</li>
 *     <li>иначе (версии загружены из разных файлов) - по равенству меток.</li>
 * </ul>
 *
 * <p>Добавленные и удаленные узлы сообщаются только корнями поддеревьев.
 * Узел считается перемещенным, если у него сменился родитель, собственный маркер
 * или порядок относительно сопоставленных соседей. Смена метки только из-за
 * перенумерации предка перемещением не считается.
 */
public final class VersionDiffer {

    private static final Logger log = LoggerFactory.getLogger(VersionDiffer.class);

    public TreeDiff diff(DocumentTree a, DocumentTree b) {
        LabelIndex ia = a.index();
        LabelIndex ib = b.index();
        boolean byIdentity = a.root().id().equals(b.root().id());
        Map<NodeId, NodeId> toA = byIdentity ? matchByIdentity(ia, ib) : matchByLabel(ia, ib);
        Map<NodeId, NodeId> toB = new HashMap<>(toA.size() * 2);
        toA.forEach((idB, idA) -> toB.put(idA, idB));

        List<Change> changes = new ArrayList<>();
        for (Node node : a.nodes()) {
            if (toB.containsKey(node.id())) {
                continue;
            }
            NodeId parent = ia.parentOf(node.id());
            if (parent == null || toB.containsKey(parent)) {
                changes.add(Change.removed(Snapshot.deep(node, ia)));
            }
        }

        Set<NodeId> reordered = reordered(b, ia, toA);
        for (Node node : b.nodes()) {
            NodeId idA = toA.get(node.id());
            if (idA == null) {
                NodeId parent = ib.parentOf(node.id());
                if (parent == null || toA.containsKey(parent)) {
                    changes.add(Change.added(Snapshot.deep(node, ib)));
                }
                continue;
            }
            Node old = ia.nodeOf(idA);
            if (!old.sameOwnData(node)) {
                changes.add(Change.modified(Snapshot.shallow(old, ia), Snapshot.shallow(node, ib)));
            }
            NodeId parentB = ib.parentOf(node.id());
            NodeId parentA = ia.parentOf(idA);
            boolean moved = !Objects.equals(parentA, parentB == null ? null : toA.get(parentB))
                    || !Objects.equals(ia.markerOf(idA), ib.markerOf(node.id()))
                    || reordered.contains(node.id());
            if (moved) {
                changes.add(Change.moved(Snapshot.shallow(old, ia), Snapshot.shallow(node, ib)));
            }
        }

        log.debug("Diff {} -> {}: {} changes (matched by {})", a.version(), b.version(), changes.size(),
                byIdentity ? "identity" : "label");
        return new TreeDiff(a.version(), b.version(), changes);
    }

    /**
     * Проверяет, что результат применения уведомления совпадает с ожидаемой версией.
     *
     * @return пустой diff при совпадении
     * @throws RegmlChainException VERIFICATION_FAILED при любом расхождении
     */
    public TreeDiff verify(DocumentTree actual, DocumentTree expected, String notice) {
        TreeDiff diff = diff(actual, expected);
        if (!diff.isEmpty()) {
            log.warn("Verification of {} failed: {} differences, first {}", notice, diff.size(),
                    diff.changes().get(0));
            throw RegmlChainException.verificationFailed(notice, diff.size(), diff.changes().get(0).label());
        }
        return diff;
    }

    /**
     * N-1 попарных diff соседних версий. Сквозной diff не вычисляется.
     */
    public List<TreeDiff> diffAdjacent(List<DocumentTree> trees) {
        List<TreeDiff> diffs = new ArrayList<>();
        for (int i = 0; i + 1 < trees.size(); i++) {
            diffs.add(diff(trees.get(i), trees.get(i + 1)));
        }
        return diffs;
    }

    private static Map<NodeId, NodeId> matchByIdentity(LabelIndex ia, LabelIndex ib) {
        Map<NodeId, NodeId> toA = new HashMap<>();
        for (String label : ib.labels()) {
            NodeId id = ib.resolve(label);
            if (ia.contains(id)) {
                toA.put(id, id);
            }
        }
        return toA;
    }

    private static Map<NodeId, NodeId> matchByLabel(LabelIndex ia, LabelIndex ib) {
        Map<NodeId, NodeId> toA = new HashMap<>();
        for (String label : ib.labels()) {
            ia.find(label).ifPresent(idA -> toA.put(ib.resolve(label), idA));
        }
        return toA;
    }

    /**
     * Узлы новой версии, оставшиеся у того же родителя, но выпавшие из LCS порядка детей.
     */
    private static Set<NodeId> reordered(DocumentTree b, LabelIndex ia, Map<NodeId, NodeId> toA) {
        Set<NodeId> reordered = new HashSet<>();
        for (Node parentB : b.nodes()) {
            NodeId parentA = toA.get(parentB.id());
            if (parentA == null || parentB.children().size() < 2) {
                continue;
            }
            List<NodeId> orderB = new ArrayList<>();
            List<NodeId> idsB = new ArrayList<>();
            Set<NodeId> stayed = new HashSet<>();
            for (Node child : parentB.children()) {
                NodeId idA = toA.get(child.id());
                if (idA != null && parentA.equals(ia.parentOf(idA))) {
                    orderB.add(idA);
                    idsB.add(child.id());
                    stayed.add(idA);
                }
            }
            List<NodeId> orderA = new ArrayList<>();
            for (Node child : ia.nodeOf(parentA).children()) {
                if (stayed.contains(child.id())) {
                    orderA.add(child.id());
                }
            }
            Set<Integer> common = SequenceMatcher.commonIndices(orderA, orderB);
            for (int i = 0; i < idsB.size(); i++) {
                if (!common.contains(i)) {
                    reordered.add(idsB.get(i));
                }
            }
        }
        return reordered;
    }
}
