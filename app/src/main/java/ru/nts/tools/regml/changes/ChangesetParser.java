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
package ru.nts.tools.regml.changes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.regml.core.RegmlChangeException;
import ru.nts.tools.regml.tree.LabelIndex;
import ru.nts.tools.regml.tree.NodeId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Проверяет и упорядочивает операции уведомления.
 *
 * <p>Порядок исполнения - устойчивая топологическая сортировка авторского порядка
 * по зависимостям:
 * <ul>
 *     <li>операция, чья цель или якорь лежит внутри поддерева, которое удаляется,
 *         заменяется или резервируется другой операцией, выполняется раньше нее;</li>
 *     <li>вставка рядом с удаляемым узлом выполняется до удаления;</li>
 *     <li>резервирование узла выполняется до вставки или перемещения в этот слот.</li>
 * </ul>
 * При отсутствии зависимостей сохраняется авторский порядок.
 *
 * <p>Перемещение из поддерева или в поддерево, которое другая операция удаляет
 * или переписывает, не упорядочивается, а отвергается как структурный конфликт.
 */
public final class ChangesetParser {

    private static final Logger log = LoggerFactory.getLogger(ChangesetParser.class);

    /**
     * Проверка и упорядочивание без дерева: вложенность определяется по префиксу метки.
     */
    public List<Operation> parse(Notice notice) {
        return parse(notice, null);
    }

    /**
     * Проверка и упорядочивание относительно индекса входной версии.
     * Метки, отсутствующие в индексе, сравниваются по префиксу.
     */
    public List<Operation> parse(Notice notice, LabelIndex index) {
        validate(notice, index);
        Hierarchy hierarchy = new Hierarchy(index);
        List<Operation> operations = notice.operations();
        checkOverlaps(operations, hierarchy);
        List<Operation> ordered = order(operations, hierarchy);
        log.debug("Notice {}: {} operations ordered", notice.documentNumber(), ordered.size());
        return ordered;
    }

    /**
     * Проверка формы каждой операции и конфликтующих притязаний на одну цель.
     *
     * @throws RegmlChangeException MALFORMED_OPERATION или DUPLICATE_TARGET
     */
    public void validate(Notice notice) {
        validate(notice, null);
    }

    /**
     * То же, но места вставки сравниваются по индексу входной версии: {@code after 1003-1}
     * и {@code before 1003-2} указывают на один промежуток между соседями.
     */
    public void validate(Notice notice, LabelIndex index) {
        List<Operation> operations = notice.operations();
        for (Operation op : operations) {
            checkShape(op);
        }

        Map<String, Operation> targets = new HashMap<>();
        Map<String, Operation> insertionPoints = new HashMap<>();
        for (Operation op : operations) {
            if (op.kind() != OperationKind.INSERT) {
                Operation first = targets.putIfAbsent(op.targetLabel(), op);
                if (first != null) {
                    throw RegmlChangeException.duplicateTarget(first.index(), op.index(), op.kindName(),
                            op.targetLabel(), "target");
                }
            }
            if ((op.kind() == OperationKind.INSERT || op.kind() == OperationKind.MOVE)
                    && op.placement() != Placement.CHILD_OF) {
                Operation first = insertionPoints.putIfAbsent(insertionPoint(op, index), op);
                if (first != null) {
                    throw RegmlChangeException.duplicateTarget(first.index(), op.index(), op.kindName(),
                            op.anchorLabel(), op.placement().jsonName());
                }
            }
        }
    }

    // Родитель и номер промежутка среди его детей; зарезервированный якорь - сам слот
    private static String insertionPoint(Operation op, LabelIndex index) {
        Optional<LabelIndex.Entry> anchor = index != null ? index.entry(op.anchorLabel()) : Optional.empty();
        if (anchor.isEmpty() || anchor.get().parent() == null) {
            return op.placement().jsonName() + " " + op.anchorLabel();
        }
        LabelIndex.Entry entry = anchor.get();
        if (entry.node().isReserved()) {
            return "slot " + entry.id();
        }
        int gap = entry.position() + (op.placement() == Placement.AFTER ? 1 : 0);
        return entry.parent() + "@" + gap;
    }

    /**
     * Листинг уведомления: заголовок и операции в авторском порядке.
     */
    public List<String> describe(Notice notice) {
        List<String> lines = new ArrayList<>();
        lines.add("Notice " + notice.documentNumber() + " (effective " + notice.effectiveDate()
                + ", applies to " + notice.appliesToVersion() + "): "
                + notice.operations().size() + " operations");
        for (Operation op : notice.operations()) {
            lines.add("  " + op.describe());
        }
        return lines;
    }

    private static void checkShape(Operation op) {
        int i = op.index();
        if (op.kind() == null) {
            throw RegmlChangeException.malformed(i, "?", "kind");
        }
        String kind = op.kindName();
        if (op.targetLabel() == null || op.targetLabel().isBlank()) {
            throw RegmlChangeException.malformed(i, kind, "targetLabel");
        }
        if (op.kind().requiresPosition()) {
            if (op.position() == null) {
                throw RegmlChangeException.malformed(i, kind, "position");
            }
            if (op.position().placement() == null) {
                throw RegmlChangeException.malformed(i, kind, "position.placement");
            }
            if (op.kind() == OperationKind.MOVE && !op.position().hasAnchor()) {
                throw RegmlChangeException.malformed(i, kind, "position.anchor");
            }
        } else if (op.position() != null) {
            throw RegmlChangeException.malformed(i, kind, "position");
        }
        if (op.kind().requiresPayload() != (op.payload() != null)) {
            throw RegmlChangeException.malformed(i, kind, "payload");
        }
    }

    private static void checkOverlaps(List<Operation> operations, Hierarchy hierarchy) {
        checkInsertsIntoRewritten(operations, hierarchy);
        for (Operation move : operations) {
            if (move.kind() != OperationKind.MOVE) {
                continue;
            }
            for (Operation other : operations) {
                if (other == move || !other.kind().discardsSubtree()) {
                    continue;
                }
                String scope = other.targetLabel();
                if (hierarchy.isStrictDescendant(move.targetLabel(), scope)) {
                    throw RegmlChangeException.structuralConflict(move.index(), move.kindName(), move.targetLabel(),
                            "source lies inside " + scope + ", which operation #" + other.index()
                                    + " (" + other.kindName() + ") discards");
                }
                String anchor = move.anchorLabel();
                boolean destinationInside = move.placement() == Placement.CHILD_OF
                        ? anchor.equals(scope) || hierarchy.isStrictDescendant(anchor, scope)
                        : hierarchy.isStrictDescendant(anchor, scope);
                if (destinationInside) {
                    throw RegmlChangeException.structuralConflict(move.index(), move.kindName(), move.targetLabel(),
                            "destination " + anchor + " lies inside " + scope + ", which operation #"
                                    + other.index() + " (" + other.kindName() + ") discards");
                }
            }
        }
    }

    /**
     * Вставка внутрь поддерева, которое другая операция заменяет или резервирует, потерялась бы
     * вместе с поддеревом. Вставка внутрь удаляемого поддерева допустима: удаление идет позже
     * и уносит вставленный узел вместе со своим поддеревом.
     */
    private static void checkInsertsIntoRewritten(List<Operation> operations, Hierarchy hierarchy) {
        for (Operation insert : operations) {
            if (insert.kind() != OperationKind.INSERT) {
                continue;
            }
            String anchor = insert.anchorLabel();
            for (Operation other : operations) {
                if (other.kind() != OperationKind.REPLACE && other.kind() != OperationKind.DESIGNATE_RESERVED) {
                    continue;
                }
                String scope = other.targetLabel();
                boolean inside = insert.placement() == Placement.CHILD_OF
                        ? anchor.equals(scope) || hierarchy.isStrictDescendant(anchor, scope)
                        : hierarchy.isStrictDescendant(anchor, scope);
                if (inside) {
                    throw RegmlChangeException.structuralConflict(insert.index(), insert.kindName(),
                            insert.targetLabel(), "insertion point " + insert.placement().jsonName() + " " + anchor
                                    + " lies inside " + scope + ", which operation #" + other.index()
                                    + " (" + other.kindName() + ") rewrites");
                }
            }
        }
    }

    private static List<Operation> order(List<Operation> operations, Hierarchy hierarchy) {
        int n = operations.size();
        List<List<Integer>> successors = new ArrayList<>(n);
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++) {
            successors.add(new ArrayList<>());
        }
        for (int u = 0; u < n; u++) {
            for (int v = 0; v < n; v++) {
                if (u != v && mustPrecede(operations.get(u), operations.get(v), hierarchy)) {
                    successors.get(u).add(v);
                    inDegree[v]++;
                }
            }
        }

        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        List<Operation> ordered = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int u = ready.poll();
            ordered.add(operations.get(u));
            for (int v : successors.get(u)) {
                if (--inDegree[v] == 0) {
                    ready.add(v);
                }
            }
        }
        if (ordered.size() < n) {
            for (int i = 0; i < n; i++) {
                if (inDegree[i] > 0) {
                    Operation op = operations.get(i);
                    throw RegmlChangeException.structuralConflict(op.index(), op.kindName(), op.targetLabel(),
                            "operations depend on each other in a cycle");
                }
            }
        }
        return ordered;
    }

    // u должна выполняться раньше v
    private static boolean mustPrecede(Operation u, Operation v, Hierarchy hierarchy) {
        if (v.kind().discardsSubtree()) {
            String scope = v.targetLabel();
            if (hierarchy.isStrictDescendant(u.targetLabel(), scope)) {
                return true;
            }
            String anchor = u.anchorLabel();
            if (anchor != null) {
                if (hierarchy.isStrictDescendant(anchor, scope)) {
                    return true;
                }
                if (anchor.equals(scope) && u.kind() != OperationKind.REPLACE) {
                    if (u.placement() == Placement.CHILD_OF) {
                        return true;
                    }
                    if (v.kind() == OperationKind.DELETE) {
                        return true;
                    }
                }
            }
        }
        // Резервирование слота раньше его заполнения
        return u.kind() == OperationKind.DESIGNATE_RESERVED
                && (v.kind() == OperationKind.INSERT || v.kind() == OperationKind.MOVE)
                && v.placement() != Placement.CHILD_OF
                && u.targetLabel().equals(v.anchorLabel());
    }

    /**
     * Отношение вложенности меток: по индексу, если обе метки в нем есть, иначе по префиксу.
     */
    private static final class Hierarchy {
        private final LabelIndex index;

        Hierarchy(LabelIndex index) {
            this.index = index;
        }

        boolean isStrictDescendant(String label, String ancestor) {
            if (label == null || ancestor == null) {
                return false;
            }
            if (index != null) {
                Optional<NodeId> node = index.find(label);
                Optional<NodeId> scope = index.find(ancestor);
                if (node.isPresent() && scope.isPresent()) {
                    return index.isAncestor(scope.get(), node.get());
                }
            }
            return label.startsWith(ancestor + LabelIndex.SEPARATOR);
        }
    }
}
