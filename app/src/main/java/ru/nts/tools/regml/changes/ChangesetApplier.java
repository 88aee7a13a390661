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
import ru.nts.tools.regml.core.RegmlErrorCode;
import ru.nts.tools.regml.core.RegmlException;
import ru.nts.tools.regml.tree.DocumentTree;
import ru.nts.tools.regml.tree.LabelIndex;
import ru.nts.tools.regml.tree.Node;
import ru.nts.tools.regml.tree.NodeId;
import ru.nts.tools.regml.tree.NodeKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Применяет уведомление к версии регуляции и возвращает следующую версию.
 *
 * <p>Все метки операций разрешаются по индексу входной версии: метки не пересчитываются
 * между операциями одного прохода, поэтому автор уведомления ссылается на узлы так,
 * как они помечены в предыдущей версии. Индекс перестраивается ровно один раз в конце.
 *
 * <p>Применение атомарно: при любой ошибке исключение выбрасывается до создания
 * нового дерева, входное дерево не изменяется никогда.
 */
public final class ChangesetApplier {

    private static final Logger log = LoggerFactory.getLogger(ChangesetApplier.class);

    private final ChangesetParser parser;

    public ChangesetApplier() {
        this(new ChangesetParser());
    }

    public ChangesetApplier(ChangesetParser parser) {
        this.parser = parser;
    }

    /**
     * Применяет уведомление.
     *
     * @throws RegmlChangeException VERSION_MISMATCH, MALFORMED_OPERATION, DUPLICATE_TARGET,
     *                              UNRESOLVED_TARGET или STRUCTURAL_CONFLICT
     */
    public ApplyResult apply(DocumentTree tree, Notice notice) {
        if (!Objects.equals(notice.appliesToVersion(), tree.version())) {
            throw RegmlChangeException.versionMismatch(notice.documentNumber(), notice.appliesToVersion(),
                    tree.version());
        }
        List<Operation> ordered = parser.parse(notice, tree.index());
        log.info("Applying notice {} to {} CFR {} version {} ({} operations)", notice.documentNumber(),
                tree.title(), tree.part(), tree.version(), ordered.size());

        WorkingTree work = new WorkingTree(tree.root(), tree.index());
        Map<Operation, NodeId> placed = new HashMap<>();
        for (Operation op : ordered) {
            log.info("Applying operation '{}' to {}", op.kindName(), op.targetLabel());
            NodeId id = applyOne(work, tree, op);
            if (op.kind() == OperationKind.INSERT) {
                placed.put(op, id);
            }
        }

        DocumentTree result;
        try {
            result = DocumentTree.of(tree.title(), tree.part(), notice.documentNumber(), notice.effectiveDate(),
                    work.materialize());
        } catch (RegmlException e) {
            if (e.getCode() != RegmlErrorCode.DUPLICATE_LABEL) {
                throw e;
            }
            String label = String.valueOf(e.getContext().get("label"));
            Operation culprit = culpritOf(ordered, label);
            throw RegmlChangeException.structuralConflict(culprit.index(), culprit.kindName(), culprit.targetLabel(),
                    "the result would contain label " + label + " twice", e);
        }

        for (Map.Entry<Operation, NodeId> entry : placed.entrySet()) {
            Operation op = entry.getKey();
            if (!result.index().contains(entry.getValue())) {
                log.debug("Operation #{} inserted a node that a later delete removed", op.index());
                continue;
            }
            String actual = result.index().labelOf(entry.getValue());
            if (op.position().hasAnchor() && !actual.equals(op.targetLabel())) {
                log.warn("Operation #{} inserted {} but the notice names it {}", op.index(), actual,
                        op.targetLabel());
            }
        }

        List<Relabel> relabels = relabels(tree.index(), result.index());
        log.debug("Notice {} produced {} label changes", notice.documentNumber(), relabels.size());
        return new ApplyResult(result, relabels);
    }

    private NodeId applyOne(WorkingTree work, DocumentTree tree, Operation op) {
        return switch (op.kind()) {
            case INSERT -> insert(work, tree, op);
            case REPLACE -> replace(work, tree, op);
            case DELETE -> {
                NodeId id = resolveNonRoot(work, tree, op);
                work.remove(id);
                yield id;
            }
            case DESIGNATE_RESERVED -> {
                NodeId id = resolveNonRoot(work, tree, op);
                work.reserve(id);
                yield id;
            }
            case MOVE -> move(work, tree, op);
        };
    }

    private NodeId insert(WorkingTree work, DocumentTree tree, Operation op) {
        NodeId anchor = resolve(work, tree, op, op.anchorLabel(), "anchor");
        Node payload = op.payload();
        if (op.placement() == Placement.CHILD_OF) {
            checkParent(work, op, anchor, payload.kind());
            work.insert(anchor, work.children(anchor).size(), payload);
            return payload.id();
        }
        NodeId parent = siblingParent(work, op, anchor);
        checkParent(work, op, parent, payload.kind());
        Node anchorNode = work.node(anchor);
        if (anchorNode.isReserved() && anchorNode.kind() == payload.kind()) {
            log.debug("Operation #{} fills reserved slot {}", op.index(), op.anchorLabel());
            work.replace(anchor, keepNumber(payload, anchorNode).withId(anchor));
            return anchor;
        }
        int position = work.indexOf(parent, anchor) + (op.placement() == Placement.AFTER ? 1 : 0);
        work.insert(parent, position, payload);
        return payload.id();
    }

    private NodeId replace(WorkingTree work, DocumentTree tree, Operation op) {
        NodeId id = resolve(work, tree, op, op.targetLabel(), "target");
        Node payload = op.payload();
        NodeId parent = work.parent(id);
        if (parent == null) {
            if (payload.kind() != NodeKind.PART) {
                throw conflict(op, "the root can only be replaced by a part");
            }
        } else {
            checkParent(work, op, parent, payload.kind());
        }
        work.replace(id, keepNumber(payload, work.node(id)).withId(id));
        return id;
    }

    private NodeId move(WorkingTree work, DocumentTree tree, Operation op) {
        NodeId id = resolveNonRoot(work, tree, op);
        NodeId anchor = resolve(work, tree, op, op.anchorLabel(), "anchor");
        if (anchor.equals(id)) {
            throw conflict(op, "a node cannot be moved relative to itself");
        }
        NodeKind kind = work.node(id).kind();
        NodeId parent = op.placement() == Placement.CHILD_OF ? anchor : siblingParent(work, op, anchor);
        if (work.isWithin(parent, id)) {
            throw conflict(op, "destination " + op.anchorLabel() + " lies inside the moved subtree");
        }
        checkParent(work, op, parent, kind);

        work.detach(id);
        if (op.placement() == Placement.CHILD_OF) {
            work.attach(id, parent, work.children(parent).size());
            return id;
        }
        Node anchorNode = work.node(anchor);
        int position = work.indexOf(parent, anchor);
        if (anchorNode.isReserved() && anchorNode.kind() == kind) {
            log.debug("Operation #{} moves {} into reserved slot {}", op.index(), op.targetLabel(),
                    op.anchorLabel());
            work.remove(anchor);
            if (kind == NodeKind.SECTION) {
                work.remark(id, anchorNode.marker());
            }
        } else if (op.placement() == Placement.AFTER) {
            position++;
        }
        work.attach(id, parent, position);
        return id;
    }

    // Секция подраздела, занявшая место другой, наследует ее номер, если не несет своего
    private static Node keepNumber(Node payload, Node previous) {
        if (payload.kind() != NodeKind.SECTION || payload.marker() != null || previous.marker() == null) {
            return payload;
        }
        return payload.withMarker(previous.marker());
    }

    private NodeId resolve(WorkingTree work, DocumentTree tree, Operation op, String label, String role) {
        Optional<NodeId> id = tree.index().find(label);
        if (id.isEmpty()) {
            throw RegmlChangeException.unresolvedTarget(op.index(), op.kindName(), label, tree.version());
        }
        if (work.isRemoved(id.get())) {
            throw conflict(op, role + " " + label + " was removed by an earlier operation");
        }
        return id.get();
    }

    private NodeId resolveNonRoot(WorkingTree work, DocumentTree tree, Operation op) {
        NodeId id = resolve(work, tree, op, op.targetLabel(), "target");
        if (id.equals(work.rootId())) {
            throw conflict(op, "the root node cannot be " + (op.kind() == OperationKind.MOVE ? "moved" : "removed"));
        }
        return id;
    }

    private NodeId siblingParent(WorkingTree work, Operation op, NodeId anchor) {
        NodeId parent = work.parent(anchor);
        if (parent == null) {
            throw conflict(op, "the root node has no siblings");
        }
        return parent;
    }

    private void checkParent(WorkingTree work, Operation op, NodeId parent, NodeKind kind) {
        Node parentNode = work.node(parent);
        if (parentNode.isReserved()) {
            throw conflict(op, "a reserved node cannot receive children");
        }
        if (!parentNode.kind().allows(kind)) {
            throw conflict(op, "a " + kind.jsonName() + " cannot be placed under a " + parentNode.kind().jsonName());
        }
    }

    private static RegmlChangeException conflict(Operation op, String reason) {
        return RegmlChangeException.structuralConflict(op.index(), op.kindName(), op.targetLabel(), reason);
    }

    // Операция, которая вероятнее всего породила повторяющуюся метку
    private static Operation culpritOf(List<Operation> ordered, String label) {
        for (int i = ordered.size() - 1; i >= 0; i--) {
            Operation op = ordered.get(i);
            Node payload = op.payload();
            if (payload != null && payload.marker() != null
                    && label.endsWith(LabelIndex.SEPARATOR + payload.marker())) {
                return op;
            }
        }
        for (int i = ordered.size() - 1; i >= 0; i--) {
            Operation op = ordered.get(i);
            if (op.kind() == OperationKind.MOVE || op.kind() == OperationKind.INSERT) {
                return op;
            }
        }
        return ordered.get(ordered.size() - 1);
    }

    private static List<Relabel> relabels(LabelIndex before, LabelIndex after) {
        List<Relabel> relabels = new ArrayList<>();
        for (String label : after.labels()) {
            NodeId id = after.resolve(label);
            String previous = before.contains(id) ? before.labelOf(id) : null;
            if (!label.equals(previous)) {
                relabels.add(new Relabel(id, previous, label));
            }
        }
        for (String label : before.labels()) {
            NodeId id = before.resolve(label);
            if (!after.contains(id)) {
                relabels.add(new Relabel(id, label, null));
            }
        }
        return relabels;
    }
}
