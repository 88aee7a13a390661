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

import ru.nts.tools.regml.tree.LabelIndex;
import ru.nts.tools.regml.tree.Node;
import ru.nts.tools.regml.tree.NodeId;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Изменяемый черновик дерева на время одного применения уведомления.
 *
 * <p>Исходные узлы не копируются: черновик хранит только переопределения
 * (узлы, списки детей, родители) поверх неизменяемого исходного дерева и его индекса.
 * {@link #materialize()} пересобирает лишь "грязные" узлы на путях к изменениям,
 * все остальные поддеревья переиспользуются по ссылке.
 * Экземпляр не потокобезопасен и живет один проход применения.
 */
final class WorkingTree {

    private final LabelIndex index;
    private final NodeId rootId;

    private final Map<NodeId, Node> nodes = new HashMap<>();
    private final Map<NodeId, List<NodeId>> childLists = new HashMap<>();
    private final Map<NodeId, NodeId> parents = new HashMap<>();
    private final Set<NodeId> dirty = new HashSet<>();
    private final Set<NodeId> removed = new HashSet<>();

    WorkingTree(Node root, LabelIndex index) {
        this.index = index;
        this.rootId = root.id();
    }

    NodeId rootId() {
        return rootId;
    }

    Node node(NodeId id) {
        Node node = nodes.get(id);
        return node != null ? node : index.nodeOf(id);
    }

    /**
     * Текущий родитель; {@code null} для корня и отсоединенных узлов.
     */
    NodeId parent(NodeId id) {
        if (parents.containsKey(id)) {
            return parents.get(id);
        }
        return index.parentOf(id);
    }

    List<NodeId> children(NodeId id) {
        List<NodeId> list = childLists.get(id);
        if (list != null) {
            return list;
        }
        List<Node> children = node(id).children();
        List<NodeId> ids = new ArrayList<>(children.size());
        for (Node child : children) {
            ids.add(child.id());
        }
        return ids;
    }

    boolean isRemoved(NodeId id) {
        return removed.contains(id);
    }

    /**
     * Лежит ли {@code id} в поддереве {@code ancestor} (включая сам узел).
     */
    boolean isWithin(NodeId id, NodeId ancestor) {
        NodeId current = id;
        while (current != null) {
            if (current.equals(ancestor)) {
                return true;
            }
            current = parent(current);
        }
        return false;
    }

    int indexOf(NodeId parent, NodeId child) {
        return children(parent).indexOf(child);
    }

    /**
     * Вставляет новое поддерево (узлы которого еще не принадлежат дереву).
     */
    void insert(NodeId parent, int position, Node subtree) {
        register(subtree);
        attach(subtree.id(), parent, position);
    }

    /**
     * Замена собственных данных и всего поддерева узла с сохранением его идентичности и позиции.
     */
    void replace(NodeId id, Node replacement) {
        markDescendantsRemoved(id);
        childLists.remove(id);
        dirty.remove(id);
        register(replacement);
        markDirty(parent(id));
    }

    void reserve(NodeId id) {
        replace(id, node(id).asReserved());
    }

    /**
     * Удаляет узел вместе с поддеревом.
     */
    void remove(NodeId id) {
        detach(id);
        markDescendantsRemoved(id);
        removed.add(id);
    }

    void detach(NodeId id) {
        NodeId parent = parent(id);
        List<NodeId> siblings = new ArrayList<>(children(parent));
        siblings.remove(id);
        childLists.put(parent, siblings);
        parents.put(id, null);
        markDirty(parent);
    }

    void attach(NodeId id, NodeId parent, int position) {
        List<NodeId> siblings = new ArrayList<>(children(parent));
        siblings.add(position, id);
        childLists.put(parent, siblings);
        parents.put(id, parent);
        markDirty(parent);
    }

    /**
     * Меняет маркер узла, не трогая его поддерево. {@code null} оставляет маркер как есть.
     */
    void remark(NodeId id, String marker) {
        if (marker == null) {
            return;
        }
        nodes.put(id, node(id).withMarker(marker));
        markDirty(parent(id));
    }

    /**
     * Собирает итоговый корень. Незатронутые поддеревья разделяются с исходным деревом.
     */
    Node materialize() {
        return materialize(rootId);
    }

    private Node materialize(NodeId id) {
        Node node = node(id);
        if (!dirty.contains(id)) {
            return node;
        }
        List<NodeId> childIds = children(id);
        List<Node> children = new ArrayList<>(childIds.size());
        for (NodeId childId : childIds) {
            children.add(materialize(childId));
        }
        return node.withChildren(children);
    }

    private void register(Node subtree) {
        nodes.put(subtree.id(), subtree);
        for (Node child : subtree.children()) {
            parents.put(child.id(), subtree.id());
            register(child);
        }
    }

    private void markDescendantsRemoved(NodeId id) {
        for (NodeId child : children(id)) {
            removed.add(child);
            markDescendantsRemoved(child);
        }
    }

    private void markDirty(NodeId id) {
        NodeId current = id;
        while (current != null) {
            dirty.add(current);
            current = parent(current);
        }
    }
}
