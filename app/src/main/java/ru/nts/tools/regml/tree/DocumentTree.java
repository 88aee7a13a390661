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
package ru.nts.tools.regml.tree;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Одна версия регуляции: метаданные, корневой узел и собственный индекс меток.
 *
 * <p>Неизменяема после создания. Любое изменение создает новое дерево, в котором
 * незатронутые поддеревья разделяются по ссылке с предыдущей версией.
 * Индекс меток никогда не разделяется между версиями с разной структурой.
 */
public final class DocumentTree {

    private final String title;
    private final String part;
    private final String version;
    private final LocalDate effectiveDate;
    private final Node root;
    private final LabelIndex index;

    private DocumentTree(String title, String part, String version, LocalDate effectiveDate, Node root,
                         LabelIndex index) {
        this.title = title;
        this.part = Objects.requireNonNull(part, "part");
        this.version = Objects.requireNonNull(version, "version");
        this.effectiveDate = effectiveDate;
        this.root = Objects.requireNonNull(root, "root");
        this.index = index;
    }

    /**
     * Создает дерево и строит его индекс меток.
     *
     * <p>Секции подразделов закрепляют за собой номер, полученный при первой разметке,
     * у секций прямо под частью номер снимается: он вычисляется из позиции.
     */
    public static DocumentTree of(String title, String part, String version, LocalDate effectiveDate, Node root) {
        LabelIndex index = LabelIndex.rebuild(root);
        Node normalized = pinSectionNumbers(root, index);
        if (normalized != root) {
            index = LabelIndex.rebuild(normalized);
        }
        return new DocumentTree(title, part, version, effectiveDate, normalized, index);
    }

    // Возвращает тот же экземпляр, если ни один маркер не изменился
    private static Node pinSectionNumbers(Node node, LabelIndex index) {
        List<Node> children = node.children();
        List<Node> updated = null;
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            Node pinned = pinSectionNumbers(child, index);
            if (child.kind() == NodeKind.SECTION) {
                String marker = child.kind().keepsMarkerUnder(node.kind()) ? index.markerOf(child.id()) : null;
                if (!Objects.equals(marker, pinned.marker())) {
                    pinned = pinned.withMarker(marker);
                }
            }
            if (pinned != child) {
                if (updated == null) {
                    updated = new ArrayList<>(children);
                }
                updated.set(i, pinned);
            }
        }
        return updated == null ? node : node.withChildren(updated);
    }

    public String title() {
        return title;
    }

    public String part() {
        return part;
    }

    public String version() {
        return version;
    }

    public LocalDate effectiveDate() {
        return effectiveDate;
    }

    public Node root() {
        return root;
    }

    public LabelIndex index() {
        return index;
    }

    /**
     * Узел по метке.
     *
     * @throws ru.nts.tools.regml.core.RegmlException LABEL_NOT_FOUND
     */
    public Node resolve(String label) {
        return index.nodeOf(index.resolve(label));
    }

    public String labelOf(Node node) {
        return index.labelOf(node.id());
    }

    /**
     * Та же структура под другой версией. Корень не меняется, поэтому индекс разделяется.
     */
    public DocumentTree withVersion(String newVersion, LocalDate newEffectiveDate) {
        return new DocumentTree(title, part, newVersion, newEffectiveDate, root, index);
    }

    /**
     * Новое дерево с другим корнем и заново построенным индексом.
     */
    public DocumentTree withRoot(Node newRoot) {
        return of(title, part, version, effectiveDate, newRoot);
    }

    /**
     * Copy-on-write замена одного узла: пересобираются только узлы на пути от корня.
     */
    public DocumentTree withNodeReplaced(NodeId id, UnaryOperator<Node> change) {
        List<NodeId> path = new ArrayList<>(index.ancestorsOf(id));
        path.add(id);
        return withRoot(rebuildPath(root, path, 0, change));
    }

    private Node rebuildPath(Node node, List<NodeId> path, int depth, UnaryOperator<Node> change) {
        if (depth == path.size() - 1) {
            return change.apply(node);
        }
        NodeId next = path.get(depth + 1);
        List<Node> children = new ArrayList<>(node.children());
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).id().equals(next)) {
                children.set(i, rebuildPath(children.get(i), path, depth + 1, change));
                return node.withChildren(children);
            }
        }
        throw new IllegalStateException("Path to " + path.get(path.size() - 1) + " is broken at " + node.id());
    }

    /**
     * Все узлы в порядке документа.
     */
    public List<Node> nodes() {
        List<Node> nodes = new ArrayList<>(index.size());
        collect(root, nodes);
        return nodes;
    }

    private static void collect(Node node, List<Node> out) {
        out.add(node);
        for (Node child : node.children()) {
            collect(child, out);
        }
    }

    @Override
    public String toString() {
        return "DocumentTree{" + title + " CFR " + part + ", version=" + version + ", effective=" + effectiveDate + "}";
    }
}
