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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Неизменяемый узел дерева регуляции.
 *
 * <p>Метка в узле не хранится: она вычисляется {@link LabelIndex} из позиции узла.
 * Порядковые узлы не имеют собственного маркера ({@code marker == null}), кроме секций
 * подразделов, которые хранят свой номер. Идентификаторные узлы обязаны иметь маркер.
 * Все операции {@code with*} возвращают новый узел с той же идентичностью,
 * неизмененные дети разделяются по ссылке.
 */
public final class Node {

    private final NodeId id;
    private final NodeKind kind;
    private final String marker;
    private final Content content;
    private final Map<String, String> attributes;
    private final boolean reserved;
    private final List<Node> children;

    private Node(NodeId id, NodeKind kind, String marker, Content content, Map<String, String> attributes,
                 boolean reserved, List<Node> children) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        if (kind.isOrdinal()) {
            // Номер секции подраздела; у остальных порядковых узлов маркер вычисляется
            this.marker = kind == NodeKind.SECTION && marker != null && !marker.isBlank() ? marker : null;
        } else {
            if (marker == null || marker.isBlank()) {
                throw new IllegalArgumentException("Node of kind '" + kind.jsonName() + "' requires a marker");
            }
            this.marker = marker;
        }
        this.content = content != null ? content : Content.EMPTY;
        this.attributes = attributes == null || attributes.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.reserved = reserved;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    public NodeId id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * Маркер идентификаторного узла, номер секции подраздела или {@code null}.
     */
    public String marker() {
        return marker;
    }

    public Content content() {
        return content;
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public String attribute(String name) {
        return attributes.get(name);
    }

    public boolean isReserved() {
        return reserved;
    }

    public List<Node> children() {
        return children;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    public Node withChildren(List<Node> newChildren) {
        return new Node(id, kind, marker, content, attributes, reserved, newChildren);
    }

    public Node withContent(Content newContent) {
        return new Node(id, kind, marker, newContent, attributes, reserved, children);
    }

    public Node withMarker(String newMarker) {
        return new Node(id, kind, newMarker, content, attributes, reserved, children);
    }

    /**
     * Тот же узел под другой идентичностью (заполнение зарезервированного слота).
     */
    public Node withId(NodeId newId) {
        return new Node(newId, kind, marker, content, attributes, reserved, children);
    }

    /**
     * Зарезервированный слот: позиция и идентичность сохраняются, содержимое и дети удаляются.
     * Атрибуты сохраняются, кроме заголовка, который заменяется на {@code [Reserved]}.
     */
    public Node asReserved() {
        Map<String, String> attrs = new LinkedHashMap<>(attributes);
        attrs.put("title", "[Reserved]");
        return new Node(id, kind, marker, Content.EMPTY, attrs, true, List.of());
    }

    /**
     * Сравнивает собственные данные узла без учета детей и идентичности.
     */
    public boolean sameOwnData(Node other) {
        return kind == other.kind
                && Objects.equals(marker, other.marker)
                && reserved == other.reserved
                && content.equals(other.content)
                && attributes.equals(other.attributes);
    }

    /**
     * Глубокое сравнение поддеревьев без учета идентичностей.
     */
    public boolean structurallyEquals(Node other) {
        if (this == other) {
            return true;
        }
        if (!sameOwnData(other) || children.size() != other.children.size()) {
            return false;
        }
        for (int i = 0; i < children.size(); i++) {
            if (!children.get(i).structurallyEquals(other.children.get(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Количество узлов в поддереве, включая этот.
     */
    public int subtreeSize() {
        int size = 1;
        for (Node child : children) {
            size += child.subtreeSize();
        }
        return size;
    }

    @Override
    public String toString() {
        return kind.jsonName() + (marker != null ? " " + marker : "") + " " + id;
    }

    public static final class Builder {
        private final NodeKind kind;
        private NodeId id;
        private String marker;
        private Content content = Content.EMPTY;
        private final Map<String, String> attributes = new LinkedHashMap<>();
        private boolean reserved;
        private final List<Node> children = new ArrayList<>();

        private Builder(NodeKind kind) {
            this.kind = kind;
        }

        public Builder id(NodeId id) {
            this.id = id;
            return this;
        }

        public Builder marker(String marker) {
            this.marker = marker;
            return this;
        }

        public Builder text(String text) {
            this.content = Content.of(text);
            return this;
        }

        public Builder content(Content content) {
            this.content = content;
            return this;
        }

        public Builder attribute(String name, String value) {
            this.attributes.put(name, value);
            return this;
        }

        public Builder reserved(boolean reserved) {
            this.reserved = reserved;
            return this;
        }

        public Builder child(Node child) {
            this.children.add(child);
            return this;
        }

        public Builder children(List<Node> children) {
            this.children.addAll(children);
            return this;
        }

        public Node build() {
            return new Node(id != null ? id : NodeId.next(), kind, marker, content, attributes, reserved, children);
        }
    }
}
