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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.regml.core.RegmlErrorCode;
import ru.nts.tools.regml.core.RegmlException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Двунаправленный индекс "метка - идентичность" для одного снимка дерева.
 *
 * <p>Строится одним полным обходом ({@link #rebuild(Node)}). Метка узла = метка области
 * (ближайшего размеченного непрозрачного предка) + {@code "-"} + маркер узла.
 * Порядковые маркеры вычисляются из позиции среди узлов того же вида в области,
 * зарезервированные узлы занимают свою позицию как обычные.
 * Идентификаторные маркеры берутся из узла дословно, как и номера секций внутри
 * подразделов: вставка в один подраздел не перенумеровывает секции другого.
 *
 * <p>Индекс неизменяем и принадлежит ровно одному {@link DocumentTree}.
 */
public final class LabelIndex {

    private static final Logger log = LoggerFactory.getLogger(LabelIndex.class);

    public static final String SEPARATOR = "-";

    private static final Pattern SECTION_NUMBER = Pattern.compile("(\\d+)([a-z]*)");

    /**
     * Запись индекса: узел, его вычисленная метка, маркер, родитель и позиция среди детей родителя.
     */
    public record Entry(NodeId id, Node node, String label, String marker, NodeId parent, int position) {
    }

    private final Map<String, Entry> byLabel;
    private final Map<NodeId, Entry> byId;

    private LabelIndex(Map<String, Entry> byLabel, Map<NodeId, Entry> byId) {
        this.byLabel = byLabel;
        this.byId = byId;
    }

    /**
     * Полная переразметка дерева с корнем {@code root}.
     *
     * @throws RegmlException DUPLICATE_LABEL, если два узла получили одну метку
     */
    public static LabelIndex rebuild(Node root) {
        Builder builder = new Builder();
        builder.register(root, null, root.marker(), root.marker(), 0);
        EnumMap<NodeKind, Integer> depths = new EnumMap<>(NodeKind.class);
        depths.put(root.kind(), 1);
        builder.labelChildren(root, root.marker(), Scope.of(root), depths);
        log.debug("Label index rebuilt: {} nodes under {}", builder.byId.size(), root.marker());
        return new LabelIndex(Collections.unmodifiableMap(builder.byLabel), Collections.unmodifiableMap(builder.byId));
    }

    /**
     * Идентичность узла по метке.
     *
     * @throws RegmlException LABEL_NOT_FOUND
     */
    public NodeId resolve(String label) {
        Entry entry = byLabel.get(label);
        if (entry == null) {
            throw new RegmlException(RegmlErrorCode.LABEL_NOT_FOUND, "label", label);
        }
        return entry.id();
    }

    public Optional<NodeId> find(String label) {
        Entry entry = byLabel.get(label);
        return entry != null ? Optional.of(entry.id()) : Optional.empty();
    }

    public boolean contains(String label) {
        return byLabel.containsKey(label);
    }

    public boolean contains(NodeId id) {
        return byId.containsKey(id);
    }

    public Entry entry(NodeId id) {
        Entry entry = byId.get(id);
        if (entry == null) {
            throw new IllegalArgumentException("Node " + id + " is not part of this tree");
        }
        return entry;
    }

    public Optional<Entry> entry(String label) {
        return Optional.ofNullable(byLabel.get(label));
    }

    public String labelOf(NodeId id) {
        return entry(id).label();
    }

    public String markerOf(NodeId id) {
        return entry(id).marker();
    }

    /**
     * Родитель узла или {@code null} для корня.
     */
    public NodeId parentOf(NodeId id) {
        return entry(id).parent();
    }

    public Node nodeOf(NodeId id) {
        return entry(id).node();
    }

    /**
     * Является ли {@code ancestor} строгим предком {@code id}.
     */
    public boolean isAncestor(NodeId ancestor, NodeId id) {
        NodeId current = parentOf(id);
        while (current != null) {
            if (current.equals(ancestor)) {
                return true;
            }
            current = parentOf(current);
        }
        return false;
    }

    /**
     * Цепочка предков от корня до родителя узла.
     */
    public List<NodeId> ancestorsOf(NodeId id) {
        List<NodeId> chain = new ArrayList<>();
        NodeId current = parentOf(id);
        while (current != null) {
            chain.add(current);
            current = parentOf(current);
        }
        Collections.reverse(chain);
        return chain;
    }

    /**
     * Все метки в порядке документа (прямой обход).
     */
    public List<String> labels() {
        return List.copyOf(byLabel.keySet());
    }

    public int size() {
        return byId.size();
    }

    private static final class Builder {
        private final Map<String, Entry> byLabel = new LinkedHashMap<>();
        private final Map<NodeId, Entry> byId = new HashMap<>();

        void register(Node node, NodeId parent, String label, String marker, int position) {
            Entry entry = new Entry(node.id(), node, label, marker, parent, position);
            if (byLabel.putIfAbsent(label, entry) != null) {
                throw new RegmlException(RegmlErrorCode.DUPLICATE_LABEL, "label", label);
            }
            if (byId.putIfAbsent(node.id(), entry) != null) {
                throw new IllegalStateException("Node " + node.id() + " occurs twice in the tree");
            }
        }

        /**
         * Разметка детей {@code parent} в области {@code scope}. Счетчики порядковых
         * маркеров принадлежат области и разделяются с прозрачными детьми.
         */
        void labelChildren(Node parent, String scope, Scope state, EnumMap<NodeKind, Integer> depths) {
            List<Node> children = parent.children();
            for (int i = 0; i < children.size(); i++) {
                Node child = children.get(i);
                NodeKind kind = child.kind();
                String marker;
                if (kind.isOrdinal() && kind.keepsMarkerUnder(parent.kind())) {
                    state.counters.merge(kind, 1, Integer::sum);
                    marker = child.marker() != null
                            ? child.marker()
                            : nextSectionNumber(state.lastSection, state.sectionNumbers);
                    state.sectionNumbers.add(marker);
                } else if (kind.isOrdinal()) {
                    int ordinal = state.counters.merge(kind, 1, Integer::sum);
                    marker = kind.sequenceFor(depths.getOrDefault(kind, 0) + 1).marker(ordinal);
                    if (kind == NodeKind.SECTION) {
                        state.sectionNumbers.add(marker);
                    }
                } else {
                    marker = child.marker();
                }
                if (kind == NodeKind.SECTION) {
                    state.lastSection = marker;
                }
                String label = scope + SEPARATOR + marker;
                register(child, parent.id(), label, marker, i);

                EnumMap<NodeKind, Integer> childDepths = new EnumMap<>(depths);
                childDepths.merge(kind, 1, Integer::sum);
                if (kind.isTransparent()) {
                    labelChildren(child, scope, state, childDepths);
                } else {
                    labelChildren(child, label, Scope.of(child), childDepths);
                }
            }
        }
    }

    /**
     * Состояние разметки одной области: счетчики порядковых видов и занятые номера секций.
     */
    private static final class Scope {
        private final EnumMap<NodeKind, Integer> counters = new EnumMap<>(NodeKind.class);
        private final Set<String> sectionNumbers = new HashSet<>();
        private String lastSection;

        static Scope of(Node owner) {
            Scope scope = new Scope();
            scope.collectSectionNumbers(owner);
            return scope;
        }

        // Явные номера секций подразделов известны заранее, чтобы выведенный номер их не занял
        private void collectSectionNumbers(Node node) {
            for (Node child : node.children()) {
                if (child.kind() == NodeKind.SECTION && node.kind().isTransparent() && child.marker() != null) {
                    sectionNumbers.add(child.marker());
                } else if (child.kind().isTransparent()) {
                    collectSectionNumbers(child);
                }
            }
        }
    }

    /**
     * Номер для секции подраздела без собственного номера: следующий за {@code previous}
     * свободный номер. Если он занят, секция получает буквенный суффикс ({@code 2a}, {@code 2b}).
     */
    static String nextSectionNumber(String previous, Set<String> taken) {
        if (previous == null) {
            if (!taken.contains("1")) {
                return "1";
            }
            return suffixed("0", 1, taken);
        }
        Matcher matcher = SECTION_NUMBER.matcher(previous);
        if (matcher.matches()) {
            String base = matcher.group(1);
            String letters = matcher.group(2);
            if (letters.isEmpty()) {
                String next = Long.toString(Long.parseLong(base) + 1);
                if (!taken.contains(next)) {
                    return next;
                }
                return suffixed(base, 1, taken);
            }
            if (letters.chars().distinct().count() == 1) {
                int ordinal = (letters.length() - 1) * 26 + letters.charAt(0) - 'a' + 2;
                String next = base + MarkerSequence.LOWER_ALPHA.marker(ordinal);
                if (!taken.contains(next)) {
                    return next;
                }
            }
        }
        return suffixed(previous, 1, taken);
    }

    private static String suffixed(String base, int from, Set<String> taken) {
        int ordinal = from;
        while (taken.contains(base + MarkerSequence.LOWER_ALPHA.marker(ordinal))) {
            ordinal++;
        }
        return base + MarkerSequence.LOWER_ALPHA.marker(ordinal);
    }
}
