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

import ru.nts.tools.regml.tree.Content;
import ru.nts.tools.regml.tree.LabelIndex;
import ru.nts.tools.regml.tree.Node;
import ru.nts.tools.regml.tree.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Снимок узла в одной из сравниваемых версий, с вычисленными метками.
 * Для добавленных и удаленных узлов снимок глубокий, для измененных и перемещенных
 * содержит только собственные данные узла.
 */
public record Snapshot(String label, NodeKind kind, String marker, Content content, Map<String, String> attributes,
                       boolean reserved, List<Snapshot> children) {

    public Snapshot {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        children = List.copyOf(children);
    }

    public static Snapshot shallow(Node node, LabelIndex index) {
        return new Snapshot(index.labelOf(node.id()), node.kind(), index.markerOf(node.id()), node.content(),
                node.attributes(), node.isReserved(), List.of());
    }

    public static Snapshot deep(Node node, LabelIndex index) {
        List<Snapshot> children = new ArrayList<>(node.children().size());
        for (Node child : node.children()) {
            children.add(deep(child, index));
        }
        return new Snapshot(index.labelOf(node.id()), node.kind(), index.markerOf(node.id()), node.content(),
                node.attributes(), node.isReserved(), children);
    }
}
