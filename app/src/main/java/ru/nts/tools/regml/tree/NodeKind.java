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

import java.util.EnumSet;
import java.util.Set;

/**
 * Виды узлов регуляции и правила их разметки.
 *
 * <p>Порядковые ({@link LabelStyle#ORDINAL}) узлы получают маркер из позиции среди
 * узлов того же вида в своей области меток. Идентификаторные ({@link LabelStyle#IDENTIFIER})
 * узлы хранят маркер дословно и никогда не перенумеровываются.
 * Прозрачный узел (подраздел) имеет собственную метку, но его дети размечаются
 * относительно области родителя. Секция внутри подраздела хранит свой номер
 * ({@code 1003-3}, {@code 1003-2a}) и не перенумеровывается при вставках в другие подразделы.
 */
public enum NodeKind {

    PART("part", LabelStyle.IDENTIFIER, false),
    SUBPART("subpart", LabelStyle.IDENTIFIER, true),
    SECTION("section", LabelStyle.ORDINAL, false),
    PARAGRAPH("paragraph", LabelStyle.ORDINAL, false),
    APPENDIX("appendix", LabelStyle.IDENTIFIER, false),
    APPENDIX_SECTION("appendixSection", LabelStyle.ORDINAL, false),
    INTERPRETATION("interpretation", LabelStyle.IDENTIFIER, false),
    INTERP_PARAGRAPH("interpParagraph", LabelStyle.ORDINAL, false);

    public enum LabelStyle {ORDINAL, IDENTIFIER}

    private static final MarkerSequence[] PARAGRAPH_LEVELS = {
            MarkerSequence.LOWER_ALPHA,
            MarkerSequence.ARABIC,
            MarkerSequence.LOWER_ROMAN,
            MarkerSequence.UPPER_ALPHA,
            MarkerSequence.ARABIC,
            MarkerSequence.LOWER_ROMAN
    };

    private static final MarkerSequence[] INTERP_LEVELS = {
            MarkerSequence.ARABIC,
            MarkerSequence.LOWER_ROMAN,
            MarkerSequence.UPPER_ALPHA
    };

    private final String jsonName;
    private final LabelStyle labelStyle;
    private final boolean transparent;

    NodeKind(String jsonName, LabelStyle labelStyle, boolean transparent) {
        this.jsonName = jsonName;
        this.labelStyle = labelStyle;
        this.transparent = transparent;
    }

    public String jsonName() {
        return jsonName;
    }

    public LabelStyle labelStyle() {
        return labelStyle;
    }

    public boolean isOrdinal() {
        return labelStyle == LabelStyle.ORDINAL;
    }

    public boolean isTransparent() {
        return transparent;
    }

    /**
     * Хранит ли узел этого вида свой маркер под родителем вида {@code parent}.
     */
    public boolean keepsMarkerUnder(NodeKind parent) {
        return !isOrdinal() || this == SECTION && parent != null && parent.isTransparent();
    }

    /**
     * Последовательность маркеров для порядкового узла на заданной глубине
     * вложенности в узлы того же вида (глубина с 1).
     */
    public MarkerSequence sequenceFor(int depth) {
        return switch (this) {
            case SECTION, APPENDIX_SECTION -> MarkerSequence.ARABIC;
            case PARAGRAPH -> PARAGRAPH_LEVELS[(depth - 1) % PARAGRAPH_LEVELS.length];
            case INTERP_PARAGRAPH -> INTERP_LEVELS[(depth - 1) % INTERP_LEVELS.length];
            default -> throw new IllegalStateException(jsonName + " is not an ordinal kind");
        };
    }

    /**
     * Допустимые виды детей.
     */
    public Set<NodeKind> allowedChildren() {
        return switch (this) {
            case PART -> EnumSet.of(SUBPART, SECTION, APPENDIX, INTERPRETATION);
            case SUBPART -> EnumSet.of(SECTION);
            case SECTION, PARAGRAPH, APPENDIX_SECTION -> EnumSet.of(PARAGRAPH);
            case APPENDIX -> EnumSet.of(APPENDIX_SECTION, PARAGRAPH);
            case INTERPRETATION -> EnumSet.of(INTERPRETATION, INTERP_PARAGRAPH);
            case INTERP_PARAGRAPH -> EnumSet.of(INTERP_PARAGRAPH);
        };
    }

    public boolean allows(NodeKind child) {
        return allowedChildren().contains(child);
    }

    public static NodeKind fromJson(String name) {
        for (NodeKind kind : values()) {
            if (kind.jsonName.equals(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + name);
    }
}
