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
import java.util.List;

/**
 * Построители небольших деревьев для тестов.
 */
public final class TreeFixtures {

    public static final String TITLE = "12";
    public static final String PART = "1003";

    private TreeFixtures() {
    }

    public static Node part(Node... children) {
        return Node.builder(NodeKind.PART).marker(PART).attribute("title", "Equal Credit Opportunity")
                .children(List.of(children)).build();
    }

    public static Node subpart(String marker, Node... children) {
        return Node.builder(NodeKind.SUBPART).marker(marker).children(List.of(children)).build();
    }

    public static Node section(String text, Node... children) {
        return Node.builder(NodeKind.SECTION).text(text).children(List.of(children)).build();
    }

    public static Node paragraph(String text, Node... children) {
        return Node.builder(NodeKind.PARAGRAPH).text(text).children(List.of(children)).build();
    }

    public static Node reservedSection() {
        return Node.builder(NodeKind.SECTION).attribute("title", "[Reserved]").reserved(true).build();
    }

    public static Node appendix(String marker, Node... children) {
        return Node.builder(NodeKind.APPENDIX).marker(marker).children(List.of(children)).build();
    }

    public static DocumentTree tree(String version, Node root) {
        return DocumentTree.of(TITLE, PART, version, LocalDate.of(2011, 12, 30), root);
    }

    /**
     * 1003 -> 1003-1 ("First", с абзацем 1003-1-a), 1003-2 ("Second").
     */
    public static DocumentTree twoSections(String version) {
        return tree(version, part(
                section("First", paragraph("Scope of the part.")),
                section("Second")));
    }
}
