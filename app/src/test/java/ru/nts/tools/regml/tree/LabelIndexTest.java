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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.regml.core.RegmlErrorCode;
import ru.nts.tools.regml.core.RegmlException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static ru.nts.tools.regml.tree.TreeFixtures.*;

class LabelIndexTest {

    @Nested
    class Ordinals {

        @Test
        void testSectionsAndParagraphs() {
            DocumentTree tree = tree("v1", part(
                    section("One",
                            paragraph("a", paragraph("a-1", paragraph("a-1-i", paragraph("a-1-i-A")))),
                            paragraph("b")),
                    section("Two")));

            assertEquals(List.of("1003", "1003-1", "1003-1-a", "1003-1-a-1", "1003-1-a-1-i", "1003-1-a-1-i-A",
                    "1003-1-b", "1003-2"), tree.index().labels());
            assertEquals("a-1-i-A", tree.resolve("1003-1-a-1-i-A").content().text());
            assertEquals("A", tree.index().markerOf(tree.resolve("1003-1-a-1-i-A").id()));
        }

        @Test
        void testReservedNodesKeepTheirPosition() {
            DocumentTree tree = tree("v1", part(section("One"), reservedSection(), section("Three")));

            assertTrue(tree.resolve("1003-2").isReserved());
            assertEquals("Three", tree.resolve("1003-3").content().text());
        }
    }

    @Nested
    class Scopes {

        @Test
        void testSubpartIsTransparent() {
            // Секции нумеруются сквозь подразделы, сам подраздел имеет собственную метку
            Node subpartA = subpart("Subpart-A", section("One"), section("Two"));
            Node subpartB = subpart("Subpart-B", section("Three"));
            DocumentTree tree = tree("v1", part(subpartA, subpartB));

            assertEquals(List.of("1003", "1003-Subpart-A", "1003-1", "1003-2", "1003-Subpart-B", "1003-3"),
                    tree.index().labels());
            assertEquals(subpartB.id(), tree.index().parentOf(tree.resolve("1003-3").id()));
        }

        @Test
        void testSubpartSectionsKeepTheirNumbers() {
            // Номер закрепляется за секцией подраздела при первой разметке
            DocumentTree tree = tree("v1", part(
                    subpart("Subpart-A", section("One"), section("Two")),
                    subpart("Subpart-B", section("Three"))));

            assertEquals("3", tree.resolve("1003-3").marker());
            assertNull(twoSections("v1").resolve("1003-1").marker());

            // Новая секция без номера после 1003-2: номер 3 занят подразделом B
            Node subpartA = tree.resolve("1003-Subpart-A");
            List<Node> sections = new ArrayList<>(subpartA.children());
            sections.add(section("Two and a half"));
            DocumentTree next = tree.withNodeReplaced(subpartA.id(), node -> node.withChildren(sections));

            assertEquals(List.of("1003", "1003-Subpart-A", "1003-1", "1003-2", "1003-2a", "1003-Subpart-B",
                    "1003-3"), next.index().labels());
            assertEquals("Three", next.resolve("1003-3").content().text());
        }

        @Test
        void testSectionMovedOutOfSubpartBecomesOrdinal() {
            Node loose = Node.builder(NodeKind.SECTION).marker("7").text("Loose").build();
            DocumentTree tree = tree("v1", part(loose));

            assertNull(tree.resolve("1003-1").marker());
            assertFalse(tree.index().contains("1003-7"));
        }

        @Test
        void testNextSectionNumber() {
            assertEquals("1", LabelIndex.nextSectionNumber(null, Set.of()));
            assertEquals("0a", LabelIndex.nextSectionNumber(null, Set.of("1")));
            assertEquals("3", LabelIndex.nextSectionNumber("2", Set.of("1", "2")));
            assertEquals("2a", LabelIndex.nextSectionNumber("2", Set.of("1", "2", "3")));
            assertEquals("2c", LabelIndex.nextSectionNumber("2b", Set.of("2", "2a", "2b", "3")));
            assertEquals("2ba", LabelIndex.nextSectionNumber("2b", Set.of("2b", "2c")));
            assertEquals("Ta", LabelIndex.nextSectionNumber("T", Set.of("T")));
        }

        @Test
        void testAppendixAndInterpretation() {
            Node interpParagraph = Node.builder(NodeKind.INTERP_PARAGRAPH).text("Comment")
                    .child(Node.builder(NodeKind.INTERP_PARAGRAPH).text("Nested").build())
                    .build();
            Node interp = Node.builder(NodeKind.INTERPRETATION).marker("Interp")
                    .child(Node.builder(NodeKind.INTERPRETATION).marker("1").child(interpParagraph).build())
                    .build();
            Node appendixSection = Node.builder(NodeKind.APPENDIX_SECTION).text("Model form")
                    .child(paragraph("Item"))
                    .build();
            DocumentTree tree = tree("v1", part(section("One"), appendix("A", appendixSection), interp));

            assertEquals(List.of("1003", "1003-1", "1003-A", "1003-A-1", "1003-A-1-a", "1003-Interp",
                    "1003-Interp-1", "1003-Interp-1-1", "1003-Interp-1-1-i"), tree.index().labels());
        }

        @Test
        void testDuplicateIdentifierMarkers() {
            RegmlException e = assertThrows(RegmlException.class,
                    () -> LabelIndex.rebuild(part(appendix("A"), appendix("A"))));
            assertEquals(RegmlErrorCode.DUPLICATE_LABEL, e.getCode());
            assertEquals("1003-A", e.getContext().get("label"));
        }
    }

    @Nested
    class Lookups {

        @Test
        void testResolveUnknownLabel() {
            DocumentTree tree = twoSections("v1");

            RegmlException e = assertThrows(RegmlException.class, () -> tree.index().resolve("1003-9"));
            assertEquals(RegmlErrorCode.LABEL_NOT_FOUND, e.getCode());
            assertTrue(tree.index().find("1003-9").isEmpty());
            assertFalse(tree.index().contains("1003-9"));
        }

        @Test
        void testAncestry() {
            DocumentTree tree = twoSections("v1");
            LabelIndex index = tree.index();
            NodeId root = tree.root().id();
            NodeId section = index.resolve("1003-1");
            NodeId paragraph = index.resolve("1003-1-a");

            assertNull(index.parentOf(root));
            assertEquals(section, index.parentOf(paragraph));
            assertEquals(List.of(root, section), index.ancestorsOf(paragraph));
            assertTrue(index.isAncestor(root, paragraph));
            assertFalse(index.isAncestor(paragraph, section));
            assertFalse(index.isAncestor(section, section));
            assertEquals(1, index.entry(index.resolve("1003-2")).position());
            assertEquals(4, index.size());
        }
    }
}
