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

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import ru.nts.tools.regml.core.RegmlChangeException;
import ru.nts.tools.regml.core.RegmlErrorCode;
import ru.nts.tools.regml.diff.Change;
import ru.nts.tools.regml.diff.ChangeKind;
import ru.nts.tools.regml.diff.TreeDiff;
import ru.nts.tools.regml.diff.VersionDiffer;
import ru.nts.tools.regml.tree.DocumentTree;
import ru.nts.tools.regml.tree.Node;
import ru.nts.tools.regml.tree.NodeId;
import ru.nts.tools.regml.tree.NodeKind;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static ru.nts.tools.regml.tree.TreeFixtures.*;

class ChangesetApplierTest {

    private final ChangesetApplier applier = new ChangesetApplier();
    private final VersionDiffer differ = new VersionDiffer();

    private static Notice notice(String number, String appliesTo, Operation... operations) {
        return new Notice(number, LocalDate.of(2012, 3, 1), appliesTo, Arrays.asList(operations));
    }

    private static List<String> sectionTexts(DocumentTree tree) {
        return tree.root().children().stream().map(n -> n.content().text()).toList();
    }

    @Nested
    class Insert {

        @Test
        void testInsertAfterRenumbersFollowingSiblings() {
            DocumentTree base = twoSections("v1");
            NodeId second = base.index().resolve("1003-2");

            ApplyResult result = applier.apply(base, notice("v2", "v1",
                    Operation.insert(0, "1003-2", Position.after("1003-1"), section("Inserted"))));
            DocumentTree next = result.tree();

            assertEquals("v2", next.version());
            assertEquals(List.of("First", "Inserted", "Second"), sectionTexts(next));
            assertEquals("Inserted", next.resolve("1003-2").content().text());
            assertEquals(second, next.index().resolve("1003-3"));

            TreeDiff diff = differ.diff(base, next);
            assertEquals(2, diff.size());
            Change added = diff.changes().get(0);
            assertEquals(ChangeKind.ADDED, added.kind());
            assertEquals("1003-2", added.label());
            Change moved = diff.changes().get(1);
            assertEquals(ChangeKind.MOVED, moved.kind());
            assertEquals("1003-2", moved.previousLabel());
            assertEquals("1003-3", moved.label());
        }

        @Test
        void testRelabelLog() {
            DocumentTree base = twoSections("v1");

            ApplyResult result = applier.apply(base, notice("v2", "v1",
                    Operation.insert(0, "1003-2", Position.after("1003-1"), section("Inserted"))));

            assertEquals(2, result.relabels().size());
            assertTrue(result.relabels().stream().anyMatch(r -> r.isAdded() && r.after().equals("1003-2")));
            assertTrue(result.relabels().stream()
                    .anyMatch(r -> "1003-2".equals(r.before()) && "1003-3".equals(r.after())));
        }

        @Test
        void testInsertChildOfAppends() {
            DocumentTree base = twoSections("v1");

            DocumentTree next = applier.apply(base, notice("v2", "v1",
                    Operation.insert(0, "1003-1-b", Position.childOf("1003-1"), paragraph("New paragraph")))).tree();

            assertEquals("New paragraph", next.resolve("1003-1-b").content().text());
            assertEquals("Scope of the part.", next.resolve("1003-1-a").content().text());
        }

        @Test
        void testInsertWithoutAnchorUsesTarget() {
            DocumentTree base = twoSections("v1");

            DocumentTree next = applier.apply(base, notice("v2", "v1",
                    Operation.insert(0, "1003-2", new Position(Placement.BEFORE, null), section("Before second"))))
                    .tree();

            assertEquals(List.of("First", "Before second", "Second"), sectionTexts(next));
        }

        @Test
        void testKindNotAllowedUnderParent() {
            DocumentTree base = twoSections("v1");

            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> applier.apply(base,
                    notice("v2", "v1", Operation.insert(0, "1003-a", Position.childOf("1003"), paragraph("Loose")))));
            assertEquals(RegmlErrorCode.STRUCTURAL_CONFLICT, e.getCode());
            assertEquals("a paragraph cannot be placed under a part", e.getContext().get("reason"));
        }

        @Test
        void testDuplicateIdentifierInResult() {
            DocumentTree base = tree("v1", part(section("One"), appendix("A")));

            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> applier.apply(base,
                    notice("v2", "v1", Operation.insert(0, "1003-A", Position.childOf("1003"), appendix("A")))));
            assertEquals(RegmlErrorCode.STRUCTURAL_CONFLICT, e.getCode());
            assertEquals(0, e.getOperationIndex());
            assertTrue(String.valueOf(e.getContext().get("reason")).contains("label 1003-A twice"));
        }
    }

    @Nested
    class ReplaceAndDelete {

        @Test
        void testReplaceKeepsLabelsAndIdentity() {
            DocumentTree base = twoSections("v1");
            NodeId paragraph = base.index().resolve("1003-1-a");

            ApplyResult result = applier.apply(base, notice("v2", "v1",
                    Operation.replace(0, "1003-1-a", paragraph("Amended scope."))));

            assertTrue(result.relabels().isEmpty());
            assertEquals(paragraph, result.tree().index().resolve("1003-1-a"));
            TreeDiff diff = differ.diff(base, result.tree());
            assertEquals(1, diff.size());
            assertEquals(ChangeKind.MODIFIED, diff.changes().get(0).kind());
            assertEquals("1003-1-a", diff.changes().get(0).label());
        }

        @Test
        void testDeleteRenumbers() {
            DocumentTree base = tree("v1", part(section("One"), section("Two"), section("Three")));

            DocumentTree next = applier.apply(base, notice("v2", "v1", Operation.delete(0, "1003-2"))).tree();

            assertEquals("Three", next.resolve("1003-2").content().text());
            assertFalse(next.index().contains("1003-3"));
        }

        @Test
        void testInsertNextToDeletedNode() {
            DocumentTree base = twoSections("v1");

            DocumentTree next = applier.apply(base, notice("v2", "v1",
                    Operation.delete(0, "1003-2"),
                    Operation.insert(1, "1003-2", Position.after("1003-2"), section("Replacement")))).tree();

            assertEquals(List.of("First", "Replacement"), sectionTexts(next));
        }

        @Test
        void testInsertIntoDeletedSectionIsDropped() {
            // Вставка внутрь удаляемой секции выполняется до удаления и уходит вместе с ней
            DocumentTree base = twoSections("v1");

            DocumentTree next = applier.apply(base, notice("v2", "v1",
                    Operation.delete(0, "1003-1"),
                    Operation.insert(1, "1003-1-b", Position.after("1003-1-a"), paragraph("Orphan")))).tree();

            assertEquals(List.of("Second"), sectionTexts(next));
            assertFalse(next.index().contains("1003-1-a"));
            assertEquals(2, next.index().size());
        }

        @Test
        void testInsertIntoReplacedSectionConflicts() {
            DocumentTree base = twoSections("v1");

            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> applier.apply(base,
                    notice("v2", "v1",
                            Operation.replace(0, "1003-1", section("Rewritten")),
                            Operation.insert(1, "1003-1-b", Position.after("1003-1-a"), paragraph("Lost")))));
            assertEquals(RegmlErrorCode.STRUCTURAL_CONFLICT, e.getCode());
            assertEquals(1, e.getOperationIndex());
        }

        @Test
        void testEquivalentInsertionPointsConflict() {
            // "после 1003-1" и "перед 1003-2" описывают одно и то же место
            DocumentTree base = twoSections("v1");

            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> applier.apply(base,
                    notice("v2", "v1",
                            Operation.insert(0, "1003-2", Position.after("1003-1"), section("Left")),
                            Operation.insert(1, "1003-3", Position.before("1003-2"), section("Right")))));
            assertEquals(RegmlErrorCode.DUPLICATE_TARGET, e.getCode());
            assertEquals(1, e.getOperationIndex());
            assertEquals(0, e.getContext().get("first"));
        }

        @Test
        void testRootCannotBeDeleted() {
            DocumentTree base = twoSections("v1");

            RegmlChangeException e = assertThrows(RegmlChangeException.class,
                    () -> applier.apply(base, notice("v2", "v1", Operation.delete(0, "1003"))));
            assertEquals(RegmlErrorCode.STRUCTURAL_CONFLICT, e.getCode());
            assertEquals("the root node cannot be removed", e.getContext().get("reason"));
        }
    }

    @Nested
    class Reserved {

        @Test
        void testReserveKeepsNumbering() {
            DocumentTree base = tree("v1", part(section("One"), section("Two"), section("Three")));

            DocumentTree next = applier.apply(base, notice("v2", "v1", Operation.reserve(0, "1003-2"))).tree();

            Node reserved = next.resolve("1003-2");
            assertTrue(reserved.isReserved());
            assertEquals("[Reserved]", reserved.attribute("title"));
            assertEquals("Three", next.resolve("1003-3").content().text());
        }

        @Test
        void testFillReservedSlot() {
            DocumentTree base = tree("v1", part(section("One"), section("Two"), section("Three")));
            DocumentTree reserved = applier.apply(base, notice("v2", "v1", Operation.reserve(0, "1003-2"))).tree();
            NodeId slot = reserved.index().resolve("1003-2");

            ApplyResult result = applier.apply(reserved, notice("v3", "v2",
                    Operation.insert(0, "1003-2", Position.before("1003-2"), section("Filled"))));
            DocumentTree filled = result.tree();

            assertEquals(List.of("One", "Filled", "Three"), sectionTexts(filled));
            assertFalse(filled.resolve("1003-2").isReserved());
            assertEquals(slot, filled.index().resolve("1003-2"));
            assertTrue(result.relabels().isEmpty());

            TreeDiff diff = differ.diff(reserved, filled);
            assertEquals(List.of(ChangeKind.MODIFIED), diff.changes().stream().map(Change::kind).toList());
        }

        @Test
        void testDeleteThenInsertRenumbers() {
            // Без резервирования место не сохраняется: удаление сдвигает метки, вставка сдвигает снова
            DocumentTree base = tree("v1", part(section("One"), section("Two"), section("Three")));
            NodeId two = base.index().resolve("1003-2");
            NodeId three = base.index().resolve("1003-3");

            DocumentTree deleted = applier.apply(base, notice("v2", "v1", Operation.delete(0, "1003-2"))).tree();
            assertEquals(three, deleted.index().resolve("1003-2"));

            ApplyResult result = applier.apply(deleted, notice("v3", "v2",
                    Operation.insert(0, "1003-2", Position.before("1003-2"), section("New"))));
            DocumentTree refilled = result.tree();

            assertEquals(List.of("One", "New", "Three"), sectionTexts(refilled));
            assertNotEquals(two, refilled.index().resolve("1003-2"));
            assertEquals(three, refilled.index().resolve("1003-3"));
            assertFalse(result.relabels().isEmpty());
        }

        @Test
        void testInsertUnderNodeReservedInSameNoticeConflicts() {
            DocumentTree base = twoSections("v1");

            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> applier.apply(base,
                    notice("v2", "v1",
                            Operation.reserve(0, "1003-2"),
                            Operation.insert(1, "1003-2-a", Position.childOf("1003-2"), paragraph("x")))));
            assertEquals(RegmlErrorCode.STRUCTURAL_CONFLICT, e.getCode());
            assertEquals(1, e.getOperationIndex());
        }

        @Test
        void testReservedNodeCannotReceiveChildren() {
            DocumentTree base = tree("v1", part(section("One"), reservedSection()));

            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> applier.apply(base,
                    notice("v2", "v1", Operation.insert(0, "1003-2-a", Position.childOf("1003-2"), paragraph("x")))));
            assertEquals("a reserved node cannot receive children", e.getContext().get("reason"));
        }
    }

    @Nested
    class Subparts {

        private DocumentTree twoSubparts() {
            return tree("v1", part(
                    subpart("Subpart-A", section("A1"), section("A2")),
                    subpart("Subpart-B", section("B1"))));
        }

        @Test
        void testInsertDoesNotRenumberOtherSubpart() {
            DocumentTree base = twoSubparts();
            NodeId b1 = base.index().resolve("1003-3");

            ApplyResult result = applier.apply(base, notice("v2", "v1",
                    Operation.insert(0, "1003-2a", Position.after("1003-2"), section("A3"))));
            DocumentTree next = result.tree();

            assertEquals(b1, next.index().resolve("1003-3"));
            assertEquals("A3", next.resolve("1003-2a").content().text());
            assertEquals(List.of("1003", "1003-Subpart-A", "1003-1", "1003-2", "1003-2a", "1003-Subpart-B",
                    "1003-3"), next.index().labels());
            assertTrue(result.relabels().isEmpty());
        }

        @Test
        void testDeleteDoesNotRenumberOtherSubpart() {
            DocumentTree next = applier.apply(twoSubparts(), notice("v2", "v1",
                    Operation.delete(0, "1003-1"))).tree();

            assertEquals("A2", next.resolve("1003-2").content().text());
            assertEquals("B1", next.resolve("1003-3").content().text());
            assertFalse(next.index().contains("1003-1"));
        }

        @Test
        void testReplaceKeepsSectionNumber() {
            DocumentTree next = applier.apply(twoSubparts(), notice("v2", "v1",
                    Operation.replace(0, "1003-3", section("B1 amended")))).tree();

            assertEquals("B1 amended", next.resolve("1003-3").content().text());
            assertEquals("3", next.resolve("1003-3").marker());
        }

        @Test
        void testMoveKeepsSectionNumber() {
            DocumentTree base = twoSubparts();
            NodeId a1 = base.index().resolve("1003-1");

            DocumentTree next = applier.apply(base, notice("v2", "v1",
                    Operation.move(0, "1003-1", Position.childOf("1003-Subpart-B")))).tree();

            assertEquals(a1, next.index().resolve("1003-1"));
            assertEquals(next.index().resolve("1003-Subpart-B"), next.index().parentOf(a1));
        }
    }

    @Nested
    class Move {

        @Test
        void testMoveAfterSibling() {
            DocumentTree base = twoSections("v1");

            DocumentTree next = applier.apply(base, notice("v2", "v1",
                    Operation.move(0, "1003-1", Position.after("1003-2")))).tree();

            assertEquals(List.of("Second", "First"), sectionTexts(next));
            assertEquals("Scope of the part.", next.resolve("1003-2-a").content().text());

            TreeDiff diff = differ.diff(base, next);
            assertEquals(List.of(ChangeKind.MOVED, ChangeKind.MOVED),
                    diff.changes().stream().map(Change::kind).toList());
        }

        @Test
        void testMoveBetweenParents() {
            DocumentTree base = tree("v1", part(section("One", paragraph("p1")), section("Two", paragraph("p2"))));

            DocumentTree next = applier.apply(base, notice("v2", "v1",
                    Operation.move(0, "1003-2-a", Position.after("1003-1-a")))).tree();

            assertEquals("p2", next.resolve("1003-1-b").content().text());
            assertFalse(next.resolve("1003-2").hasChildren());
        }

        @Test
        void testMoveIntoOwnSubtree() {
            DocumentTree base = tree("v1", part(section("One", paragraph("p1", paragraph("p1-1")))));

            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> applier.apply(base,
                    notice("v2", "v1", Operation.move(0, "1003-1-a", Position.childOf("1003-1-a-1")))));
            assertEquals(RegmlErrorCode.STRUCTURAL_CONFLICT, e.getCode());
            assertEquals("destination 1003-1-a-1 lies inside the moved subtree", e.getContext().get("reason"));
        }
    }

    @Nested
    class Atomicity {

        @Test
        void testEmptyNoticeOnlyChangesVersion() {
            DocumentTree base = twoSections("v1");

            ApplyResult result = applier.apply(base, notice("v2", "v1"));

            assertEquals("v2", result.tree().version());
            assertTrue(base.root().structurallyEquals(result.tree().root()));
            assertEquals(base.index().labels(), result.tree().index().labels());
            assertTrue(result.relabels().isEmpty());
            assertTrue(differ.diff(base, result.tree()).isEmpty());
        }

        @Test
        void testFailedOperationLeavesInputUntouched() {
            DocumentTree base = twoSections("v1");

            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> applier.apply(base,
                    notice("v2", "v1",
                            Operation.replace(0, "1003-1", section("Rewritten")),
                            Operation.delete(1, "1003-9"))));

            assertEquals(RegmlErrorCode.UNRESOLVED_TARGET, e.getCode());
            assertEquals(1, e.getOperationIndex());
            assertEquals("1003-9", e.getLabel());
            assertEquals("v1", e.getContext().get("version"));
            assertEquals("First", base.resolve("1003-1").content().text());
            assertEquals("v1", base.version());
        }

        @Test
        void testVersionMismatch() {
            DocumentTree base = twoSections("v1");

            RegmlChangeException e = assertThrows(RegmlChangeException.class,
                    () -> applier.apply(base, notice("v3", "v2", Operation.delete(0, "1003-2"))));
            assertEquals(RegmlErrorCode.VERSION_MISMATCH, e.getCode());
            assertEquals("v2", e.getContext().get("appliesTo"));
        }

        @Test
        void testPayloadKindMustMatchStructure() {
            DocumentTree base = twoSections("v1");
            Node subpart = Node.builder(NodeKind.SUBPART).marker("Subpart-A").build();

            assertThrows(RegmlChangeException.class, () -> applier.apply(base,
                    notice("v2", "v1", Operation.replace(0, "1003-1-a", subpart))));
        }
    }
}
