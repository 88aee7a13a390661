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
import ru.nts.tools.regml.tree.DocumentTree;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static ru.nts.tools.regml.tree.TreeFixtures.*;

class ChangesetParserTest {

    private final ChangesetParser parser = new ChangesetParser();

    private static Notice notice(Operation... operations) {
        return new Notice("2012-100", LocalDate.of(2012, 3, 1), "v1", Arrays.asList(operations));
    }

    private static List<Integer> order(List<Operation> operations) {
        return operations.stream().map(Operation::index).toList();
    }

    @Nested
    class Shape {

        @Test
        void testInsertRequiresPayload() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class,
                    () -> parser.validate(notice(Operation.insert(0, "1003-3", Position.after("1003-2"), null))));
            assertEquals(RegmlErrorCode.MALFORMED_OPERATION, e.getCode());
            assertEquals("payload", e.getContext().get("field"));
            assertEquals(0, e.getOperationIndex());
        }

        @Test
        void testDeleteRejectsPosition() {
            Operation op = new Operation(1, OperationKind.DELETE, "1003-2", Position.after("1003-1"), null);
            RegmlChangeException e = assertThrows(RegmlChangeException.class,
                    () -> parser.validate(notice(Operation.delete(0, "1003-1"), op)));
            assertEquals("position", e.getContext().get("field"));
            assertEquals(1, e.getOperationIndex());
        }

        @Test
        void testMoveRequiresAnchor() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class,
                    () -> parser.validate(notice(Operation.move(0, "1003-1", new Position(Placement.AFTER, null)))));
            assertEquals("position.anchor", e.getContext().get("field"));
        }

        @Test
        void testUnknownKind() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class,
                    () -> parser.validate(notice(new Operation(0, null, "1003-1", null, null))));
            assertEquals(RegmlErrorCode.MALFORMED_OPERATION, e.getCode());
            assertEquals("kind", e.getContext().get("field"));
        }

        @Test
        void testMissingTarget() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class,
                    () -> parser.validate(notice(Operation.delete(0, " "))));
            assertEquals("targetLabel", e.getContext().get("field"));
        }
    }

    @Nested
    class Duplicates {

        @Test
        void testTwoOperationsOnOneTarget() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> parser.validate(notice(
                    Operation.delete(0, "1003-2"),
                    Operation.replace(1, "1003-2", section("Other")))));
            assertEquals(RegmlErrorCode.DUPLICATE_TARGET, e.getCode());
            assertEquals(0, e.getContext().get("first"));
            assertEquals(1, e.getOperationIndex());
        }

        @Test
        void testTwoInsertsAtOnePoint() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> parser.validate(notice(
                    Operation.insert(0, "1003-2", Position.after("1003-1"), section("A")),
                    Operation.insert(1, "1003-3", Position.after("1003-1"), section("B")))));
            assertEquals(RegmlErrorCode.DUPLICATE_TARGET, e.getCode());
            assertEquals("after", e.getContext().get("placement"));
        }

        @Test
        void testAfterAndBeforeNeighboursAreOnePoint() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> parser.validate(notice(
                    Operation.insert(0, "1003-2", Position.after("1003-1"), section("A")),
                    Operation.insert(1, "1003-3", Position.before("1003-2"), section("B"))),
                    twoSections("v1").index()));
            assertEquals(RegmlErrorCode.DUPLICATE_TARGET, e.getCode());
            assertEquals(1, e.getOperationIndex());
        }

        @Test
        void testDistinctGapsDoNotConflict() {
            assertDoesNotThrow(() -> parser.validate(notice(
                    Operation.insert(0, "1003-1", Position.before("1003-1"), section("A")),
                    Operation.insert(1, "1003-3", Position.after("1003-1"), section("B"))),
                    twoSections("v1").index()));
        }

        @Test
        void testChildOfInsertsMayShareParent() {
            assertDoesNotThrow(() -> parser.validate(notice(
                    Operation.insert(0, "1003-3", Position.childOf("1003"), section("A")),
                    Operation.insert(1, "1003-4", Position.childOf("1003"), section("B")))));
        }
    }

    @Nested
    class Ordering {

        @Test
        void testIndependentOperationsKeepAuthoredOrder() {
            List<Operation> ordered = parser.parse(notice(
                    Operation.replace(0, "1003-2", section("Two")),
                    Operation.replace(1, "1003-1", section("One")),
                    Operation.delete(2, "1003-3")));

            assertEquals(List.of(0, 1, 2), order(ordered));
        }

        @Test
        void testEditInsideDeletedSubtreeRunsFirst() {
            List<Operation> ordered = parser.parse(notice(
                    Operation.delete(0, "1003-1"),
                    Operation.replace(1, "1003-1-a", paragraph("Edited"))));

            assertEquals(List.of(1, 0), order(ordered));
        }

        @Test
        void testInsertNextToDeletedNodeRunsFirst() {
            List<Operation> ordered = parser.parse(notice(
                    Operation.delete(0, "1003-2"),
                    Operation.insert(1, "1003-3", Position.after("1003-2"), section("New"))));

            assertEquals(List.of(1, 0), order(ordered));
        }

        @Test
        void testReserveBeforeFill() {
            List<Operation> ordered = parser.parse(notice(
                    Operation.insert(0, "1003-2", Position.before("1003-2"), section("Filled")),
                    Operation.reserve(1, "1003-2")));

            assertEquals(List.of(1, 0), order(ordered));
        }

        @Test
        void testHierarchyFromIndex() {
            // Подраздел не входит в префикс меток секций: вложенность берется из индекса
            DocumentTree tree = tree("v1", part(subpart("Subpart-A", section("One"), section("Two"))));
            List<Operation> ordered = parser.parse(notice(
                    Operation.delete(0, "1003-Subpart-A"),
                    Operation.replace(1, "1003-2", section("Edited"))), tree.index());

            assertEquals(List.of(1, 0), order(ordered));
        }

        @Test
        void testMoveOutOfDeletedSubtree() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> parser.parse(notice(
                    Operation.delete(0, "1003-1"),
                    Operation.move(1, "1003-1-a", Position.childOf("1003-2")))));
            assertEquals(RegmlErrorCode.STRUCTURAL_CONFLICT, e.getCode());
            assertEquals(1, e.getOperationIndex());
        }

        @Test
        void testInsertUnderReplacedNode() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> parser.parse(notice(
                    Operation.replace(0, "1003-2", section("Rewritten")),
                    Operation.insert(1, "1003-2-a", Position.childOf("1003-2"), paragraph("x")))));
            assertEquals(RegmlErrorCode.STRUCTURAL_CONFLICT, e.getCode());
            assertEquals(1, e.getOperationIndex());
        }

        @Test
        void testInsertUnderReservedNode() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> parser.parse(notice(
                    Operation.reserve(0, "1003-2"),
                    Operation.insert(1, "1003-2-a", Position.childOf("1003-2"), paragraph("x")))));
            assertEquals(RegmlErrorCode.STRUCTURAL_CONFLICT, e.getCode());
            assertEquals(1, e.getOperationIndex());
        }

        @Test
        void testInsertBesideChildOfReplacedNode() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> parser.parse(notice(
                    Operation.replace(0, "1003-1", section("Rewritten")),
                    Operation.insert(1, "1003-1-b", Position.after("1003-1-a"), paragraph("x")))));
            assertEquals(RegmlErrorCode.STRUCTURAL_CONFLICT, e.getCode());
        }

        @Test
        void testInsertInsideDeletedNodeIsAllowed() {
            List<Operation> ordered = parser.parse(notice(
                    Operation.delete(0, "1003-1"),
                    Operation.insert(1, "1003-1-b", Position.after("1003-1-a"), paragraph("x"))));

            assertEquals(List.of(1, 0), order(ordered));
        }

        @Test
        void testMoveIntoDeletedSubtree() {
            RegmlChangeException e = assertThrows(RegmlChangeException.class, () -> parser.parse(notice(
                    Operation.move(0, "1003-2-a", Position.childOf("1003-1")),
                    Operation.delete(1, "1003-1"))));
            assertEquals(RegmlErrorCode.STRUCTURAL_CONFLICT, e.getCode());
            assertTrue(String.valueOf(e.getContext().get("reason")).startsWith("destination 1003-1"));
        }
    }

    @Test
    void testDescribe() {
        List<String> lines = parser.describe(notice(
                Operation.insert(0, "1003-3", Position.after("1003-2"), section("New", paragraph("Text"))),
                Operation.delete(1, "1003-1")));

        assertEquals("Notice 2012-100 (effective 2012-03-01, applies to v1): 2 operations", lines.get(0));
        assertEquals("  #0 insert 1003-3 after 1003-2 [section, 2 nodes]", lines.get(1));
        assertEquals("  #1 delete 1003-1", lines.get(2));
    }
}
