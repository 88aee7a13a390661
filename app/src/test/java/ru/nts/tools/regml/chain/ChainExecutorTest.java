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
package ru.nts.tools.regml.chain;

import org.junit.jupiter.api.Test;
import ru.nts.tools.regml.changes.ChangesetApplier;
import ru.nts.tools.regml.changes.Notice;
import ru.nts.tools.regml.changes.Operation;
import ru.nts.tools.regml.changes.Position;
import ru.nts.tools.regml.core.RegmlChainException;
import ru.nts.tools.regml.core.RegmlErrorCode;
import ru.nts.tools.regml.core.RegmlException;
import ru.nts.tools.regml.diff.ChangeKind;
import ru.nts.tools.regml.diff.TreeDiff;
import ru.nts.tools.regml.diff.VersionDiffer;
import ru.nts.tools.regml.tree.DocumentTree;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static ru.nts.tools.regml.tree.TreeFixtures.*;

class ChainExecutorTest {

    private static final Notice INSERT = new Notice("n1", LocalDate.of(2012, 1, 1), "v0", List.of(
            Operation.insert(0, "1003-3", Position.childOf("1003"), section("Third"))));
    private static final Notice DELETE = new Notice("n2", LocalDate.of(2012, 6, 1), "n1", List.of(
            Operation.delete(0, "1003-1")));
    private static final Notice BROKEN = new Notice("n2", LocalDate.of(2012, 6, 1), "n1", List.of(
            Operation.delete(0, "1003-9")));

    private static VersionChain chainOf(Notice... notices) {
        List<NoticeListing> listings = new ArrayList<>();
        for (Notice notice : notices) {
            listings.add(NoticeListing.from(notice));
        }
        return new NoticeChainResolver().resolve(PART, "v0", listings);
    }

    @Test
    void testMaterialize() {
        VersionChain chain = chainOf(INSERT, DELETE);
        Map<String, Notice> notices = Map.of("n1", INSERT, "n2", DELETE);

        List<DocumentTree> versions = chain.materialize(twoSections("v0"), new ChangesetApplier(),
                listing -> notices.get(listing.documentNumber()));

        assertEquals(List.of("v0", "n1", "n2"), versions.stream().map(DocumentTree::version).toList());
        assertEquals("Second", versions.get(2).resolve("1003-1").content().text());
        assertEquals("Third", versions.get(2).resolve("1003-2").content().text());
    }

    @Test
    void testFailuresAreIsolated() {
        Map<String, Notice> good = Map.of("n1", INSERT, "n2", DELETE);
        Map<String, Notice> bad = Map.of("n1", INSERT, "n2", BROKEN);
        List<ChainJob> jobs = List.of(
                new ChainJob(TITLE, "1003", twoSections("v0"), chainOf(INSERT, BROKEN),
                        listing -> bad.get(listing.documentNumber())),
                new ChainJob(TITLE, "1002", twoSections("v0"), chainOf(INSERT, DELETE),
                        listing -> good.get(listing.documentNumber())));

        List<ChainOutcome> outcomes;
        try (ChainExecutor executor = new ChainExecutor(2)) {
            outcomes = executor.runAll(jobs);
        }

        ChainOutcome failed = outcomes.get(0);
        assertFalse(failed.isSuccess());
        assertEquals(RegmlErrorCode.UNRESOLVED_TARGET, ((RegmlException) failed.failure()).getCode());
        // Версии до ошибочного шага сохраняются
        assertEquals("n1", failed.last().version());

        ChainOutcome succeeded = outcomes.get(1);
        assertTrue(succeeded.isSuccess());
        assertEquals("1002", succeeded.part());
        assertEquals("n2", succeeded.last().version());
    }

    @Test
    void testUnexpectedFailureWrapped() {
        List<ChainJob> jobs = List.of(new ChainJob(TITLE, PART, twoSections("v0"), chainOf(INSERT),
                listing -> {
                    throw new IllegalStateException("source unavailable");
                }));

        List<ChainOutcome> outcomes;
        try (ChainExecutor executor = new ChainExecutor(1)) {
            outcomes = executor.runAll(jobs);
        }

        RegmlException failure = (RegmlException) outcomes.get(0).failure();
        assertEquals(RegmlErrorCode.INTERNAL_ERROR, failure.getCode());
        assertInstanceOf(IllegalStateException.class, failure.getCause());
    }

    @Test
    void testVerificationStopsChain() {
        DocumentTree unexpected = tree("n1", part(section("Something else")));
        StepVerifier verifier = StepVerifier.against(new VersionDiffer(),
                version -> version.equals("n1") ? Optional.of(unexpected) : Optional.empty());
        Map<String, Notice> notices = Map.of("n1", INSERT, "n2", DELETE);
        List<ChainJob> jobs = List.of(new ChainJob(TITLE, PART, twoSections("v0"), chainOf(INSERT, DELETE),
                listing -> notices.get(listing.documentNumber()), verifier));

        List<ChainOutcome> outcomes;
        try (ChainExecutor executor = new ChainExecutor(1)) {
            outcomes = executor.runAll(jobs);
        }

        RegmlChainException failure = (RegmlChainException) outcomes.get(0).failure();
        assertEquals(RegmlErrorCode.VERIFICATION_FAILED, failure.getCode());
        assertEquals(1, outcomes.get(0).versions().size());
    }

    @Test
    void testParallelDiffs() {
        DocumentTree v0 = twoSections("v0");
        DocumentTree n1 = new ChangesetApplier().apply(v0, INSERT).tree();
        DocumentTree n2 = new ChangesetApplier().apply(n1, DELETE).tree();

        List<TreeDiff> diffs;
        try (ChainExecutor executor = new ChainExecutor(2)) {
            diffs = executor.diffAdjacent(List.of(v0, n1, n2));
        }

        assertEquals(2, diffs.size());
        assertEquals("v0", diffs.get(0).fromVersion());
        assertFalse(diffs.get(0).labels(ChangeKind.ADDED).isEmpty());
        assertEquals("n2", diffs.get(1).toVersion());
    }
}
