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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.regml.changes.ChangesetApplier;
import ru.nts.tools.regml.core.RegmlErrorCode;
import ru.nts.tools.regml.core.RegmlException;
import ru.nts.tools.regml.diff.TreeDiff;
import ru.nts.tools.regml.diff.VersionDiffer;
import ru.nts.tools.regml.tree.DocumentTree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Параллельное выполнение независимых цепочек и независимых попарных diff.
 *
 * <p>Внутри одной цепочки применение строго последовательно. Разные цепочки
 * не разделяют изменяемого состояния (все деревья неизменяемы), поэтому
 * выполняются на общем пуле потоков. Ошибка одной цепочки фиксируется
 * в ее {@link ChainOutcome} и не отменяет остальные.
 */
public final class ChainExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChainExecutor.class);

    private final ExecutorService executor;
    private final ChangesetApplier applier;
    private final VersionDiffer differ;

    public ChainExecutor(int threads) {
        this(threads, new ChangesetApplier(), new VersionDiffer());
    }

    public ChainExecutor(int threads, ChangesetApplier applier, VersionDiffer differ) {
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads));
        this.applier = applier;
        this.differ = differ;
    }

    /**
     * Материализует все цепочки. Результаты в порядке заданий.
     */
    public List<ChainOutcome> runAll(List<ChainJob> jobs) {
        List<Future<ChainOutcome>> futures = jobs.stream()
                .map(job -> executor.submit(() -> run(job)))
                .toList();

        List<ChainOutcome> outcomes = new ArrayList<>(jobs.size());
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(futures.get(i)));
        }
        return outcomes;
    }

    /**
     * Попарные diff соседних версий, вычисляемые параллельно. Порядок сохраняется.
     */
    public List<TreeDiff> diffAdjacent(List<DocumentTree> trees) {
        List<Future<TreeDiff>> futures = new ArrayList<>();
        for (int i = 0; i + 1 < trees.size(); i++) {
            DocumentTree left = trees.get(i);
            DocumentTree right = trees.get(i + 1);
            futures.add(executor.submit(() -> differ.diff(left, right)));
        }
        List<TreeDiff> diffs = new ArrayList<>(futures.size());
        for (Future<TreeDiff> future : futures) {
            diffs.add(await(future));
        }
        return diffs;
    }

    private ChainOutcome run(ChainJob job) {
        List<DocumentTree> versions = Collections.synchronizedList(new ArrayList<>());
        try {
            job.chain().materialize(job.baseline(), applier, job.loader(), job.verifier(), versions::add);
            return new ChainOutcome(job.title(), job.part(), versions, null);
        } catch (RegmlException e) {
            log.error("Chain {} CFR {} failed: {}", job.title(), job.part(), e.toLogMessage());
            return new ChainOutcome(job.title(), job.part(), versions, e);
        } catch (RuntimeException e) {
            log.error("Chain {} CFR {} failed unexpectedly", job.title(), job.part(), e);
            return new ChainOutcome(job.title(), job.part(), versions,
                    new RegmlException(RegmlErrorCode.INTERNAL_ERROR, e));
        }
    }

    private static <T> T await(Future<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegmlException(RegmlErrorCode.INTERNAL_ERROR, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new RegmlException(RegmlErrorCode.INTERNAL_ERROR, e.getCause());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
