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
package ru.nts.tools.regml.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import ru.nts.tools.regml.chain.ChainExecutor;
import ru.nts.tools.regml.chain.ChainJob;
import ru.nts.tools.regml.chain.ChainOutcome;
import ru.nts.tools.regml.chain.LocalNoticeSource;
import ru.nts.tools.regml.chain.NoticeChainResolver;
import ru.nts.tools.regml.chain.NoticeListing;
import ru.nts.tools.regml.chain.StepVerifier;
import ru.nts.tools.regml.chain.VersionChain;
import ru.nts.tools.regml.core.RegmlException;
import ru.nts.tools.regml.core.RegmlSettings;
import ru.nts.tools.regml.diff.VersionDiffer;
import ru.nts.tools.regml.io.DocumentWriter;
import ru.nts.tools.regml.tree.DocumentTree;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Материализация цепочек уведомлений из локального хранилища.
 * Несколько частей обрабатываются параллельно; ошибка одной части не прерывает остальные.
 */
@Command(name = "apply-through", mixinStandardHelpOptions = true,
        description = "Apply every known notice of the given parts, optionally up to one notice.")
class ApplyThroughCommand implements Callable<Integer> {

    @ParentCommand
    private RegmlCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "TITLE", description = "Regulation title")
    private String title;

    @Parameters(index = "1..*", arity = "1..*", paramLabel = "PART", description = "Regulation parts")
    private List<String> parts;

    @Option(names = "--through", paramLabel = "DOC", description = "Stop after this notice (one part only)")
    private String through;

    @Option(names = "--baseline", paramLabel = "VERSION",
            description = "Starting version (default: the version the earliest notice applies to)")
    private String baseline;

    @Option(names = "--verify", description = "Compare each produced version with an existing file of that version")
    private boolean verify;

    @Override
    public Integer call() {
        if (through != null && parts.size() > 1) {
            throw new ParameterException(spec.commandLine(), "--through can only be used with a single part");
        }
        PrintWriter out = spec.commandLine().getOut();
        RegmlSettings settings = parent.settings();
        LocalNoticeSource source = new LocalNoticeSource(settings, parent.noticeReader());
        NoticeChainResolver resolver = new NoticeChainResolver();
        VersionDiffer differ = new VersionDiffer();

        List<ChainJob> jobs = new ArrayList<>();
        for (String part : parts) {
            List<NoticeListing> listings = source.listings(title, part);
            if (listings.isEmpty()) {
                out.println(part + ": no notices");
                continue;
            }
            String start = baseline != null
                    ? baseline
                    : listings.stream().sorted(NoticeListing.CHRONOLOGICAL).findFirst().orElseThrow().appliesToVersion();
            VersionChain chain = resolver.resolve(part, start, listings, through);
            DocumentTree tree = parent.documentReader().read(versionFile(settings, part, start));
            StepVerifier verifier = verify
                    ? StepVerifier.against(differ, version -> existing(settings, part, version))
                    : StepVerifier.NONE;
            jobs.add(new ChainJob(title, part, tree, chain, listing -> source.load(part, listing), verifier));
        }

        List<ChainOutcome> outcomes;
        try (ChainExecutor executor = new ChainExecutor(settings.threads())) {
            outcomes = executor.runAll(jobs);
        }

        DocumentWriter writer = new DocumentWriter();
        boolean failed = false;
        for (ChainOutcome outcome : outcomes) {
            List<DocumentTree> versions = outcome.versions();
            for (DocumentTree tree : versions.subList(Math.min(1, versions.size()), versions.size())) {
                writer.write(tree, versionFile(settings, outcome.part(), tree.version()));
            }
            if (outcome.isSuccess()) {
                out.println(outcome.part() + ": " + (versions.size() - 1) + " versions, now at " + outcome.last().version());
            } else {
                failed = true;
                String message = outcome.failure() instanceof RegmlException regml
                        ? regml.toUserMessage()
                        : String.valueOf(outcome.failure());
                spec.commandLine().getErr().println(outcome.part() + ": " + message);
            }
        }
        spec.commandLine().getErr().flush();
        out.flush();
        return failed ? RegmlCli.EXIT_ENGINE : RegmlCli.EXIT_OK;
    }

    private static Path versionFile(RegmlSettings settings, String part, String version) {
        return settings.regulationDir(part).resolve(version + ".json");
    }

    private Optional<DocumentTree> existing(RegmlSettings settings, String part, String version) {
        Path path = versionFile(settings, part, version);
        return Files.isRegularFile(path) ? Optional.of(parent.documentReader().read(path)) : Optional.empty();
    }
}
