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
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import ru.nts.tools.regml.changes.ApplyResult;
import ru.nts.tools.regml.changes.ChangesetApplier;
import ru.nts.tools.regml.changes.Notice;
import ru.nts.tools.regml.changes.Relabel;
import ru.nts.tools.regml.diff.TreeDiff;
import ru.nts.tools.regml.diff.VersionDiffer;
import ru.nts.tools.regml.io.DocumentWriter;
import ru.nts.tools.regml.tree.DocumentTree;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Применение одного уведомления к версии регуляции. Результат записывается
 * в {@code <root>/regulation/<part>/<notice>.json} (или в {@code --output}).
 */
@Command(name = "apply-notice", mixinStandardHelpOptions = true,
        description = "Apply one notice to a regulation version and write the new version.")
class ApplyNoticeCommand implements Callable<Integer> {

    @ParentCommand
    private RegmlCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "REGULATION", description = "Regulation version file")
    private String regulation;

    @Parameters(index = "1", paramLabel = "NOTICE", description = "Notice file")
    private String notice;

    @Option(names = "--expected", paramLabel = "FILE",
            description = "Independently produced version to verify the result against")
    private String expected;

    @Option(names = "--dry-run", description = "Apply and report without writing")
    private boolean dryRun;

    @Option(names = "--output", paramLabel = "FILE", description = "Write the new version here")
    private Path output;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        DocumentTree tree = parent.documentReader().read(parent.regulationFile(regulation));
        Notice parsed = parent.noticeReader().read(parent.noticeFile(notice));

        ApplyResult result = new ChangesetApplier().apply(tree, parsed);
        VersionDiffer differ = new VersionDiffer();
        if (expected != null) {
            DocumentTree reference = parent.documentReader().read(parent.regulationFile(expected));
            differ.verify(result.tree(), reference, parsed.documentNumber());
            out.println("Result matches " + expected);
        }

        for (Relabel relabel : result.relabels()) {
            out.println("  " + relabel);
        }
        TreeDiff diff = differ.diff(tree, result.tree());
        out.println(tree.version() + " -> " + result.tree().version() + ": " + diff.size() + " changes");

        if (!dryRun) {
            Path target = output != null
                    ? output
                    : parent.settings().regulationDir(result.tree().part()).resolve(result.tree().version() + ".json");
            new DocumentWriter().write(result.tree(), target);
            out.println("Written " + target);
        }
        out.flush();
        return RegmlCli.EXIT_OK;
    }
}
