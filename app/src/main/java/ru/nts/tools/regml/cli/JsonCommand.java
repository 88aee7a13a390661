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
import ru.nts.tools.regml.chain.ChainExecutor;
import ru.nts.tools.regml.diff.TreeDiff;
import ru.nts.tools.regml.io.JsonExporter;
import ru.nts.tools.regml.tree.DocumentTree;
import ru.nts.tools.regml.validation.Diagnostic;
import ru.nts.tools.regml.validation.ReferenceValidator;
import ru.nts.tools.regml.validation.TermCandidate;
import ru.nts.tools.regml.validation.TermScanner;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Экспорт версий в JSON для внешних потребителей. Версии экспортируются в порядке
 * аргументов; для нескольких версий к каждой прикладывается diff к следующей.
 * Перед экспортом каждая версия проходит проверку ссылок и ключевых терминов.
 */
@Command(name = "json", mixinStandardHelpOptions = true,
        description = "Export regulation versions, with diffs between adjacent versions, as JSON.")
class JsonCommand implements Callable<Integer> {

    @ParentCommand
    private RegmlCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Regulation version files, oldest first")
    private List<String> files;

    @Option(names = "--output", paramLabel = "DIR", description = "Output directory (default: regml.json.root)")
    private Path output;

    @Option(names = "--check-terms", description = "Also list defined terms used without a reference")
    private boolean checkTerms;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<DocumentTree> trees = new ArrayList<>(files.size());
        ReferenceValidator references = new ReferenceValidator(parent.settings().singularExceptions());
        for (String file : files) {
            DocumentTree tree = parent.documentReader().read(parent.regulationFile(file));
            // Проблемы в ссылках не мешают экспорту, они только печатаются
            List<Diagnostic> diagnostics = new ArrayList<>(references.validateTerms(tree));
            diagnostics.addAll(references.validateInternalCitations(tree));
            diagnostics.addAll(references.validateKeyterms(tree));
            for (Diagnostic diagnostic : diagnostics) {
                if (diagnostic.severity().isProblem()) {
                    out.println(tree.version() + ": " + diagnostic);
                }
            }
            if (checkTerms) {
                List<TermCandidate> candidates = new TermScanner(parent.settings().singularExceptions())
                        .scan(tree, null, null);
                out.println(tree.version() + ": " + candidates.size() + " unreferenced term occurrences");
                for (TermCandidate candidate : candidates) {
                    out.println("  " + CheckTermsCommand.describe(candidate));
                }
            }
            trees.add(tree);
        }

        List<TreeDiff> diffs;
        try (ChainExecutor executor = new ChainExecutor(parent.settings().threads())) {
            diffs = executor.diffAdjacent(trees);
        }

        Path dir = output != null ? output : parent.settings().jsonRoot();
        for (Path written : new JsonExporter().write(dir, trees, diffs)) {
            out.println("Written " + written);
        }
        out.flush();
        return RegmlCli.EXIT_OK;
    }
}
