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
import ru.nts.tools.regml.io.DocumentWriter;
import ru.nts.tools.regml.tree.DocumentTree;
import ru.nts.tools.regml.validation.TermCandidate;
import ru.nts.tools.regml.validation.TermFixPolicy;
import ru.nts.tools.regml.validation.TermReferenceFixer;
import ru.nts.tools.regml.validation.TermScanner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Поиск неоформленных вхождений терминов. Решения принимает пользователь
 * (или флаг {@code --apply-all}); исправленная версия записывается на место исходной.
 */
@Command(name = "check-terms", mixinStandardHelpOptions = true,
        description = "Find defined terms used without a reference and offer to add the references.")
class CheckTermsCommand implements Callable<Integer> {

    @ParentCommand
    private RegmlCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Regulation file")
    private String file;

    @Option(names = "--label", description = "Only check this label and its descendants")
    private String label;

    @Option(names = "--term", description = "Only check this term")
    private String term;

    @Option(names = "--apply-all", description = "Add every suggested reference without asking")
    private boolean applyAll;

    @Option(names = "--dry-run", description = "List candidates only")
    private boolean dryRun;

    @Override
    public Integer call() throws IOException {
        PrintWriter out = spec.commandLine().getOut();
        Path path = parent.regulationFile(file);
        DocumentTree tree = parent.documentReader().read(path);

        List<TermCandidate> candidates = new TermScanner(parent.settings().singularExceptions())
                .scan(tree, label, term);
        out.println(candidates.size() + " unreferenced term occurrences");
        if (dryRun || candidates.isEmpty()) {
            for (TermCandidate candidate : candidates) {
                out.println("  " + describe(candidate));
            }
            out.flush();
            return RegmlCli.EXIT_OK;
        }

        TermFixPolicy policy = applyAll
                ? TermFixPolicy.fixed(TermFixPolicy.Decision.APPLY)
                : new ConsolePolicy(out, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
        TermReferenceFixer.FixResult result = new TermReferenceFixer().apply(tree, candidates, policy);
        if (result.applied() > 0) {
            new DocumentWriter().write(result.tree(), path);
        }
        out.println(result.applied() + " references added, " + result.skipped() + " skipped");
        out.flush();
        return RegmlCli.EXIT_OK;
    }

    static String describe(TermCandidate candidate) {
        return candidate.occurrenceLabel() + " @" + candidate.offset() + ": \"" + candidate.text()
                + "\" -> " + candidate.definedIn();
    }

    /**
     * Интерактивная политика: y - добавить, n - пропустить, a - всегда, v - никогда.
     */
    static final class ConsolePolicy implements TermFixPolicy {
        private final PrintWriter out;
        private final BufferedReader in;

        ConsolePolicy(PrintWriter out, BufferedReader in) {
            this.out = out;
            this.in = in;
        }

        @Override
        public Decision decide(TermCandidate candidate) {
            while (true) {
                out.print(describe(candidate) + "  [y]es/[n]o/[a]lways/ne[v]er: ");
                out.flush();
                String answer;
                try {
                    answer = in.readLine();
                } catch (IOException e) {
                    throw new IllegalStateException("Cannot read answer", e);
                }
                if (answer == null) {
                    return Decision.NEVER;
                }
                switch (answer.trim().toLowerCase(Locale.ROOT)) {
                    case "y":
                        return Decision.APPLY;
                    case "n":
                        return Decision.IGNORE;
                    case "a":
                        return Decision.ALWAYS;
                    case "v":
                        return Decision.NEVER;
                    default:
                        out.println("Please answer y, n, a or v.");
                }
            }
        }
    }
}
