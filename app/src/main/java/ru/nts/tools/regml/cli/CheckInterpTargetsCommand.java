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
import ru.nts.tools.regml.tree.DocumentTree;
import ru.nts.tools.regml.validation.Diagnostic;
import ru.nts.tools.regml.validation.ReferenceValidator;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "check-interp-targets", mixinStandardHelpOptions = true,
        description = "Check that every interpretation target points to an existing label.")
class CheckInterpTargetsCommand implements Callable<Integer> {

    @ParentCommand
    private RegmlCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Regulation file")
    private String file;

    @Option(names = "--label", description = "Only check this interpretation and its descendants")
    private String label;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        DocumentTree tree = parent.documentReader().read(parent.regulationFile(file));

        List<Diagnostic> diagnostics = new ReferenceValidator(parent.settings().singularExceptions())
                .validateInterpTargets(tree, label);
        for (Diagnostic diagnostic : diagnostics) {
            out.println(diagnostic);
        }
        out.flush();
        return Diagnostic.isValid(diagnostics) ? RegmlCli.EXIT_OK : RegmlCli.EXIT_ENGINE;
    }
}
