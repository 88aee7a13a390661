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
import ru.nts.tools.regml.io.DocumentReader;
import ru.nts.tools.regml.validation.Diagnostic;
import ru.nts.tools.regml.validation.ReferenceValidator;
import ru.nts.tools.regml.validation.SchemaValidator;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Validate a regulation (or notice) file against the schema and check its references.")
class ValidateCommand implements Callable<Integer> {

    @ParentCommand
    private RegmlCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Regulation or notice file")
    private String file;

    @Option(names = "--notice", description = "Validate FILE as a notice")
    private boolean notice;

    @Option(names = "--no-terms", description = "Skip term reference checks")
    private boolean noTerms;

    @Option(names = "--no-citations", description = "Skip internal citation checks")
    private boolean noCitations;

    @Option(names = "--no-keyterms", description = "Skip paragraph keyterm checks")
    private boolean noKeyterms;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        Path path = notice ? parent.noticeFile(file) : parent.regulationFile(file);

        List<Diagnostic> diagnostics = new ArrayList<>(new SchemaValidator().validateFile(path, notice));
        if (!notice && Diagnostic.isValid(diagnostics)) {
            DocumentReader.Loaded loaded = parent.documentReader().load(path);
            for (String warning : loaded.warnings()) {
                diagnostics.add(Diagnostic.warning(warning, null));
            }
            ReferenceValidator references = new ReferenceValidator(parent.settings().singularExceptions());
            if (!noTerms) {
                diagnostics.addAll(references.validateTerms(loaded.tree()));
            }
            if (!noCitations) {
                diagnostics.addAll(references.validateInternalCitations(loaded.tree()));
            }
            if (!noKeyterms) {
                diagnostics.addAll(references.validateKeyterms(loaded.tree()));
            }
        }

        for (Diagnostic diagnostic : diagnostics) {
            out.println(diagnostic);
        }
        boolean valid = Diagnostic.isValid(diagnostics);
        out.println(valid ? "Validation successful" : "Validation failed");
        out.flush();
        return valid ? RegmlCli.EXIT_OK : RegmlCli.EXIT_ENGINE;
    }
}
