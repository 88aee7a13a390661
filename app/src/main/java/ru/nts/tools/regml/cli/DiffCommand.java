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
import ru.nts.tools.regml.core.Json;
import ru.nts.tools.regml.diff.Change;
import ru.nts.tools.regml.diff.TreeDiff;
import ru.nts.tools.regml.diff.VersionDiffer;
import ru.nts.tools.regml.io.JsonExporter;
import ru.nts.tools.regml.tree.DocumentTree;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "diff", mixinStandardHelpOptions = true,
        description = "Show the structural changes between two regulation versions.")
class DiffCommand implements Callable<Integer> {

    @ParentCommand
    private RegmlCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "LEFT", description = "Older version file")
    private String left;

    @Parameters(index = "1", paramLabel = "RIGHT", description = "Newer version file")
    private String right;

    @Option(names = "--json", description = "Print the changes as JSON")
    private boolean json;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        DocumentTree a = parent.documentReader().read(parent.regulationFile(left));
        DocumentTree b = parent.documentReader().read(parent.regulationFile(right));
        TreeDiff diff = new VersionDiffer().diff(a, b);

        if (json) {
            out.println(Json.pretty(new JsonExporter().toJson(diff)));
        } else {
            out.println(diff.fromVersion() + " -> " + diff.toVersion() + ": " + diff.size() + " changes");
            for (Change change : diff.changes()) {
                out.println("  " + change);
            }
        }
        out.flush();
        return RegmlCli.EXIT_OK;
    }
}
