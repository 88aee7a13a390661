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
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import ru.nts.tools.regml.changes.ChangesetParser;
import ru.nts.tools.regml.changes.Notice;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "notice-changes", mixinStandardHelpOptions = true,
        description = "List the operations of a notice in authored order.")
class NoticeChangesCommand implements Callable<Integer> {

    @ParentCommand
    private RegmlCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "NOTICE", description = "Notice file")
    private String notice;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        Notice parsed = parent.noticeReader().read(parent.noticeFile(notice));
        for (String line : new ChangesetParser().describe(parsed)) {
            out.println(line);
        }
        out.flush();
        return RegmlCli.EXIT_OK;
    }
}
