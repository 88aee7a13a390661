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
import ru.nts.tools.regml.chain.NoticeChainResolver;
import ru.nts.tools.regml.chain.NoticeListing;
import ru.nts.tools.regml.chain.VersionChain;
import ru.nts.tools.regml.changes.ChangesetApplier;
import ru.nts.tools.regml.changes.Notice;
import ru.nts.tools.regml.io.DocumentWriter;
import ru.nts.tools.regml.tree.DocumentTree;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Применение нескольких уведомлений к версии части. Порядок применения определяется
 * датами вступления в силу и связями appliesToVersion, а не порядком аргументов.
 */
@Command(name = "apply-notices", mixinStandardHelpOptions = true,
        description = "Apply several notices, in chain order, starting from a regulation version.")
class ApplyNoticesCommand implements Callable<Integer> {

    @ParentCommand
    private RegmlCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "PART", description = "Regulation part")
    private String part;

    @Parameters(index = "1", paramLabel = "VERSION", description = "Starting version")
    private String version;

    @Parameters(index = "2..*", arity = "1..*", paramLabel = "NOTICE", description = "Notice files")
    private List<String> notices;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        DocumentTree baseline = parent.documentReader().read(parent.regulationFile(part + "/" + version));

        Map<String, Notice> byNumber = new LinkedHashMap<>();
        for (String name : notices) {
            Notice notice = parent.noticeReader().read(noticeFile(name));
            byNumber.put(notice.documentNumber(), notice);
        }
        List<NoticeListing> listings = byNumber.values().stream().map(NoticeListing::from).toList();
        VersionChain chain = new NoticeChainResolver().resolve(part, version, listings);

        DocumentWriter writer = new DocumentWriter();
        List<DocumentTree> versions = chain.materialize(baseline, new ChangesetApplier(),
                listing -> byNumber.get(listing.documentNumber()));
        for (DocumentTree tree : versions.subList(1, versions.size())) {
            Path target = parent.settings().regulationDir(part).resolve(tree.version() + ".json");
            writer.write(tree, target);
            out.println("Written " + target);
        }
        out.println(part + ": " + version + " -> " + chain.finalVersion());
        out.flush();
        return RegmlCli.EXIT_OK;
    }

    private Path noticeFile(String name) {
        Path inPart = parent.settings().noticeDir(part).resolve(name.endsWith(".json") ? name : name + ".json");
        return inPart.toFile().isFile() ? inPart : parent.noticeFile(name);
    }
}
