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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;
import ru.nts.tools.regml.chain.LocalNoticeSource;
import ru.nts.tools.regml.chain.NoticeChainResolver;
import ru.nts.tools.regml.chain.NoticeListing;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "versions", mixinStandardHelpOptions = true,
        description = "List the known notices of a part in chain order.")
class VersionsCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(VersionsCommand.class);

    @ParentCommand
    private RegmlCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "TITLE", description = "Regulation title")
    private String title;

    @Parameters(index = "1", paramLabel = "PART", description = "Regulation part")
    private String part;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<NoticeListing> listings = new ArrayList<>(
                new LocalNoticeSource(parent.settings(), parent.noticeReader()).listings(title, part));
        listings.sort(NoticeListing.CHRONOLOGICAL);
        for (NoticeListing listing : listings) {
            out.println(listing.documentNumber() + "  effective " + listing.effectiveDate()
                    + "  applies to " + listing.appliesToVersion());
        }
        for (String warning : new NoticeChainResolver().inspect(listings)) {
            log.warn("{} CFR {}: {}", title, part, warning);
            out.println("WARNING: " + warning);
        }
        out.flush();
        return RegmlCli.EXIT_OK;
    }
}
