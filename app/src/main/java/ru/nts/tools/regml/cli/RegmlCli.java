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
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import ru.nts.tools.regml.core.RegmlException;
import ru.nts.tools.regml.core.RegmlSettings;
import ru.nts.tools.regml.io.DocumentReader;
import ru.nts.tools.regml.io.NoticeReader;

import java.io.PrintWriter;
import java.nio.file.Path;

/**
 * Точка входа командной строки.
 *
 * <p>Коды завершения: 0 - успех, 1 - ошибка движка (с сообщением и подсказкой),
 * 2 - ошибка аргументов.
 */
@Command(
        name = "regml",
        mixinStandardHelpOptions = true,
        version = "regml 1.0.0",
        description = "Versioned regulation trees: validation, notice application and diffs.",
        subcommands = {
                HelpCommand.class,
                ValidateCommand.class,
                CheckTermsCommand.class,
                CheckInterpTargetsCommand.class,
                CheckChangesCommand.class,
                NoticeChangesCommand.class,
                ApplyNoticeCommand.class,
                ApplyNoticesCommand.class,
                ApplyThroughCommand.class,
                VersionsCommand.class,
                DiffCommand.class,
                JsonCommand.class
        })
public class RegmlCli {

    private static final Logger log = LoggerFactory.getLogger(RegmlCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ENGINE = 1;

    private RegmlSettings settings;
    private final DocumentReader documentReader = new DocumentReader();
    private final NoticeReader noticeReader = new NoticeReader();

    public RegmlCli() {
    }

    RegmlCli(RegmlSettings settings) {
        this.settings = settings;
    }

    public static void main(String[] args) {
        System.exit(newCommandLine(new RegmlCli()).execute(args));
    }

    /**
     * Командная строка с обработчиком ошибок движка.
     */
    static CommandLine newCommandLine(RegmlCli cli) {
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionExceptionHandler((e, cmd, parseResult) -> {
            PrintWriter err = cmd.getErr();
            if (e instanceof RegmlException regml) {
                log.debug("Command failed: {}", regml.toLogMessage());
                err.println(regml.toUserMessage());
            } else {
                log.error("Unexpected failure", e);
                err.println("Unexpected error: " + e);
            }
            err.flush();
            return EXIT_ENGINE;
        });
        return commandLine;
    }

    synchronized RegmlSettings settings() {
        if (settings == null) {
            settings = RegmlSettings.load();
        }
        return settings;
    }

    DocumentReader documentReader() {
        return documentReader;
    }

    NoticeReader noticeReader() {
        return noticeReader;
    }

    Path regulationFile(String name) {
        return settings().findRegulationFile(name);
    }

    Path noticeFile(String name) {
        return settings().findNoticeFile(name);
    }
}
