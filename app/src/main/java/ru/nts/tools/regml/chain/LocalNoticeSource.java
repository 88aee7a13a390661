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
package ru.nts.tools.regml.chain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.nts.tools.regml.changes.Notice;
import ru.nts.tools.regml.core.RegmlFileException;
import ru.nts.tools.regml.core.RegmlSettings;
import ru.nts.tools.regml.io.NoticeReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Уведомления из каталога данных: {@code <root>/notice/<part>/*.json}.
 */
public final class LocalNoticeSource implements NoticeSource {

    private static final Logger log = LoggerFactory.getLogger(LocalNoticeSource.class);

    private final RegmlSettings settings;
    private final NoticeReader reader;
    private final Map<String, Path> files = new ConcurrentHashMap<>();

    public LocalNoticeSource(RegmlSettings settings, NoticeReader reader) {
        this.settings = settings;
        this.reader = reader;
    }

    @Override
    public List<NoticeListing> listings(String title, String part) {
        Path dir = settings.noticeDir(part);
        if (!Files.isDirectory(dir)) {
            log.warn("No notice directory for part {}: {}", part, dir);
            return List.of();
        }
        List<Path> paths;
        try (Stream<Path> stream = Files.list(dir)) {
            paths = stream.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().toList();
        } catch (IOException e) {
            throw RegmlFileException.notReadable(dir, e);
        }
        List<NoticeListing> listings = new ArrayList<>(paths.size());
        for (Path path : paths) {
            Notice notice = reader.read(path);
            files.put(key(part, notice.documentNumber()), path);
            listings.add(NoticeListing.from(notice));
        }
        log.debug("Found {} notices for {} CFR {}", listings.size(), title, part);
        return listings;
    }

    @Override
    public Notice load(String part, NoticeListing listing) {
        Path path = files.get(key(part, listing.documentNumber()));
        if (path == null) {
            path = settings.noticeDir(part).resolve(listing.documentNumber() + ".json");
        }
        return reader.read(path);
    }

    private static String key(String part, String documentNumber) {
        return part + "/" + documentNumber;
    }
}
