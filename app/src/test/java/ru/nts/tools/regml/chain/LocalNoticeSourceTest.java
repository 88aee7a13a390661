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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.regml.Fixtures;
import ru.nts.tools.regml.changes.Notice;
import ru.nts.tools.regml.core.RegmlFileException;
import ru.nts.tools.regml.core.RegmlSettings;
import ru.nts.tools.regml.io.NoticeReader;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class LocalNoticeSourceTest {

    @TempDir
    Path tempDir;

    private LocalNoticeSource source() {
        Properties properties = new Properties();
        properties.setProperty(RegmlSettings.ROOT, tempDir.toString());
        return new LocalNoticeSource(RegmlSettings.fromProperties(properties), new NoticeReader());
    }

    @Test
    void testListingsAndLoad() {
        Fixtures.copy(Fixtures.SECOND_NOTICE, tempDir.resolve("notice/1003/2012-200.json"));
        Fixtures.copy(Fixtures.NOTICE, tempDir.resolve("notice/1003/2012-100.json"));
        LocalNoticeSource source = source();

        List<NoticeListing> listings = source.listings("12", "1003");

        assertEquals(2, listings.size());
        assertEquals("2012-100", listings.get(0).documentNumber());
        assertEquals(LocalDate.of(2012, 3, 1), listings.get(0).effectiveDate());
        assertEquals("2012-100", listings.get(1).appliesToVersion());

        Notice notice = source.load("1003", listings.get(1));
        assertEquals("2012-200", notice.documentNumber());
        assertEquals(1, notice.operations().size());
    }

    @Test
    void testListingsIgnoreOtherFiles() throws Exception {
        Fixtures.copy(Fixtures.NOTICE, tempDir.resolve("notice/1003/2012-100.json"));
        Files.writeString(tempDir.resolve("notice/1003/README.txt"), "not a notice");

        assertEquals(1, source().listings("12", "1003").size());
    }

    @Test
    void testMissingDirectory() {
        assertTrue(source().listings("12", "1010").isEmpty());
    }

    @Test
    void testLoadWithoutListing() {
        Fixtures.copy(Fixtures.NOTICE, tempDir.resolve("notice/1003/2012-100.json"));
        NoticeListing listing = new NoticeListing("2012-100", null, "2011-31714");

        assertEquals("2011-31714", source().load("1003", listing).appliesToVersion());
        assertThrows(RegmlFileException.class,
                () -> source().load("1003", new NoticeListing("2013-1", null, "x")));
    }
}
