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
package ru.nts.tools.regml.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import ru.nts.tools.regml.Fixtures;
import ru.nts.tools.regml.core.Json;
import ru.nts.tools.regml.tree.DocumentTree;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    private final DocumentWriter writer = new DocumentWriter();

    @Test
    void testWrittenVersionReadsBack() throws IOException {
        DocumentTree tree = new DocumentReader().read(Fixtures.path(Fixtures.REGULATION));
        Path target = tempDir.resolve("regulation/1003/2011-31714.json");

        writer.write(tree, target);
        DocumentReader.Loaded loaded = new DocumentReader().load(target);

        assertTrue(Files.exists(target));
        assertFalse(Files.exists(target.resolveSibling("2011-31714.json.tmp")));
        assertTrue(loaded.warnings().isEmpty());
        assertTrue(tree.root().structurallyEquals(loaded.tree().root()));
        assertEquals(tree.index().labels(), loaded.tree().index().labels());
    }

    @Test
    void testComputedLabelsAndMarkers() throws IOException {
        DocumentTree tree = new DocumentReader().read(Fixtures.path(Fixtures.REGULATION));

        ObjectNode json = writer.toJson(tree);
        JsonNode paragraph = json.path("tree").path("children").get(1).path("children").get(1);

        assertEquals("2011-12-30", json.path("effectiveDate").asText());
        assertEquals("1003-2-b", paragraph.path("label").asText());
        assertEquals("b", paragraph.path("marker").asText());
        assertEquals("internal", paragraph.path("content").path("references").get(0).path("type").asText());
        assertEquals(json, Json.mapper().readTree(writer.toString(tree)));
    }
}
