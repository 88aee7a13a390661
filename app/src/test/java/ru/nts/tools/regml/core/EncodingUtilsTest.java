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
package ru.nts.tools.regml.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EncodingUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testUtf8WithBom() throws IOException {
        Path file = tempDir.resolve("bom.json");
        byte[] body = "{\"text\": \"§ 1003.2 Définitions\"}".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[body.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(body, 0, bytes, 3, body.length);
        Files.write(file, bytes);

        EncodingUtils.TextFileContent content = EncodingUtils.readTextFile(file);

        assertEquals("{\"text\": \"§ 1003.2 Définitions\"}", content.content());
        assertEquals(StandardCharsets.UTF_8, content.charset());
    }

    @Test
    void testValidUtf8WinsOverDetector() throws IOException {
        // Короткий текст с одним знаком параграфа детектор принимает за однобайтовую кодировку
        Path file = tempDir.resolve("section.json");
        Files.writeString(file, "{\"content\": \"§ 1003.1 Authority, purpose, and scope.\"}", StandardCharsets.UTF_8);

        EncodingUtils.TextFileContent content = EncodingUtils.readTextFile(file);

        assertEquals(StandardCharsets.UTF_8, content.charset());
        assertEquals("{\"content\": \"§ 1003.1 Authority, purpose, and scope.\"}", content.content());
    }

    @Test
    void testLegacyCharsetFallback() throws IOException {
        // Одиночный байт 0xA7 (знак параграфа) не является валидным UTF-8
        Path file = tempDir.resolve("legacy.json");
        Files.write(file, new byte[]{'{', '"', 0x41, (byte) 0xA7, '"', '}'});

        EncodingUtils.TextFileContent content = EncodingUtils.readTextFile(file);

        assertTrue(content.content().startsWith("{\"A"));
        assertNotEquals(StandardCharsets.UTF_8, content.charset());
    }

    @Test
    void testBinaryFileRejected() throws IOException {
        Path file = tempDir.resolve("binary.json");
        Files.write(file, new byte[]{'{', 0, 0, '}'});

        assertThrows(IOException.class, () -> EncodingUtils.readTextFile(file));
    }

    @Test
    void testIsValidUtf8() {
        assertTrue(EncodingUtils.isValidUtf8("Regulation B".getBytes(StandardCharsets.UTF_8)));
        assertFalse(EncodingUtils.isValidUtf8(new byte[]{(byte) 0xC3}));
    }
}
