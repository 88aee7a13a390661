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

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception for file-related errors (not found, unreadable, malformed content).
 */
public class RegmlFileException extends RegmlException {

    public RegmlFileException(RegmlErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    public RegmlFileException(RegmlErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code, context, cause);
    }

    /**
     * Factory: File not found
     */
    public static RegmlFileException notFound(Path path) {
        return new RegmlFileException(RegmlErrorCode.FILE_NOT_FOUND, Map.of("path", path.toString()));
    }

    /**
     * Factory: File not found by a bare name
     */
    public static RegmlFileException notFound(String name) {
        return new RegmlFileException(RegmlErrorCode.FILE_NOT_FOUND, Map.of("path", name));
    }

    /**
     * Factory: File not readable
     */
    public static RegmlFileException notReadable(Path path, Throwable cause) {
        return new RegmlFileException(RegmlErrorCode.FILE_NOT_READABLE, Map.of("path", path.toString()), cause);
    }

    /**
     * Factory: File content does not describe a document or a notice
     */
    public static RegmlFileException malformed(String path, String reason) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", path);
        ctx.put("reason", reason);
        return new RegmlFileException(RegmlErrorCode.MALFORMED_DOCUMENT, ctx);
    }

    /**
     * Factory: File content does not describe a document or a notice, caused by a parser failure
     */
    public static RegmlFileException malformed(String path, String reason, Throwable cause) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("path", path);
        ctx.put("reason", reason);
        return new RegmlFileException(RegmlErrorCode.MALFORMED_DOCUMENT, ctx, cause);
    }

    /**
     * Factory: Write failure
     */
    public static RegmlFileException ioError(Path path, Throwable cause) {
        return new RegmlFileException(RegmlErrorCode.IO_ERROR, Map.of("path", path.toString()), cause);
    }
}
