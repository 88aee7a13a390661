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

import java.util.Map;

/**
 * Structured error codes for the RegML engine.
 * Each error has a human-readable message and a solution hint.
 *
 * <p>Example rendering:
 * <pre>
 * [ERROR: UNRESOLVED_TARGET]
 * Message: Operation target does not exist
 * Solution: Operation #2 (delete) targets 1003-4, which is not a label of version 2015-1234.
 * Context: operation=2, kind=delete, label=1003-4, version=2015-1234
 * </pre>
 */
public enum RegmlErrorCode {

    // ============ Label Errors ============

    LABEL_NOT_FOUND("Label not found",
            "Label '%label%' does not exist in this version. Check the label spelling and the document version."),

    DUPLICATE_LABEL("Two nodes resolve to the same label",
            "Label '%label%' was computed for more than one node. Check identifier markers of sibling nodes."),

    // ============ Operation Errors ============

    UNRESOLVED_TARGET("Operation target does not exist",
            "Operation #%operation% (%kind%) targets %label%, which is not a label of version %version%."),

    VERSION_MISMATCH("Notice does not apply to this version",
            "Notice %notice% applies to version %appliesTo%, but the input tree is version %version%."),

    STRUCTURAL_CONFLICT("Structural conflict",
            "Operation #%operation% (%kind%) on %label% cannot be applied: %reason%."),

    MALFORMED_OPERATION("Malformed operation",
            "Operation #%operation% (%kind%) is missing or has an invalid '%field%'. Check the notice file."),

    DUPLICATE_TARGET("Conflicting operations on the same target",
            "Operations #%first% and #%operation% both claim %label% (%placement%). Merge them into one operation."),

    // ============ Chain Errors ============

    CHAIN_BROKEN("Version chain is broken",
            "No notice applies to version %version%; next notice %notice% applies to %appliesTo%. A notice is missing."),

    UNKNOWN_NOTICE("Notice not available",
            "Notice %notice% is not among the notices for part %part%. Use 'versions' to list them."),

    VERIFICATION_FAILED("Result does not match the expected version",
            "Applying %notice% produced %changes% differences against the expected tree. Inspect the listed labels."),

    // ============ File Errors ============

    FILE_NOT_FOUND("File not found",
            "Check file path '%path%'. Relative names are looked up under the regml data root."),

    FILE_NOT_READABLE("File not readable",
            "Check file permissions for '%path%'."),

    MALFORMED_DOCUMENT("Malformed document",
            "File '%path%' is not a valid document or notice: %reason%."),

    // ============ System Errors ============

    IO_ERROR("I/O error occurred",
            "Check disk space and permissions. Try again."),

    INTERNAL_ERROR("Internal error",
            "Unexpected error. Check logs for details.");

    private final String message;
    private final String solution;

    RegmlErrorCode(String message, String solution) {
        this.message = message;
        this.solution = solution;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Formats error message with optional context.
     *
     * @param context Optional context map (label, operation, etc.)
     * @return Formatted error string
     */
    public String format(Map<String, Object> context) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("[ERROR: %s]\n", this.name()));
        sb.append(String.format("Message: %s\n", message));

        // Интерполяция %placeholder% в solution
        String resolvedSolution = solution;
        if (context != null) {
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                resolvedSolution = resolvedSolution.replace(
                        "%" + entry.getKey() + "%", String.valueOf(entry.getValue()));
            }
        }
        // Очищаем неиспользованные плейсхолдеры
        resolvedSolution = resolvedSolution.replaceAll("%\\w+%", "...");
        sb.append(String.format("Solution: %s", resolvedSolution));

        if (context != null && !context.isEmpty()) {
            sb.append("\nContext: ");
            boolean first = true;
            for (Map.Entry<String, Object> entry : context.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
        }

        return sb.toString();
    }

    /**
     * Formats error message without context.
     *
     * @return Formatted error string
     */
    public String format() {
        return format(null);
    }
}
