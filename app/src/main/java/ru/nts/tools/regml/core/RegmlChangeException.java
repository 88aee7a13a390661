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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exception for failures of a single notice operation.
 * The context always names the authored operation index, its kind and the label involved.
 */
public class RegmlChangeException extends RegmlException {

    public RegmlChangeException(RegmlErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    public RegmlChangeException(RegmlErrorCode code, Map<String, Object> context, Throwable cause) {
        super(code, context, cause);
    }

    /**
     * Authored (0-based) index of the failed operation, or -1 for notice-level failures.
     */
    public int getOperationIndex() {
        Object index = getContext().get("operation");
        return index instanceof Integer i ? i : -1;
    }

    public String getLabel() {
        Object label = getContext().get("label");
        return label != null ? label.toString() : null;
    }

    /**
     * Factory: target label does not exist in the input version
     */
    public static RegmlChangeException unresolvedTarget(int operation, String kind, String label, String version) {
        Map<String, Object> ctx = operationContext(operation, kind, label);
        ctx.put("version", version);
        return new RegmlChangeException(RegmlErrorCode.UNRESOLVED_TARGET, ctx);
    }

    /**
     * Factory: operation cannot be applied to the current structure
     */
    public static RegmlChangeException structuralConflict(int operation, String kind, String label, String reason) {
        Map<String, Object> ctx = operationContext(operation, kind, label);
        ctx.put("reason", reason);
        return new RegmlChangeException(RegmlErrorCode.STRUCTURAL_CONFLICT, ctx);
    }

    /**
     * Factory: operation cannot be applied, caused by a lower-level failure
     */
    public static RegmlChangeException structuralConflict(int operation, String kind, String label, String reason,
                                                          Throwable cause) {
        Map<String, Object> ctx = operationContext(operation, kind, label);
        ctx.put("reason", reason);
        return new RegmlChangeException(RegmlErrorCode.STRUCTURAL_CONFLICT, ctx, cause);
    }

    /**
     * Factory: required field missing for the operation kind
     */
    public static RegmlChangeException malformed(int operation, String kind, String field) {
        Map<String, Object> ctx = operationContext(operation, kind, null);
        ctx.put("field", field);
        return new RegmlChangeException(RegmlErrorCode.MALFORMED_OPERATION, ctx);
    }

    /**
     * Factory: two operations claim the same target in conflicting ways
     */
    public static RegmlChangeException duplicateTarget(int first, int operation, String kind, String label,
                                                       String placement) {
        Map<String, Object> ctx = operationContext(operation, kind, label);
        ctx.put("first", first);
        ctx.put("placement", placement);
        return new RegmlChangeException(RegmlErrorCode.DUPLICATE_TARGET, ctx);
    }

    /**
     * Factory: notice declared for another version
     */
    public static RegmlChangeException versionMismatch(String notice, String appliesTo, String version) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("notice", notice);
        ctx.put("appliesTo", appliesTo);
        ctx.put("version", version);
        return new RegmlChangeException(RegmlErrorCode.VERSION_MISMATCH, ctx);
    }

    private static Map<String, Object> operationContext(int operation, String kind, String label) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("operation", operation);
        ctx.put("kind", kind);
        if (label != null) {
            ctx.put("label", label);
        }
        return ctx;
    }
}
