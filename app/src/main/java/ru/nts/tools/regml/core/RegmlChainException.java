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
 * Exception for version chain failures (gaps, mismatched links, unknown notices)
 * and for failed verification of a chain step.
 */
public class RegmlChainException extends RegmlException {

    public RegmlChainException(RegmlErrorCode code, Map<String, Object> context) {
        super(code, context);
    }

    /**
     * Version the chain reached before it broke.
     */
    public String getVersion() {
        Object version = getContext().get("version");
        return version != null ? version.toString() : null;
    }

    /**
     * Factory: no notice applies to the given version
     *
     * @param version   last version the chain produced
     * @param notice    next notice in date order
     * @param appliesTo version that notice declares as its predecessor
     */
    public static RegmlChainException broken(String version, String notice, String appliesTo) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("version", version);
        ctx.put("notice", notice);
        ctx.put("appliesTo", appliesTo);
        return new RegmlChainException(RegmlErrorCode.CHAIN_BROKEN, ctx);
    }

    /**
     * Factory: bounded chain names an unavailable notice
     */
    public static RegmlChainException unknownNotice(String notice, String part) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("notice", notice);
        ctx.put("part", part);
        return new RegmlChainException(RegmlErrorCode.UNKNOWN_NOTICE, ctx);
    }

    /**
     * Factory: applied result differs from the expected tree
     */
    public static RegmlChainException verificationFailed(String notice, int changes, String firstLabel) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("notice", notice);
        ctx.put("changes", changes);
        if (firstLabel != null) {
            ctx.put("label", firstLabel);
        }
        return new RegmlChainException(RegmlErrorCode.VERIFICATION_FAILED, ctx);
    }
}
