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

import ru.nts.tools.regml.changes.Notice;
import ru.nts.tools.regml.tree.DocumentTree;

import java.util.function.Function;

/**
 * Задание на материализацию одной цепочки (title, part).
 */
public record ChainJob(String title, String part, DocumentTree baseline, VersionChain chain,
                       Function<NoticeListing, Notice> loader, StepVerifier verifier) {

    public ChainJob(String title, String part, DocumentTree baseline, VersionChain chain,
                    Function<NoticeListing, Notice> loader) {
        this(title, part, baseline, chain, loader, StepVerifier.NONE);
    }
}
