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

import java.util.List;

/**
 * Источник уведомлений для части регуляции.
 * Движок только читает из него: без повторов и кэширования на своей стороне.
 */
public interface NoticeSource {

    /**
     * Все известные уведомления части, в произвольном порядке.
     */
    List<NoticeListing> listings(String title, String part);

    /**
     * Полное уведомление по записи списка.
     */
    Notice load(String part, NoticeListing listing);
}
