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
package ru.nts.tools.regml.changes;

/**
 * Точка вставки: размещение и метка якоря.
 * Якорь может отсутствовать у вставки, тогда им служит метка цели операции.
 */
public record Position(Placement placement, String anchor) {

    public static Position before(String anchor) {
        return new Position(Placement.BEFORE, anchor);
    }

    public static Position after(String anchor) {
        return new Position(Placement.AFTER, anchor);
    }

    public static Position childOf(String anchor) {
        return new Position(Placement.CHILD_OF, anchor);
    }

    public boolean hasAnchor() {
        return anchor != null && !anchor.isBlank();
    }

    @Override
    public String toString() {
        return hasAnchor() ? placement + " " + anchor : placement.toString();
    }
}
