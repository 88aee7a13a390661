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
import ru.nts.tools.regml.core.RegmlChainException;
import ru.nts.tools.regml.core.RegmlErrorCode;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NoticeChainResolverTest {

    private final NoticeChainResolver resolver = new NoticeChainResolver();

    private static final NoticeListing FIRST = new NoticeListing("2012-100", LocalDate.of(2012, 1, 1), "2011-31714");
    private static final NoticeListing SECOND = new NoticeListing("2012-200", LocalDate.of(2012, 6, 1), "2012-100");
    private static final NoticeListing THIRD = new NoticeListing("2013-300", LocalDate.of(2013, 1, 1), "2012-200");

    @Test
    void testChronologicalChain() {
        VersionChain chain = resolver.resolve("1003", "2011-31714", List.of(THIRD, FIRST, SECOND));

        assertEquals(List.of(FIRST, SECOND, THIRD), chain.links());
        assertEquals(List.of("2011-31714", "2012-100", "2012-200", "2013-300"), chain.versions());
        assertEquals("2013-300", chain.finalVersion());
    }

    @Test
    void testSameDateOrderedByDocumentNumber() {
        NoticeListing a = new NoticeListing("2012-100", LocalDate.of(2012, 1, 1), "v0");
        NoticeListing b = new NoticeListing("2012-101", LocalDate.of(2012, 1, 1), "2012-100");

        assertEquals(List.of(a, b), resolver.resolve("1003", "v0", List.of(b, a)).links());
    }

    @Test
    void testThrough() {
        VersionChain chain = resolver.resolve("1003", "2011-31714", List.of(FIRST, SECOND, THIRD), "2012-200");

        assertEquals(List.of(FIRST, SECOND), chain.links());
    }

    @Test
    void testThroughUnknownNotice() {
        RegmlChainException e = assertThrows(RegmlChainException.class,
                () -> resolver.resolve("1003", "2011-31714", List.of(FIRST, SECOND), "2014-1"));
        assertEquals(RegmlErrorCode.UNKNOWN_NOTICE, e.getCode());
        assertEquals("2014-1", e.getContext().get("notice"));
    }

    @Test
    void testStartsAfterBaselineNotice() {
        VersionChain chain = resolver.resolve("1003", "2012-200", List.of(FIRST, SECOND, THIRD));
        assertEquals(List.of(THIRD), chain.links());

        VersionChain empty = resolver.resolve("1003", "2012-200", List.of(FIRST, SECOND, THIRD), "2012-100");
        assertTrue(empty.isEmpty());
        assertEquals("2012-200", empty.finalVersion());
    }

    @Test
    void testBrokenChainNamesLastProducedVersion() {
        NoticeListing stray = new NoticeListing("2013-300", LocalDate.of(2013, 1, 1), "2012-999");

        RegmlChainException e = assertThrows(RegmlChainException.class,
                () -> resolver.resolve("1003", "2011-31714", List.of(FIRST, SECOND, stray)));
        assertEquals(RegmlErrorCode.CHAIN_BROKEN, e.getCode());
        assertEquals("2012-200", e.getVersion());
        assertEquals("2013-300", e.getContext().get("notice"));
    }

    @Test
    void testBrokenAtFirstLink() {
        RegmlChainException e = assertThrows(RegmlChainException.class,
                () -> resolver.resolve("1003", "2010-1", List.of(FIRST)));
        assertEquals("2010-1", e.getVersion());
    }

    @Test
    void testInspect() {
        NoticeListing stray = new NoticeListing("2013-300", LocalDate.of(2013, 1, 1), "2012-999");

        assertEquals(List.of(), resolver.inspect(List.of(SECOND, FIRST, THIRD)));
        assertEquals(List.of("2013-300 applies to 2012-999, but the preceding version is 2012-200"),
                resolver.inspect(List.of(FIRST, SECOND, stray)));
    }
}
