package com.lyshra.open.retry.core.engine.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.net.ConnectException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ExceptionUtils Tests")
class ExceptionUtilsTest {

    // ==================== causeChain Tests ====================

    @Nested
    @DisplayName("causeChain")
    class CauseChainTests {

        @Test
        @DisplayName("returns an empty chain for null")
        void nullThrowable_EmptyChain() {
            assertTrue(ExceptionUtils.causeChain(null).isEmpty());
        }

        @Test
        @DisplayName("lists the exception followed by its causes")
        void nestedChain_OutermostFirst() {
            IOException root = new IOException("root");
            IllegalStateException middle = new IllegalStateException("middle", root);
            RuntimeException top = new RuntimeException("top", middle);

            assertEquals(List.of(top, middle, root), ExceptionUtils.causeChain(top));
        }

        @Test
        @DisplayName("stops at a repeated exception in a circular chain")
        void circularChain_Terminates() {
            RuntimeException first = new RuntimeException("first");
            RuntimeException second = new RuntimeException("second");
            first.initCause(second);
            second.initCause(first);

            assertEquals(List.of(first, second), ExceptionUtils.causeChain(first));
        }
    }

    // ==================== matchesInCauseChain Tests ====================

    @Nested
    @DisplayName("matchesInCauseChain")
    class MatchesInCauseChainTests {

        @Test
        @DisplayName("returns false for null throwable")
        void nullThrowable_ReturnsFalse() {
            assertFalse(ExceptionUtils.matchesInCauseChain(null, ex -> true));
        }

        @ParameterizedTest(name = "match at depth {0}")
        @ValueSource(ints = {0, 1, 3, 6})
        @DisplayName("finds a match at various depths")
        void nestedMatch_ReturnsTrue(int depth) {
            Throwable current = new ConnectException("refused");
            for (int i = 0; i < depth; i++) {
                current = new RuntimeException("level " + i, current);
            }

            assertTrue(ExceptionUtils.matchesInCauseChain(current, ConnectException.class::isInstance));
        }

        @Test
        @DisplayName("returns false when no exception matches")
        void noMatch_ReturnsFalse() {
            Exception ex = new RuntimeException("Some error", new IllegalStateException("inner"));

            assertFalse(ExceptionUtils.matchesInCauseChain(ex, IOException.class::isInstance));
        }
    }
}
