package com.lbg.markets.surveillance.hsm.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeTest {

    @Test
    void attemptCapturesValue() throws Exception {
        Outcome<String> outcome = Outcome.attempt(() -> "Hello, Tracy");

        assertTrue(outcome.isSuccess());
        assertEquals("Hello, Tracy", outcome.getOrThrow());
        assertTrue(outcome.error().isEmpty());
    }

    @Test
    void attemptCapturesException() {
        Outcome<String> outcome = Outcome.attempt(() -> {
            throw new IOException("disk gone");
        });

        assertTrue(outcome.isFailure());
        IOException thrown = assertThrows(IOException.class, outcome::getOrThrow);
        assertEquals("disk gone", thrown.getMessage());
        assertTrue(outcome.result().isEmpty());
    }

    @Test
    void mapOnlyTransformsSuccess() throws Exception {
        Outcome<Integer> success = Outcome.success(20);
        Outcome<Integer> failure = Outcome.failure(new IllegalStateException("boom"));

        assertEquals(21, success.map(v -> v + 1).getOrThrow());

        Outcome<Integer> mapped = failure.map(v -> v + 1);
        assertTrue(mapped.isFailure());
        assertSame(failure.error().orElseThrow(), mapped.error().orElseThrow());
    }

    @Test
    void mapTurnsThrownExceptionIntoFailure() {
        Outcome<Integer> outcome = Outcome.success(1).map(v -> {
            throw new IllegalArgumentException("bad value " + v);
        });

        assertTrue(outcome.isFailure());
        assertInstanceOf(IllegalArgumentException.class, outcome.error().orElseThrow());
    }

    @Test
    void recoverOnlyHandlesFailure() throws Exception {
        Outcome<Boolean> failure = Outcome.failure(new IOException("offline"));
        Outcome<Boolean> success = Outcome.success(true);

        assertFalse(failure.recover(e -> false).getOrThrow());
        assertSame(success, success.recover(e -> false));
    }

    @Test
    void foldSelectsBranch() {
        assertEquals("ok:1", Outcome.success(1).fold(v -> "ok:" + v, e -> "err"));
        assertEquals("err:x", Outcome.<Integer>failure(new RuntimeException("x"))
                .fold(v -> "ok", e -> "err:" + e.getMessage()));
    }

    @Test
    void failureRequiresCause() {
        assertThrows(IllegalArgumentException.class, () -> Outcome.failure(null));
    }
}
