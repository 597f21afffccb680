package com.lyshra.open.retry.core.engine.error;

import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LyshraOpenRetryPolicies Tests")
class LyshraOpenRetryPoliciesTest {

    @Test
    @DisplayName("default policy is the built-in classifier")
    void defaultPolicy() {
        assertSame(LyshraOpenRetryDefaultClassifier.INSTANCE, LyshraOpenRetryPolicies.defaultPolicy());
    }

    @Test
    @DisplayName("always and never ignore the error")
    void alwaysAndNever() {
        assertTrue(LyshraOpenRetryPolicies.always().isRetryable(new IllegalArgumentException()));
        assertFalse(LyshraOpenRetryPolicies.never().isRetryable(new TimeoutException()));
    }

    @Test
    @DisplayName("retryOn matches subtypes of the listed types")
    void retryOnTypes() {
        ILyshraOpenRetryPolicy policy = LyshraOpenRetryPolicies.retryOn(IOException.class, UncheckedIOException.class);

        assertTrue(policy.isRetryable(new java.net.SocketException("reset")));
        assertTrue(policy.isRetryable(new UncheckedIOException(new IOException("io"))));
        assertFalse(policy.isRetryable(new IllegalStateException()));
        assertFalse(policy.isRetryable(null));
    }

    @Test
    @DisplayName("policies combine with or, and and negate")
    void combinators() {
        ILyshraOpenRetryPolicy io = LyshraOpenRetryPolicies.retryOn(IOException.class);
        ILyshraOpenRetryPolicy classified = LyshraOpenRetryPolicies.defaultPolicy();

        assertTrue(io.or(classified).isRetryable(new TimeoutException()));
        assertTrue(io.or(classified).isRetryable(new IOException("disk")));
        assertFalse(io.and(classified).isRetryable(new IOException("disk")));
        assertTrue(io.and(classified).isRetryable(new java.net.ConnectException("refused")));
        assertTrue(io.negate().isRetryable(new IllegalStateException()));
    }
}
