package com.lyshra.open.retry.core.engine.config;

import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryPolicy;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-call overrides for a single retry sequence.
 *
 * Every field is optional; a {@code null} field keeps the executor's
 * construction-time default. Overrides are applied once, through
 * {@link LyshraOpenRetryConfig#merge(LyshraOpenRetryOptions)}.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class LyshraOpenRetryOptions {

    /**
     * Options that override nothing.
     */
    public static final LyshraOpenRetryOptions NONE = LyshraOpenRetryOptions.builder().build();

    private final Integer maxRetries;

    private final Long baseDelayMs;

    private final Double jitterFactor;

    /**
     * Classifier replacing the executor default for this call.
     */
    private final ILyshraOpenRetryPolicy retryPolicy;

    // ========== Factory Methods ==========

    public static LyshraOpenRetryOptions withMaxRetries(int maxRetries) {
        return LyshraOpenRetryOptions.builder()
                .maxRetries(maxRetries)
                .build();
    }

    public static LyshraOpenRetryOptions withPolicy(ILyshraOpenRetryPolicy retryPolicy) {
        return LyshraOpenRetryOptions.builder()
                .retryPolicy(retryPolicy)
                .build();
    }
}
