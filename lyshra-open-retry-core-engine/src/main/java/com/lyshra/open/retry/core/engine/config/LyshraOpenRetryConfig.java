package com.lyshra.open.retry.core.engine.config;

import com.lyshra.open.retry.integration.constant.LyshraOpenRetryConstants;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Effective settings of one retry sequence.
 *
 * An executor holds a default instance built at construction time; each
 * call derives its own snapshot through {@link #merge(LyshraOpenRetryOptions)}.
 * The snapshot is never modified while the sequence runs.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class LyshraOpenRetryConfig {

    public static final LyshraOpenRetryConfig DEFAULT = LyshraOpenRetryConfig.builder().build();

    /**
     * Maximum number of times the operation is invoked, the first call included.
     * Default: 3
     */
    @Builder.Default
    private final int maxRetries = LyshraOpenRetryConstants.DEFAULT_MAX_RETRIES;

    /**
     * Minimum delay between two attempts.
     * Default: 1000 milliseconds
     */
    @Builder.Default
    private final long baseDelayMs = LyshraOpenRetryConstants.DEFAULT_BASE_DELAY_MS;

    /**
     * Maximum random share of the base delay added on top of it.
     * Default: 0.5
     */
    @Builder.Default
    private final double jitterFactor = LyshraOpenRetryConstants.DEFAULT_JITTER_FACTOR;

    @Builder.Default
    private final LyshraOpenRetryLogSettings logSettings = LyshraOpenRetryLogSettings.DEFAULT;

    /**
     * Applies per-call overrides. Fields left {@code null} in the options keep
     * the value of this config; supplied fields always win, zero included.
     *
     * @param options the overrides, may be null
     * @return a validated config for a single call
     * @throws IllegalStateException if the merged values are invalid
     */
    public LyshraOpenRetryConfig merge(LyshraOpenRetryOptions options) {
        if (options == null) {
            validate();
            return this;
        }
        LyshraOpenRetryConfig merged = toBuilder()
                .maxRetries(options.getMaxRetries() != null ? options.getMaxRetries() : maxRetries)
                .baseDelayMs(options.getBaseDelayMs() != null ? options.getBaseDelayMs() : baseDelayMs)
                .jitterFactor(options.getJitterFactor() != null ? options.getJitterFactor() : jitterFactor)
                .build();
        merged.validate();
        return merged;
    }

    /**
     * Upper bound of a single backoff under this config, saturating at {@link Long#MAX_VALUE}.
     */
    public long getMaxDelayMs() {
        double jitterMs = jitterFactor * baseDelayMs;
        if (jitterMs >= Long.MAX_VALUE - baseDelayMs) {
            return Long.MAX_VALUE;
        }
        return baseDelayMs + (long) jitterMs;
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public void validate() {
        if (maxRetries < 1) {
            throw new IllegalStateException("maxRetries must be at least 1, was " + maxRetries);
        }
        if (baseDelayMs < 0) {
            throw new IllegalStateException("baseDelayMs must not be negative, was " + baseDelayMs);
        }
        if (Double.isNaN(jitterFactor) || Double.isInfinite(jitterFactor) || jitterFactor < 0) {
            throw new IllegalStateException("jitterFactor must be a finite non-negative number, was " + jitterFactor);
        }
        if (getMaxDelayMs() > LyshraOpenRetryConstants.MAX_DELAY_MS) {
            throw new IllegalStateException("baseDelayMs * (1 + jitterFactor) must not exceed "
                    + LyshraOpenRetryConstants.MAX_DELAY_MS + " ms, was " + baseDelayMs + " * (1 + " + jitterFactor + ")");
        }
        if (logSettings == null) {
            throw new IllegalStateException("logSettings must not be null");
        }
    }
}
