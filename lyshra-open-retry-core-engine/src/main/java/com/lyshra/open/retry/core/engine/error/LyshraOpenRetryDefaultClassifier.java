package com.lyshra.open.retry.core.engine.error;

import com.lyshra.open.retry.core.engine.utils.ExceptionUtils;
import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryPolicy;

import java.util.Set;

/**
 * Built-in transient-error classifier.
 *
 * <p>An error is retryable when it, or any exception in its cause chain,
 * either carries one of the {@link LyshraOpenRetryTransientErrorCode} identifiers
 * or reports a status code in {429, 500, 502, 503, 504}. Everything else is
 * treated as fatal.</p>
 *
 * <p>Stateless; use {@link #INSTANCE}.</p>
 */
public final class LyshraOpenRetryDefaultClassifier implements ILyshraOpenRetryPolicy {

    public static final LyshraOpenRetryDefaultClassifier INSTANCE = new LyshraOpenRetryDefaultClassifier();

    public static final Set<Integer> RETRYABLE_STATUS_CODES = Set.of(429, 500, 502, 503, 504);

    private LyshraOpenRetryDefaultClassifier() {
    }

    @Override
    public boolean isRetryable(Throwable error) {
        return ExceptionUtils.matchesInCauseChain(error, LyshraOpenRetryDefaultClassifier::isTransient);
    }

    private static boolean isTransient(Throwable error) {
        if (LyshraOpenRetryTransientErrorCode.resolve(error).isPresent()) {
            return true;
        }
        return LyshraOpenRetryStatusCodeResolver.resolve(error)
                .map(RETRYABLE_STATUS_CODES::contains)
                .orElse(false);
    }

    @Override
    public String toString() {
        return "LyshraOpenRetryDefaultClassifier";
    }
}
