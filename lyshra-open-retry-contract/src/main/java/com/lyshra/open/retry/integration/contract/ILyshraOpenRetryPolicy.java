package com.lyshra.open.retry.integration.contract;

import java.util.Objects;

/**
 * Decides whether a failed attempt deserves another try.
 *
 * <p>Implementations must be stateless. The policy receives the raw error
 * signalled by the operation, never a normalized form, and is consulted
 * once per failed attempt.</p>
 *
 * <pre>{@code
 * ILyshraOpenRetryPolicy onlyTimeouts = error -> error instanceof TimeoutException;
 * executor.execute(() -> client.fetch(id), onlyTimeouts);
 * }</pre>
 */
@FunctionalInterface
public interface ILyshraOpenRetryPolicy {

    /**
     * @param error the failure signalled by the operation
     * @return true if the operation should be attempted again
     */
    boolean isRetryable(Throwable error);

    default ILyshraOpenRetryPolicy or(ILyshraOpenRetryPolicy other) {
        Objects.requireNonNull(other, "other policy must not be null");
        return error -> isRetryable(error) || other.isRetryable(error);
    }

    default ILyshraOpenRetryPolicy and(ILyshraOpenRetryPolicy other) {
        Objects.requireNonNull(other, "other policy must not be null");
        return error -> isRetryable(error) && other.isRetryable(error);
    }

    default ILyshraOpenRetryPolicy negate() {
        return error -> !isRetryable(error);
    }
}
