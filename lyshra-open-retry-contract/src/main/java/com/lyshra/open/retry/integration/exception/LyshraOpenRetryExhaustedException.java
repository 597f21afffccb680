package com.lyshra.open.retry.integration.exception;

import com.lyshra.open.retry.integration.constant.LyshraOpenRetryConstants;

/**
 * Signalled when every allowed attempt failed with a retryable error.
 *
 * <p>The last observed failure is kept as the cause and is also available
 * through {@link #getLastError()}.</p>
 */
public class LyshraOpenRetryExhaustedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int attempts;

    /**
     * Creates an exception with the default message.
     */
    public LyshraOpenRetryExhaustedException(int attempts, Throwable lastError) {
        this(String.format(LyshraOpenRetryConstants.EXHAUSTED_MESSAGE_TEMPLATE, attempts), attempts, lastError);
    }

    /**
     * Creates an exception with a pre-formatted message.
     */
    public LyshraOpenRetryExhaustedException(String message, int attempts, Throwable lastError) {
        super(message, lastError);
        this.attempts = attempts;
    }

    /**
     * Gets the number of attempts that were made.
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * Gets the failure of the final attempt.
     */
    public Throwable getLastError() {
        return getCause();
    }
}
