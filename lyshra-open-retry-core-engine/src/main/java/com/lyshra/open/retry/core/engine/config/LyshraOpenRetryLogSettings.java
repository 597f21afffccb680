package com.lyshra.open.retry.core.engine.config;

import com.lyshra.open.retry.integration.constant.LyshraOpenRetryConstants;
import com.lyshra.open.retry.integration.enumerations.LyshraOpenRetryLogSeverity;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Severity and message templates used when reporting retry events.
 *
 * Templates are {@link String#format} patterns. The attempt, non-retryable
 * and exhaustion templates receive a number followed by the error; the
 * exhausted-message template receives only the attempt count.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class LyshraOpenRetryLogSettings {

    public static final LyshraOpenRetryLogSettings DEFAULT = LyshraOpenRetryLogSettings.builder().build();

    /**
     * Severity of the message logged for every retryable failure.
     * Default: WARN
     */
    @Builder.Default
    private final LyshraOpenRetryLogSeverity attemptFailureSeverity = LyshraOpenRetryLogSeverity.WARN;

    @Builder.Default
    private final String attemptFailureTemplate = "Attempt #%d failed. Error: %s";

    @Builder.Default
    private final String nonRetryableTemplate = "Non-retryable error encountered on attempt #%d. Error: %s";

    @Builder.Default
    private final String exhaustedTemplate = "All %d attempts failed. Last error: %s";

    /**
     * Message of the exhaustion exception handed back to the caller.
     */
    @Builder.Default
    private final String exhaustedMessageTemplate = LyshraOpenRetryConstants.EXHAUSTED_MESSAGE_TEMPLATE;

    public String formatAttemptFailure(int attempt, Throwable error) {
        return String.format(attemptFailureTemplate, attempt, describe(error));
    }

    public String formatNonRetryable(int attempt, Throwable error) {
        return String.format(nonRetryableTemplate, attempt, describe(error));
    }

    public String formatExhausted(int attempts, Throwable lastError) {
        return String.format(exhaustedTemplate, attempts, describe(lastError));
    }

    public String formatExhaustedMessage(int attempts) {
        return String.format(exhaustedMessageTemplate, attempts);
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown";
        }
        String message = error.getMessage();
        return message != null
                ? error.getClass().getSimpleName() + ": " + message
                : error.getClass().getSimpleName();
    }
}
