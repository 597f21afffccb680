package com.lyshra.open.retry.core.engine.error;

import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryErrorInfo;

import java.net.SocketException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Error identifiers the default classifier treats as transient.
 *
 * <p>Each constant lists the codes and exception names it answers to.
 * Matching ignores case.</p>
 */
public enum LyshraOpenRetryTransientErrorCode {

    TIMEOUT("TIMEOUT", "TimeoutError", "TimeoutException"),
    CONNECTION_RESET("ECONNRESET"),
    CONNECTION_TIMED_OUT("ETIMEDOUT", "SocketTimeoutException", "ConnectTimeoutException"),
    DNS_TEMPORARY_FAILURE("EAI_AGAIN"),
    NAME_NOT_FOUND("ENOTFOUND", "UnknownHostException"),
    CONNECTION_REFUSED("ECONNREFUSED", "ConnectException"),
    BROKEN_PIPE("EPIPE"),
    THROTTLING("Throttling", "ThrottlingException"),
    TOO_MANY_REQUESTS("TooManyRequestsException"),
    SLOW_DOWN("SlowDown"),
    REQUEST_TIMEOUT("RequestTimeout", "RequestTimeoutException");

    private final Set<String> identifiers;

    LyshraOpenRetryTransientErrorCode(String... identifiers) {
        List<String> normalized = new ArrayList<>();
        for (String identifier : identifiers) {
            normalized.add(identifier.toUpperCase(Locale.ROOT));
        }
        this.identifiers = Set.copyOf(normalized);
    }

    public boolean matches(String identifier) {
        return identifier != null && identifiers.contains(identifier.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Finds the constant answering to an identifier.
     *
     * @param identifier an error code or exception name, may be null
     * @return the matching constant, or empty
     */
    public static Optional<LyshraOpenRetryTransientErrorCode> fromIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        for (LyshraOpenRetryTransientErrorCode code : values()) {
            if (code.matches(identifier)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the transient code of a single exception, ignoring its causes.
     * Checks the declared error code, then the simple class name, then the
     * message of a {@link SocketException}.
     *
     * @param error the exception to inspect
     * @return the transient code, or empty if the exception carries none
     */
    public static Optional<LyshraOpenRetryTransientErrorCode> resolve(Throwable error) {
        if (error == null) {
            return Optional.empty();
        }

        if (error instanceof ILyshraOpenRetryErrorInfo info) {
            Optional<LyshraOpenRetryTransientErrorCode> declared = fromIdentifier(info.getErrorCode());
            if (declared.isPresent()) {
                return declared;
            }
        }

        Optional<LyshraOpenRetryTransientErrorCode> byName = fromIdentifier(error.getClass().getSimpleName());
        if (byName.isPresent()) {
            return byName;
        }

        // The JDK reports resets and broken pipes as plain SocketExceptions
        if (error instanceof SocketException && error.getMessage() != null) {
            String message = error.getMessage().toLowerCase(Locale.ROOT);
            if (message.contains("connection reset")) {
                return Optional.of(CONNECTION_RESET);
            }
            if (message.contains("broken pipe")) {
                return Optional.of(BROKEN_PIPE);
            }
        }

        return Optional.empty();
    }
}
