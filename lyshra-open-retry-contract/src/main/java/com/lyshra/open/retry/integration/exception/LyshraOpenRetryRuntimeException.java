package com.lyshra.open.retry.integration.exception;

import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * Unchecked failure tagged with an error code, a status code and free-form
 * metadata, all of which the default classifier inspects.
 */
@Getter
@ToString
public class LyshraOpenRetryRuntimeException extends RuntimeException implements ILyshraOpenRetryException {
    protected final String errorCode;
    protected final Integer statusCode;
    protected final Map<String, Object> metadata;

    public LyshraOpenRetryRuntimeException(String message, String errorCode, Integer statusCode,
                                           Map<String, Object> metadata, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.statusCode = statusCode;
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public LyshraOpenRetryRuntimeException(String message, String errorCode) {
        this(message, errorCode, null, Map.of(), null);
    }

    public LyshraOpenRetryRuntimeException(String message, Integer statusCode) {
        this(message, null, statusCode, Map.of(), null);
    }

    public LyshraOpenRetryRuntimeException(String message, Map<String, Object> metadata) {
        this(message, null, null, metadata, null);
    }

    public LyshraOpenRetryRuntimeException(String message, String errorCode, Throwable cause) {
        this(message, errorCode, null, Map.of(), cause);
    }

}
