package com.lyshra.open.retry.integration.constant;

public interface LyshraOpenRetryConstants {

    int DEFAULT_MAX_RETRIES = 3;
    long DEFAULT_BASE_DELAY_MS = 1000L;
    double DEFAULT_JITTER_FACTOR = 0.5;

    // Longest single backoff; Mono.delay times in nanoseconds
    long MAX_DELAY_MS = Long.MAX_VALUE / 1_000_000L;

    String EXHAUSTED_MESSAGE_TEMPLATE = "Operation failed after %d attempts.";

    // Metadata keys checked for an HTTP status code
    String METADATA_HTTP_STATUS_CODE = "httpStatusCode";
    String METADATA_STATUS_CODE = "statusCode";
    String METADATA_STATUS = "status";

    // Configuration keys
    String MAX_RETRIES_PROPERTY = "lyshra.retry.max-retries";
    String BASE_DELAY_MS_PROPERTY = "lyshra.retry.base-delay-ms";
    String JITTER_FACTOR_PROPERTY = "lyshra.retry.jitter-factor";

    String MAX_RETRIES_ENV = "LYSHRA_RETRY_MAX_RETRIES";
    String BASE_DELAY_MS_ENV = "LYSHRA_RETRY_BASE_DELAY_MS";
    String JITTER_FACTOR_ENV = "LYSHRA_RETRY_JITTER_FACTOR";
}
