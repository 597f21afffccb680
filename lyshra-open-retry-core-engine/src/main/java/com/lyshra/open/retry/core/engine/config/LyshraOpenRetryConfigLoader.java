package com.lyshra.open.retry.core.engine.config;

import com.lyshra.open.retry.integration.constant.LyshraOpenRetryConstants;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Properties;
import java.util.function.Function;

/**
 * Resolves executor defaults from the runtime environment.
 *
 * <p>Each setting is looked up in this order:</p>
 * <ol>
 *   <li>System property ({@code lyshra.retry.max-retries}, {@code lyshra.retry.base-delay-ms},
 *       {@code lyshra.retry.jitter-factor})</li>
 *   <li>Environment variable ({@code LYSHRA_RETRY_MAX_RETRIES}, {@code LYSHRA_RETRY_BASE_DELAY_MS},
 *       {@code LYSHRA_RETRY_JITTER_FACTOR})</li>
 *   <li>Built-in default (3 / 1000 / 0.5)</li>
 * </ol>
 * <p>Values that do not parse or fall out of range are logged and skipped.</p>
 */
@Slf4j
public final class LyshraOpenRetryConfigLoader {

    private final Properties properties;
    private final Function<String, String> environment;

    public LyshraOpenRetryConfigLoader() {
        this(System.getProperties(), System::getenv);
    }

    public LyshraOpenRetryConfigLoader(Properties properties, Function<String, String> environment) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    public LyshraOpenRetryConfig load() {
        LyshraOpenRetryConfig config = LyshraOpenRetryConfig.builder()
                .maxRetries(determineMaxRetries())
                .baseDelayMs(determineBaseDelayMs())
                .jitterFactor(determineJitterFactor())
                .build();
        log.debug("Loaded retry config: {}", config);
        return config;
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private int determineMaxRetries() {
        String raw = lookup(LyshraOpenRetryConstants.MAX_RETRIES_PROPERTY, LyshraOpenRetryConstants.MAX_RETRIES_ENV);
        if (raw == null) {
            return LyshraOpenRetryConstants.DEFAULT_MAX_RETRIES;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value >= 1) {
                return value;
            }
            log.warn("Invalid max retries: {}. Must be at least 1, using default.", raw);
        } catch (NumberFormatException e) {
            log.warn("Invalid max retries: {}. Using default.", raw);
        }
        return LyshraOpenRetryConstants.DEFAULT_MAX_RETRIES;
    }

    private long determineBaseDelayMs() {
        String raw = lookup(LyshraOpenRetryConstants.BASE_DELAY_MS_PROPERTY, LyshraOpenRetryConstants.BASE_DELAY_MS_ENV);
        if (raw == null) {
            return LyshraOpenRetryConstants.DEFAULT_BASE_DELAY_MS;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value >= 0) {
                return value;
            }
            log.warn("Invalid base delay: {}. Must not be negative, using default.", raw);
        } catch (NumberFormatException e) {
            log.warn("Invalid base delay: {}. Using default.", raw);
        }
        return LyshraOpenRetryConstants.DEFAULT_BASE_DELAY_MS;
    }

    private double determineJitterFactor() {
        String raw = lookup(LyshraOpenRetryConstants.JITTER_FACTOR_PROPERTY, LyshraOpenRetryConstants.JITTER_FACTOR_ENV);
        if (raw == null) {
            return LyshraOpenRetryConstants.DEFAULT_JITTER_FACTOR;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (value >= 0 && !Double.isInfinite(value)) {
                return value;
            }
            log.warn("Invalid jitter factor: {}. Must be a finite non-negative number, using default.", raw);
        } catch (NumberFormatException e) {
            log.warn("Invalid jitter factor: {}. Using default.", raw);
        }
        return LyshraOpenRetryConstants.DEFAULT_JITTER_FACTOR;
    }

    private String lookup(String propertyKey, String environmentKey) {
        String property = properties.getProperty(propertyKey);
        if (property != null && !property.isBlank()) {
            return property;
        }
        String env = environment.apply(environmentKey);
        if (env != null && !env.isBlank()) {
            return env;
        }
        return null;
    }
}
