package com.lyshra.open.retry.core.engine.executor;

import com.lyshra.open.retry.core.engine.config.LyshraOpenRetryConfig;
import com.lyshra.open.retry.core.engine.config.LyshraOpenRetryConfigLoader;
import com.lyshra.open.retry.core.engine.executor.impl.LyshraOpenRetryExecutorImpl;
import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryDelayScheduler;
import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryLogger;
import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Factory for creating retry executors.
 *
 * Usage:
 * <pre>
 * ILyshraOpenRetryExecutor executor = LyshraOpenRetryExecutorFactory.createDefault();
 * executor.execute(() -&gt; client.fetch(id)).block();
 * </pre>
 */
@Slf4j
public final class LyshraOpenRetryExecutorFactory {

    private LyshraOpenRetryExecutorFactory() {
        // Utility class
    }

    private static final class SingletonHelper {
        private static final ILyshraOpenRetryExecutor INSTANCE = createDefault();
    }

    /**
     * Shared executor configured from the environment at first use.
     */
    public static ILyshraOpenRetryExecutor getInstance() {
        return SingletonHelper.INSTANCE;
    }

    /**
     * Creates an executor whose defaults come from system properties and
     * environment variables.
     */
    public static ILyshraOpenRetryExecutor createDefault() {
        return create(new LyshraOpenRetryConfigLoader().load());
    }

    /**
     * Creates an executor with explicit defaults and the built-in collaborators.
     *
     * @param config the defaults
     * @return the executor
     * @throws IllegalStateException if the config is invalid
     */
    public static ILyshraOpenRetryExecutor create(LyshraOpenRetryConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();

        log.info("Creating retry executor with config: {}", config);
        return new LyshraOpenRetryExecutorImpl(config);
    }

    /**
     * Creates an executor with explicit defaults and caller-supplied collaborators.
     */
    public static ILyshraOpenRetryExecutor create(LyshraOpenRetryConfig config,
                                                  ILyshraOpenRetryPolicy defaultPolicy,
                                                  ILyshraOpenRetryDelayScheduler delayScheduler,
                                                  ILyshraOpenRetryLogger retryLogger) {
        Objects.requireNonNull(config, "config must not be null");
        config.validate();

        log.info("Creating retry executor with config: {}, policy: {}, scheduler: {}",
                config, defaultPolicy, delayScheduler);
        return new LyshraOpenRetryExecutorImpl(config, defaultPolicy, delayScheduler, retryLogger);
    }
}
