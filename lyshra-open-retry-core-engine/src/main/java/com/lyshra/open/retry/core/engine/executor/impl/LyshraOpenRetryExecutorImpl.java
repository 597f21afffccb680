package com.lyshra.open.retry.core.engine.executor.impl;

import com.lyshra.open.retry.core.engine.config.LyshraOpenRetryConfig;
import com.lyshra.open.retry.core.engine.config.LyshraOpenRetryLogSettings;
import com.lyshra.open.retry.core.engine.config.LyshraOpenRetryOptions;
import com.lyshra.open.retry.core.engine.delay.LyshraOpenRetryJitteredDelayScheduler;
import com.lyshra.open.retry.core.engine.error.LyshraOpenRetryDefaultClassifier;
import com.lyshra.open.retry.core.engine.executor.ILyshraOpenRetryExecutor;
import com.lyshra.open.retry.core.engine.logging.Slf4jLyshraOpenRetryLogger;
import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryDelayScheduler;
import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryLogger;
import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryPolicy;
import com.lyshra.open.retry.integration.exception.LyshraOpenRetryExhaustedException;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Default retry executor.
 *
 * <h2>Attempt Loop</h2>
 * <pre>
 * attempt ─→ success ─────────────────────────────→ value
 *    │
 *  failure ─→ policy false ─────────────────────────→ original error
 *    │
 *  policy true ─→ attempt &lt; max ─→ suspend ─→ resubscribe
 *                      │
 *                 attempt == max ──────────────────→ exhausted error
 * </pre>
 *
 * <p>Attempts are driven by {@link Mono#retryWhen}, which resubscribes in a loop,
 * so a zero-delay sequence does not deepen the stack however large its budget.
 * All per-call state (merged config, policy, attempt number) lives in the
 * reactive chain of that call. The executor's own fields are immutable, so one
 * instance serves any number of concurrent calls.</p>
 */
@Slf4j
public class LyshraOpenRetryExecutorImpl implements ILyshraOpenRetryExecutor {

    private final LyshraOpenRetryConfig defaultConfig;
    private final ILyshraOpenRetryPolicy defaultPolicy;
    private final ILyshraOpenRetryDelayScheduler delayScheduler;
    private final ILyshraOpenRetryLogger retryLogger;

    public LyshraOpenRetryExecutorImpl() {
        this(LyshraOpenRetryConfig.DEFAULT);
    }

    public LyshraOpenRetryExecutorImpl(LyshraOpenRetryConfig defaultConfig) {
        this(defaultConfig,
                LyshraOpenRetryDefaultClassifier.INSTANCE,
                new LyshraOpenRetryJitteredDelayScheduler(),
                new Slf4jLyshraOpenRetryLogger());
    }

    public LyshraOpenRetryExecutorImpl(LyshraOpenRetryConfig defaultConfig,
                                       ILyshraOpenRetryPolicy defaultPolicy,
                                       ILyshraOpenRetryDelayScheduler delayScheduler,
                                       ILyshraOpenRetryLogger retryLogger) {
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig must not be null");
        this.defaultPolicy = Objects.requireNonNull(defaultPolicy, "defaultPolicy must not be null");
        this.delayScheduler = Objects.requireNonNull(delayScheduler, "delayScheduler must not be null");
        this.retryLogger = Objects.requireNonNull(retryLogger, "retryLogger must not be null");
        defaultConfig.validate();
    }

    @Override
    public <T> Mono<T> execute(Supplier<? extends Mono<T>> operation, LyshraOpenRetryOptions options,
                               ILyshraOpenRetryPolicy policy) {
        Objects.requireNonNull(operation, "operation must not be null");

        return Mono.defer(() -> {
            LyshraOpenRetryConfig config = defaultConfig.merge(options);
            ILyshraOpenRetryPolicy effectivePolicy = resolvePolicy(options, policy);
            // defer turns a throwing supplier or a null publisher into an error signal
            return Mono.<T>defer(operation)
                    .retryWhen(buildRetry(config, effectivePolicy));
        });
    }

    @Override
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation,
                                                 LyshraOpenRetryOptions options,
                                                 ILyshraOpenRetryPolicy policy) {
        Objects.requireNonNull(operation, "operation must not be null");
        Supplier<Mono<T>> attempt = () -> Mono.fromCompletionStage(operation.get());
        return execute(attempt, options, policy).toFuture();
    }

    @Override
    public LyshraOpenRetryConfig getDefaultConfig() {
        return defaultConfig;
    }

    // ========================================================================
    // ATTEMPT LOOP
    // ========================================================================

    /**
     * Every failed attempt reaches the companion exactly once. Emitting resubscribes
     * to the operation; an error signal ends the sequence with that error.
     */
    private Retry buildRetry(LyshraOpenRetryConfig config, ILyshraOpenRetryPolicy policy) {
        return Retry.from(failures -> failures.concatMap(signal -> onFailure(config, policy, signal.copy())));
    }

    private Mono<Long> onFailure(LyshraOpenRetryConfig config,
                                 ILyshraOpenRetryPolicy policy,
                                 Retry.RetrySignal signal) {
        int attempt = Math.toIntExact(signal.totalRetries() + 1);
        Throwable error = signal.failure();
        LyshraOpenRetryLogSettings logSettings = config.getLogSettings();

        if (!policy.isRetryable(error)) {
            retryLogger.error(logSettings.formatNonRetryable(attempt, error));
            return Mono.error(error);
        }

        retryLogger.log(logSettings.getAttemptFailureSeverity(), logSettings.formatAttemptFailure(attempt, error));

        if (attempt < config.getMaxRetries()) {
            long delayMs = delayScheduler.computeDelay(config.getBaseDelayMs(), config.getJitterFactor());
            log.debug("Retrying in {} ms: [{}/{}]", delayMs, attempt + 1, config.getMaxRetries());
            return delayScheduler.suspend(delayMs).thenReturn(signal.totalRetries());
        }

        retryLogger.error(logSettings.formatExhausted(config.getMaxRetries(), error));
        return Mono.error(new LyshraOpenRetryExhaustedException(
                logSettings.formatExhaustedMessage(config.getMaxRetries()),
                config.getMaxRetries(),
                error));
    }

    private ILyshraOpenRetryPolicy resolvePolicy(LyshraOpenRetryOptions options, ILyshraOpenRetryPolicy policy) {
        if (policy != null) {
            return policy;
        }
        if (options != null && options.getRetryPolicy() != null) {
            return options.getRetryPolicy();
        }
        return defaultPolicy;
    }
}
