package com.lyshra.open.retry.core.engine.delay;

import com.lyshra.open.retry.integration.constant.LyshraOpenRetryConstants;
import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryDelayScheduler;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Additive-jitter backoff: {@code base + random[0,1) * jitterFactor * base}.
 *
 * <p>Suspension is a {@link Mono#delay} on a timer scheduler, so a waiting
 * retry sequence holds no thread. Holds no mutable state and may be shared
 * by any number of concurrent sequences.</p>
 *
 * <p>Computed delays saturate at {@link Long#MAX_VALUE} instead of overflowing;
 * suspensions are capped at {@link LyshraOpenRetryConstants#MAX_DELAY_MS}.</p>
 */
public class LyshraOpenRetryJitteredDelayScheduler implements ILyshraOpenRetryDelayScheduler {

    private final DoubleSupplier randomSource;
    private final Scheduler timer;

    public LyshraOpenRetryJitteredDelayScheduler() {
        this(() -> ThreadLocalRandom.current().nextDouble(), Schedulers.parallel());
    }

    /**
     * @param randomSource supplies values in {@code [0, 1]}
     * @param timer        scheduler the delays are timed on
     */
    public LyshraOpenRetryJitteredDelayScheduler(DoubleSupplier randomSource, Scheduler timer) {
        this.randomSource = Objects.requireNonNull(randomSource, "randomSource must not be null");
        this.timer = Objects.requireNonNull(timer, "timer must not be null");
    }

    @Override
    public long computeDelay(long baseDelayMs, double jitterFactor) {
        if (baseDelayMs <= 0) {
            return 0L;
        }
        double random = Math.min(1.0, Math.max(0.0, randomSource.getAsDouble()));
        double jitterMs = random * jitterFactor * baseDelayMs;
        if (jitterMs >= Long.MAX_VALUE - baseDelayMs) {
            return Long.MAX_VALUE;
        }
        // truncation keeps the result within base * (1 + jitterFactor)
        return baseDelayMs + (long) jitterMs;
    }

    @Override
    public Mono<Void> suspend(long delayMs) {
        if (delayMs <= 0) {
            return Mono.empty();
        }
        return Mono.delay(Duration.ofMillis(Math.min(delayMs, LyshraOpenRetryConstants.MAX_DELAY_MS)), timer).then();
    }
}
