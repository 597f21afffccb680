package com.lyshra.open.retry.integration.contract;

import reactor.core.publisher.Mono;

/**
 * Computes the backoff between two attempts and waits it out without
 * blocking a thread.
 */
public interface ILyshraOpenRetryDelayScheduler {

    /**
     * Computes a jittered delay.
     *
     * @param baseDelayMs  the minimum delay in milliseconds
     * @param jitterFactor the maximum additive share of {@code baseDelayMs}
     * @return a delay in {@code [baseDelayMs, baseDelayMs * (1 + jitterFactor)]}
     */
    long computeDelay(long baseDelayMs, double jitterFactor);

    /**
     * Completes after {@code delayMs} milliseconds. Only the subscriber of
     * the returned publisher waits; no thread is parked.
     *
     * @param delayMs the delay in milliseconds
     * @return a publisher that completes when the delay elapsed
     */
    Mono<Void> suspend(long delayMs);
}
