package com.lyshra.open.retry.core.engine.executor;

import com.lyshra.open.retry.core.engine.config.LyshraOpenRetryConfig;
import com.lyshra.open.retry.core.engine.config.LyshraOpenRetryOptions;
import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryPolicy;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Runs a fallible asynchronous operation with bounded, jittered retries.
 *
 * <p>Attempts of one call are strictly sequential. The returned publisher is
 * lazy: nothing runs until it is subscribed, and each subscription starts a
 * fresh retry sequence. The outcome is one of:</p>
 * <ul>
 *   <li>the operation's value (or empty completion) from the first successful attempt</li>
 *   <li>the original error, as soon as the policy classifies a failure as non-retryable</li>
 *   <li>{@link com.lyshra.open.retry.integration.exception.LyshraOpenRetryExhaustedException}
 *       wrapping the last error once every attempt failed with a retryable error</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * executor.execute(() -> webClient.get().uri("/orders/{id}", id).retrieve().bodyToMono(Order.class),
 *                 LyshraOpenRetryOptions.builder().maxRetries(5).baseDelayMs(200L).build())
 *     .timeout(Duration.ofSeconds(30))
 *     .subscribe(order -> ...);
 * }</pre>
 *
 * <p>There is no cancellation token. To give up early, cancel the
 * subscription or race it against a timeout as above.</p>
 */
public interface ILyshraOpenRetryExecutor {

    /**
     * Executes with the executor defaults and the default policy of the executor.
     */
    default <T> Mono<T> execute(Supplier<? extends Mono<T>> operation) {
        return execute(operation, LyshraOpenRetryOptions.NONE, null);
    }

    default <T> Mono<T> execute(Supplier<? extends Mono<T>> operation, LyshraOpenRetryOptions options) {
        return execute(operation, options, null);
    }

    default <T> Mono<T> execute(Supplier<? extends Mono<T>> operation, ILyshraOpenRetryPolicy policy) {
        return execute(operation, LyshraOpenRetryOptions.NONE, policy);
    }

    /**
     * Executes an operation with retries.
     *
     * @param operation produces the publisher of one attempt; called once per attempt
     * @param options   per-call overrides, may be null
     * @param policy    classifier for this call; when null, {@code options.retryPolicy}
     *                  and then the executor default apply
     * @return the outcome of the retry sequence
     */
    <T> Mono<T> execute(Supplier<? extends Mono<T>> operation, LyshraOpenRetryOptions options,
                        ILyshraOpenRetryPolicy policy);

    /**
     * Variant for {@link CompletionStage} based operations. The sequence starts immediately.
     */
    <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation,
                                          LyshraOpenRetryOptions options,
                                          ILyshraOpenRetryPolicy policy);

    /**
     * Gets the construction-time defaults every call is merged onto.
     */
    LyshraOpenRetryConfig getDefaultConfig();
}
