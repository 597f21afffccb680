package com.lyshra.open.retry.core.engine.error;

import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryPolicy;

import java.util.List;
import java.util.Objects;

/**
 * Ready-made retry policies.
 */
public final class LyshraOpenRetryPolicies {

    private static final ILyshraOpenRetryPolicy ALWAYS = error -> true;
    private static final ILyshraOpenRetryPolicy NEVER = error -> false;

    private LyshraOpenRetryPolicies() {
        // Utility class
    }

    public static ILyshraOpenRetryPolicy defaultPolicy() {
        return LyshraOpenRetryDefaultClassifier.INSTANCE;
    }

    public static ILyshraOpenRetryPolicy always() {
        return ALWAYS;
    }

    public static ILyshraOpenRetryPolicy never() {
        return NEVER;
    }

    /**
     * Retries errors that are instances of any of the given types.
     */
    @SafeVarargs
    public static ILyshraOpenRetryPolicy retryOn(Class<? extends Throwable>... errorTypes) {
        List<Class<? extends Throwable>> types = List.of(Objects.requireNonNull(errorTypes, "errorTypes must not be null"));
        return error -> error != null && types.stream().anyMatch(type -> type.isInstance(error));
    }
}
