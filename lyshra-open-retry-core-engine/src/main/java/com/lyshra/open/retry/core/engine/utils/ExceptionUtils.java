package com.lyshra.open.retry.core.engine.utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Utility class for walking exception cause chains.
 */
public final class ExceptionUtils {

    private ExceptionUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Lists an exception followed by its causes, outermost first.
     * Stops at the first repeated element so circular chains terminate.
     *
     * @param throwable the exception to unwind, may be null
     * @return the chain, empty for null
     */
    public static List<Throwable> causeChain(Throwable throwable) {
        if (throwable == null) {
            return List.of();
        }

        Set<Throwable> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Throwable> chain = new ArrayList<>();
        Throwable current = throwable;

        while (current != null && visited.add(current)) {
            chain.add(current);
            current = current.getCause();
        }

        return Collections.unmodifiableList(chain);
    }

    /**
     * Checks whether any exception in the cause chain matches the predicate.
     *
     * @param throwable the exception to search through
     * @param predicate the predicate to test against each exception in the chain
     * @return true if any exception in the chain matches, false otherwise
     */
    public static boolean matchesInCauseChain(Throwable throwable, Predicate<Throwable> predicate) {
        for (Throwable current : causeChain(throwable)) {
            if (predicate.test(current)) {
                return true;
            }
        }
        return false;
    }
}
