package com.lyshra.open.retry.core.engine.logging;

import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryLogger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;

import java.util.Objects;

/**
 * Routes retry events to SLF4J.
 */
@Slf4j
public class Slf4jLyshraOpenRetryLogger implements ILyshraOpenRetryLogger {

    private final Logger delegate;

    public Slf4jLyshraOpenRetryLogger() {
        this(log);
    }

    public Slf4jLyshraOpenRetryLogger(Logger delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
    }

    @Override
    public void warn(String message) {
        delegate.warn(message);
    }

    @Override
    public void error(String message) {
        delegate.error(message);
    }
}
