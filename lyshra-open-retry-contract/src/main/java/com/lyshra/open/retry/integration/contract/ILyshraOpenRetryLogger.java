package com.lyshra.open.retry.integration.contract;

import com.lyshra.open.retry.integration.enumerations.LyshraOpenRetryLogSeverity;

/**
 * Leveled sink for retry events. Messages arrive pre-formatted.
 */
public interface ILyshraOpenRetryLogger {

    void warn(String message);

    void error(String message);

    default void log(LyshraOpenRetryLogSeverity severity, String message) {
        if (severity == LyshraOpenRetryLogSeverity.ERROR) {
            error(message);
        } else {
            warn(message);
        }
    }
}
