package com.lyshra.open.retry.integration.enumerations;

public enum LyshraOpenRetryLogSeverity {
    WARN,
    ERROR
}
