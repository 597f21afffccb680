package com.lyshra.open.retry.integration.contract;

import java.util.Map;

/**
 * Classification hints a failure can carry for the default retry classifier.
 */
public interface ILyshraOpenRetryErrorInfo {
    String getErrorCode();
    Integer getStatusCode();
    Map<String, Object> getMetadata();
}
