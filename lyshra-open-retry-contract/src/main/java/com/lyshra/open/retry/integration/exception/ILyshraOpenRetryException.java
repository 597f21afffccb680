package com.lyshra.open.retry.integration.exception;

import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryErrorInfo;

/**
 * Marker for failures that describe themselves to the retry classifier.
 */
public interface ILyshraOpenRetryException extends ILyshraOpenRetryErrorInfo {
}
