package com.lyshra.open.retry.core.engine.error;

import com.lyshra.open.retry.integration.constant.LyshraOpenRetryConstants;
import com.lyshra.open.retry.integration.contract.ILyshraOpenRetryErrorInfo;
import org.springframework.web.ErrorResponse;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts the HTTP status code a failure carries.
 *
 * <p>Locations are checked in this order:</p>
 * <ol>
 *   <li>Direct field: {@link ILyshraOpenRetryErrorInfo#getStatusCode()}, {@link ErrorResponse#getStatusCode()}</li>
 *   <li>Nested metadata: {@code httpStatusCode}, {@code statusCode} or {@code status} in
 *       {@link ILyshraOpenRetryErrorInfo#getMetadata()}</li>
 *   <li>Nested response: the received response of a {@link WebClientResponseException}
 *       or {@link RestClientResponseException}</li>
 * </ol>
 */
public final class LyshraOpenRetryStatusCodeResolver {

    private static final List<String> METADATA_KEYS = List.of(
            LyshraOpenRetryConstants.METADATA_HTTP_STATUS_CODE,
            LyshraOpenRetryConstants.METADATA_STATUS_CODE,
            LyshraOpenRetryConstants.METADATA_STATUS);

    private LyshraOpenRetryStatusCodeResolver() {
        // Utility class
    }

    /**
     * Resolves the status code of a single exception, ignoring its causes.
     *
     * @param error the exception to inspect
     * @return the status code, or empty if none is present
     */
    public static Optional<Integer> resolve(Throwable error) {
        if (error == null) {
            return Optional.empty();
        }

        if (error instanceof ILyshraOpenRetryErrorInfo info) {
            if (info.getStatusCode() != null) {
                return Optional.of(info.getStatusCode());
            }
            Optional<Integer> fromMetadata = fromMetadata(info.getMetadata());
            if (fromMetadata.isPresent()) {
                return fromMetadata;
            }
        }

        if (error instanceof ErrorResponse response) {
            return Optional.of(response.getStatusCode().value());
        }
        if (error instanceof WebClientResponseException ex) {
            return Optional.of(ex.getStatusCode().value());
        }
        if (error instanceof RestClientResponseException ex) {
            return Optional.of(ex.getStatusCode().value());
        }

        return Optional.empty();
    }

    private static Optional<Integer> fromMetadata(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Optional.empty();
        }
        for (String key : METADATA_KEYS) {
            Optional<Integer> status = toStatus(metadata.get(key));
            if (status.isPresent()) {
                return status;
            }
        }
        return Optional.empty();
    }

    private static Optional<Integer> toStatus(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.intValue());
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Optional.of(Integer.parseInt(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
