package com.umitunal.tasklite.retry;

import java.time.Duration;

/**
 * Failure of an outbound call to an external service.
 *
 * <p>Carries the HTTP-style status code and an optional retry-after hint,
 * which {@link Retry} uses instead of its computed backoff.
 */
public class ApiCallException extends RecoverableException {

    /**
     * Error categories for outbound calls.
     */
    public static final class Codes {
        public static final String RATE_LIMITED = "RATE_LIMITED";
        public static final String API_ERROR = "API_ERROR";
        public static final String TIMEOUT = "TIMEOUT";
        public static final String NETWORK_ERROR = "NETWORK_ERROR";

        private Codes() {
        }
    }

    private final int statusCode;
    private final Duration retryAfter;

    public ApiCallException(String message, String code, int statusCode, Duration retryAfter, boolean recoverable) {
        super(message, code, recoverable);
        if (retryAfter != null && retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must not be negative");
        }
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    /**
     * Build from a response status. 429 maps to {@link Codes#RATE_LIMITED};
     * 429 and 5xx are recoverable.
     *
     * @param retryAfterHeader value of a {@code Retry-After} header in seconds, or null
     */
    public static ApiCallException fromResponse(int statusCode, String message, String retryAfterHeader) {
        String code = statusCode == 429 ? Codes.RATE_LIMITED : Codes.API_ERROR;
        boolean recoverable = statusCode >= 500 || statusCode == 429;
        String text = message == null || message.isBlank() ? "HTTP " + statusCode : message;
        return new ApiCallException(text, code, statusCode, parseRetryAfter(retryAfterHeader), recoverable);
    }

    /**
     * @return the status code, or 0 when the failure happened before a response
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the server-requested delay, or null
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean isRateLimited() {
        return Codes.RATE_LIMITED.equals(getCode());
    }

    private static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException e) {
            // HTTP-date form is not supported
            return null;
        }
    }
}
