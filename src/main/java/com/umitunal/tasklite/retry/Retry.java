package com.umitunal.tasklite.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Retry-with-backoff for fallible calls.
 *
 * <pre>{@code
 * String body = Retry.withRetry(() -> client.fetch(url),
 *         RetryConfig.newBuilder().withMaxRetries(3).build());
 * }</pre>
 *
 * <p>When the budget is exhausted, or the failure is not retryable, the last
 * failure is rethrown as is.
 */
public final class Retry {
    private static final Logger log = LoggerFactory.getLogger(Retry.class);

    private Retry() {
    }

    /**
     * Call {@code fn} up to {@code maxRetries + 1} times, sleeping on the
     * calling thread between attempts.
     */
    public static <T> T withRetry(Callable<T> fn, RetryConfig config) throws Exception {
        return withRetry(fn, config, Sleeper.THREAD_SLEEP);
    }

    public static <T> T withRetry(Callable<T> fn, RetryConfig config, Sleeper sleeper) throws Exception {
        for (int attempt = 0; ; attempt++) {
            try {
                return fn.call();
            } catch (Exception e) {
                if (attempt >= config.getMaxRetries() || !config.getRetryOn().test(e)) {
                    throw e;
                }
                long delay = config.delayBeforeRetry(attempt, e);
                log.debug("Attempt {}/{} failed ({}), retrying in {}ms",
                        attempt + 1, config.getMaxRetries() + 1, e.toString(), delay);
                sleeper.sleep(delay);
            }
        }
    }

    /**
     * Asynchronous variant: re-attempts are scheduled on a delayed executor,
     * no thread is blocked while waiting.
     */
    public static <T> CompletableFuture<T> withRetryAsync(Supplier<? extends CompletionStage<T>> fn,
                                                          RetryConfig config) {
        CompletableFuture<T> result = new CompletableFuture<>();
        attempt(fn, config, 0, result);
        return result;
    }

    /**
     * Retrying version of an asynchronous function.
     */
    public static <A, T> Function<A, CompletableFuture<T>> retrying(Function<A, ? extends CompletionStage<T>> fn,
                                                                    RetryConfig config) {
        return arg -> withRetryAsync(() -> fn.apply(arg), config);
    }

    public static boolean isRateLimitError(Throwable error) {
        return error instanceof ApiCallException && ((ApiCallException) error).isRateLimited();
    }

    public static boolean isNetworkError(Throwable error) {
        if (error instanceof IOException) {
            return true;
        }
        return error instanceof ApiCallException
                && (ApiCallException.Codes.NETWORK_ERROR.equals(((ApiCallException) error).getCode())
                || ApiCallException.Codes.TIMEOUT.equals(((ApiCallException) error).getCode()));
    }

    private static <T> void attempt(Supplier<? extends CompletionStage<T>> fn, RetryConfig config,
                                    int attempt, CompletableFuture<T> result) {
        CompletionStage<T> stage;
        try {
            stage = fn.get();
            if (stage == null) {
                throw new IllegalStateException("Retried function returned null instead of a CompletionStage");
            }
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }

        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            try {
                if (attempt >= config.getMaxRetries() || !config.getRetryOn().test(cause)) {
                    result.completeExceptionally(cause);
                    return;
                }
                long delay = config.delayBeforeRetry(attempt, cause);
                log.debug("Async attempt {}/{} failed ({}), retrying in {}ms",
                        attempt + 1, config.getMaxRetries() + 1, cause.toString(), delay);
                CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS)
                        .execute(() -> attempt(fn, config, attempt + 1, result));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
