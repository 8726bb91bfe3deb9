package com.kotsin.hotspot.retry;

import com.kotsin.hotspot.config.ProcessingConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Retry handler with exponential backoff for event store writes.
 *
 * Delays: 100ms, 200ms, 400ms ... capped at {@link ProcessingConstants#MAX_RETRY_DELAY_MS}.
 */
@Component
@Slf4j
public class RetryHandler {

    public <T> T executeWithRetry(Supplier<T> operation, String operationName) {
        return executeWithRetry(operation, operationName, ProcessingConstants.MAX_RETRY_ATTEMPTS);
    }

    public <T> T executeWithRetry(Supplier<T> operation, String operationName, int maxAttempts) {
        int attempt = 0;
        RuntimeException lastException = null;

        while (attempt < maxAttempts) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                lastException = e;
                attempt++;

                if (attempt >= maxAttempts) {
                    log.error("[RETRY] '{}' failed after {} attempts", operationName, maxAttempts);
                    break;
                }

                long delayMs = backoffDelay(attempt);
                log.warn("[RETRY] '{}' failed (attempt {}/{}). Retrying in {}ms. Error: {}",
                        operationName, attempt, maxAttempts, delayMs, e.getMessage());
                sleep(delayMs);
            }
        }

        throw new RetryExhaustedException(
                String.format("Operation '%s' failed after %d attempts", operationName, maxAttempts),
                lastException);
    }

    public void executeWithRetry(Runnable operation, String operationName) {
        executeWithRetry(() -> {
            operation.run();
            return null;
        }, operationName);
    }

    long backoffDelay(int attempt) {
        long delay = (long) (ProcessingConstants.INITIAL_RETRY_DELAY_MS *
                Math.pow(ProcessingConstants.RETRY_BACKOFF_MULTIPLIER, attempt - 1));
        return Math.min(delay, ProcessingConstants.MAX_RETRY_DELAY_MS);
    }

    protected void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RetryExhaustedException("Retry interrupted", ie);
        }
    }

    /**
     * Raised when every attempt failed or the wait between attempts was interrupted.
     */
    public static class RetryExhaustedException extends RuntimeException {
        public RetryExhaustedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
