package com.b2b.inventory.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Retry and chunking rules for read-only queries.
 * Writes are never retried here: they run in a single transaction and fail fast.
 */
@Component
@Slf4j
public class ReadRetryPolicy {

    private static final long MAX_DELAY_MS = 60_000L;

    /**
     * Maximum ids per IN clause. SQL Server caps a statement at 2100 parameters, Oracle at 1000.
     */
    private final int chunkSize;
    private final int maxRetries;
    private final long retryDelayMs;

    public ReadRetryPolicy(
            @Value("${app.db.chunk-size:500}") int chunkSize,
            @Value("${app.db.max-retries:2}") int maxRetries,
            @Value("${app.db.retry-delay-ms:100}") long retryDelayMs) {
        if (chunkSize < 1) {
            throw new IllegalArgumentException("app.db.chunk-size must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryDelayMs = Math.max(1L, retryDelayMs);
        log.info("ReadRetryPolicy initialized with chunk size: {}, maxRetries: {}, retryDelayMs: {}ms",
                chunkSize, maxRetries, retryDelayMs);
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Runs a read, retrying transient {@link DataAccessException}s with exponential backoff and jitter.
     */
    public <T> T withRetry(String operationName, Supplier<T> operation) {
        int attempt = 0;
        final int totalAttempts = maxRetries + 1;
        while (true) {
            try {
                attempt++;
                return operation.get();
            } catch (DataAccessException e) {
                if (attempt > maxRetries) {
                    log.error("Operation '{}' failed after {} attempts: {}",
                            operationName, attempt, e.getMessage());
                    throw e;
                }

                long baseDelay = retryDelayMs * (1L << (attempt - 1));
                long jitter = ThreadLocalRandom.current().nextLong(0, Math.min(1000L, baseDelay));
                long delay = Math.min(baseDelay + jitter, MAX_DELAY_MS);

                log.warn("Operation '{}' failed (attempt {}/{}), retrying in {}ms: {}",
                        operationName, attempt, totalAttempts, delay, e.getMessage());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    public <T> List<List<T>> partition(List<T> list) {
        List<List<T>> partitions = new ArrayList<>();
        for (int i = 0; i < list.size(); i += chunkSize) {
            partitions.add(list.subList(i, Math.min(i + chunkSize, list.size())));
        }
        return partitions;
    }
}
