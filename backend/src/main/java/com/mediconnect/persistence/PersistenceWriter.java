package com.mediconnect.persistence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs store writes and keeps the ones that failed for retry. Writes are keyed by the record
 * they touch; a newer write for a key replaces an older buffered one, since each write
 * carries the full current state of its record. A write the store rejects as stale is never
 * retried.
 */
@Component
@Slf4j
public class PersistenceWriter {

    private final Map<String, PendingWrite> pending = new ConcurrentHashMap<>();
    private final Executor persistenceExecutor;
    private final Clock clock;

    @Value("${mediconnect.persistence.max-attempts:10}")
    private int maxAttempts = 10;

    @Value("${mediconnect.persistence.base-delay-ms:1000}")
    private long baseDelayMs = 1000;

    @Value("${mediconnect.persistence.max-delay-ms:60000}")
    private long maxDelayMs = 60000;

    public PersistenceWriter(@Qualifier("persistenceExecutor") Executor persistenceExecutor, Clock clock) {
        this.persistenceExecutor = persistenceExecutor;
        this.clock = clock;
    }

    /**
     * Runs the write on the calling thread.
     *
     * @return false if it failed and was buffered for retry
     * @throws OptimisticLockingFailureException if the store holds a newer version; nothing is buffered
     */
    public boolean writeNow(String key, Runnable write) {
        try {
            write.run();
            pending.remove(key);
            return true;
        } catch (OptimisticLockingFailureException e) {
            pending.remove(key);
            throw e;
        } catch (RuntimeException e) {
            log.warn("Write {} failed, buffered for retry: {}", key, e.getMessage());
            buffer(key, write);
            return false;
        }
    }

    /**
     * Runs the write on the persistence executor without waiting for it.
     */
    public void submit(String key, Runnable write) {
        try {
            persistenceExecutor.execute(() -> writeNow(key, write));
        } catch (RejectedExecutionException e) {
            log.warn("Persistence executor rejected write {}; buffered for retry", key);
            buffer(key, write);
        }
    }

    /**
     * Retries the buffered write for the key right away.
     *
     * @return true if nothing is left pending for the key
     */
    public boolean flush(String key) {
        PendingWrite write = pending.get(key);
        if (write == null) {
            return true;
        }
        return attempt(key, write, clock.instant());
    }

    /**
     * Forgets the buffered write for the key, if any.
     */
    public void discard(String key) {
        if (pending.remove(key) != null) {
            log.info("Discarded buffered write {}", key);
        }
    }

    public boolean isPending(String key) {
        return pending.containsKey(key);
    }

    public int pendingCount() {
        return pending.size();
    }

    @Scheduled(fixedDelayString = "${mediconnect.persistence.retry-interval-ms:5000}")
    public void retryPending() {
        if (pending.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        int recovered = 0;
        for (Map.Entry<String, PendingWrite> entry : pending.entrySet()) {
            PendingWrite write = entry.getValue();
            if (now.isBefore(write.nextAttemptAt)) {
                continue;
            }
            if (attempt(entry.getKey(), write, now)) {
                recovered++;
            }
        }
        if (recovered > 0) {
            log.info("Recovered {} buffered write(s); {} still pending", recovered, pending.size());
        }
    }

    private boolean attempt(String key, PendingWrite write, Instant now) {
        try {
            write.action.run();
            pending.remove(key, write);
            return true;
        } catch (OptimisticLockingFailureException e) {
            pending.remove(key, write);
            log.warn("Dropping write {}: the store holds a newer version", key);
            return true;
        } catch (RuntimeException e) {
            int attempts = write.attempts + 1;
            if (attempts >= maxAttempts) {
                pending.remove(key, write);
                log.error("Dropping write {} after {} attempts: {}", key, attempts, e.getMessage());
            } else {
                pending.replace(key, write, new PendingWrite(write.action, attempts, nextAttempt(now, attempts)));
                log.warn("Retry {}/{} of write {} failed: {}", attempts, maxAttempts, key, e.getMessage());
            }
            return false;
        }
    }

    private void buffer(String key, Runnable write) {
        Instant now = clock.instant();
        pending.put(key, new PendingWrite(write, 1, nextAttempt(now, 1)));
    }

    private Instant nextAttempt(Instant now, int attempts) {
        long base = Math.max(1, baseDelayMs);
        long max = Math.max(base, maxDelayMs);
        // base * 2^(attempts-1), capped
        long delay = base * (1L << Math.min(20, Math.max(0, attempts - 1)));
        return now.plus(Duration.ofMillis(Math.min(delay, max)));
    }

    private static final class PendingWrite {
        private final Runnable action;
        private final int attempts;
        private final Instant nextAttemptAt;

        private PendingWrite(Runnable action, int attempts, Instant nextAttemptAt) {
            this.action = action;
            this.attempts = attempts;
            this.nextAttemptAt = nextAttemptAt;
        }
    }
}
