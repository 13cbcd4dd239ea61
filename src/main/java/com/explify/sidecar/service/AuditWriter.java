package com.explify.sidecar.service;

import jakarta.annotation.PreDestroy;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;

/**
 * Background worker for fire-and-forget audit writes.
 *
 * <p>One thread drains a bounded queue. When the queue is full the oldest pending write is
 * discarded to admit the new one, which bounds memory under a stalled database. Failed writes are
 * logged and counted, never retried and never rethrown to the submitter.</p>
 *
 * <p>Writes are not tied to the request that scheduled them: an aborted request does not cancel
 * them, and pending writes are drained on shutdown. The writer depends on the Mongo template so
 * the container destroys it first and the drain still has a live client.</p>
 */
@Component
@DependsOn("mongoTemplate")
public class AuditWriter {
    private static final Logger log = LoggerFactory.getLogger(AuditWriter.class);
    private final ThreadPoolExecutor executor;
    private final DropOldestHandler rejectionHandler;
    private final AtomicLong failedWrites = new AtomicLong(0);
    private final long shutdownTimeoutSeconds;

    public AuditWriter(@Value("${app.audit.queue-capacity:1000}") int queueCapacity,
                       @Value("${app.audit.shutdown-timeout-seconds:10}") long shutdownTimeoutSeconds) {
        int capacity = Math.max(1, queueCapacity);
        this.rejectionHandler = new DropOldestHandler();
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(capacity), new NamedThreadFactory("audit-writer-"), this.rejectionHandler);
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;
        log.info("Audit writer initialized: queue={}", capacity);
    }

    /**
     * Schedules a write. Never blocks on the write and never throws.
     */
    public void submit(String description, Runnable write) {
        try {
            this.executor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    long failures = this.failedWrites.incrementAndGet();
                    log.error("Audit write failed ({}), total failures={}: {}", description, failures, e.getMessage());
                }
            });
        } catch (RuntimeException e) {
            this.rejectionHandler.dropped.incrementAndGet();
            log.error("Audit write not scheduled ({}): {}", description, e.getMessage());
        }
    }

    public long getDroppedCount() {
        return this.rejectionHandler.dropped.get();
    }

    public long getFailedCount() {
        return this.failedWrites.get();
    }

    public int getPendingCount() {
        return this.executor.getQueue().size();
    }

    @PreDestroy
    public void shutdown() {
        this.executor.shutdown();
        try {
            if (!this.executor.awaitTermination(this.shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                int abandoned = this.executor.shutdownNow().size();
                log.error("Audit writer did not drain within {}s, {} writes abandoned", this.shutdownTimeoutSeconds, abandoned);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            int abandoned = this.executor.shutdownNow().size();
            log.error("Interrupted while draining audit writer, {} writes abandoned", abandoned);
        }
    }

    static final class DropOldestHandler implements RejectedExecutionHandler {
        private final AtomicLong dropped = new AtomicLong(0);

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            if (executor.isShutdown()) {
                long count = this.dropped.incrementAndGet();
                log.warn("Audit write submitted after shutdown, discarded (total dropped={})", count);
                return;
            }
            if (executor.getQueue().poll() != null) {
                long count = this.dropped.incrementAndGet();
                log.warn("Audit queue full, oldest pending write dropped (total dropped={})", count);
            }
            executor.execute(task);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(this.prefix + this.counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
