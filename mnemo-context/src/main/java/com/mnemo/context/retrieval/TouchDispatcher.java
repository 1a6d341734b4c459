package com.mnemo.context.retrieval;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.mnemo.core.memory.MemoryStore;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bumps last-accessed times of surfaced memories in the background. Fire and forget: failures are logged, touches
 * that do not fit in the queue are dropped and nothing is ordered relative to reads.
 */
@Slf4j
public class TouchDispatcher implements AutoCloseable {
    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private final MemoryStore memoryStore;
    private final ThreadPoolExecutor executor;
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public TouchDispatcher(MemoryStore memoryStore) {
        this(memoryStore, DEFAULT_QUEUE_CAPACITY);
    }

    public TouchDispatcher(@NonNull MemoryStore memoryStore, int queueCapacity) {
        this.memoryStore = memoryStore;
        this.executor = new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                new ThreadFactoryBuilder()
                        .setNameFormat("mnemo-touch-%d")
                        .setDaemon(true)
                        .build(),
                (task, pool) -> {
                    dropped.incrementAndGet();
                    log.warn("Touch queue full, dropping touch");
                });
    }

    public void touch(@NonNull Collection<String> ids) {
        ids.forEach(this::touch);
    }

    public void touch(@NonNull String id) {
        executor.execute(() -> {
            try {
                memoryStore.touch(id);
            }
            catch (Exception e) {
                failed.incrementAndGet();
                log.warn("Could not touch memory {}: {}", id, e.getMessage());
            }
        });
    }

    public long droppedCount() {
        return dropped.get();
    }

    public long failedCount() {
        return failed.get();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
