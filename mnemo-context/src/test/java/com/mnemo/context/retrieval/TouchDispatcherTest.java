package com.mnemo.context.retrieval;

import com.mnemo.core.memory.MemoryStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class TouchDispatcherTest {

    @Test
    void failuresAreSwallowed() {
        final var store = mock(MemoryStore.class);
        doThrow(new IllegalStateException("nope")).when(store).touch("bad");
        try (final var dispatcher = new TouchDispatcher(store)) {
            dispatcher.touch(List.of("bad", "good"));
            await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(store).touch("good"));
            assertEquals(1, dispatcher.failedCount());
        }
    }

    @Test
    void overflowIsDropped() throws InterruptedException {
        final var store = mock(MemoryStore.class);
        final var release = new CountDownLatch(1);
        final var started = new CountDownLatch(1);
        doAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(store).touch(anyString());
        try (final var dispatcher = new TouchDispatcher(store, 2)) {
            dispatcher.touch("first");
            assertTrue(started.await(5, TimeUnit.SECONDS));
            dispatcher.touch(List.of("q1", "q2", "overflow1", "overflow2"));
            assertEquals(2, dispatcher.droppedCount());
            release.countDown();
        }
    }
}
