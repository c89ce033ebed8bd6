package io.deskrelay.queue;

import io.deskrelay.error.QueueClosedException;
import io.deskrelay.model.Task;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

final class LocalTaskQueueTest {

    @Test
    void deliversInFifoOrder() throws Exception {
        LocalTaskQueue queue = new LocalTaskQueue();
        queue.enqueue(task("tsk_a"));
        queue.enqueue(task("tsk_b"));
        queue.enqueue(task("tsk_c"));
        Assertions.assertEquals(3, queue.size());
        Assertions.assertEquals("tsk_a", queue.dequeue().orElseThrow().id());
        Assertions.assertEquals("tsk_b", queue.dequeue().orElseThrow().id());
        Assertions.assertEquals("tsk_c", queue.dequeue().orElseThrow().id());
        Assertions.assertEquals(0, queue.size());
    }

    @Test
    void blockedConsumerWakesOnEnqueue() throws Exception {
        LocalTaskQueue queue = new LocalTaskQueue();
        AtomicReference<Optional<Task>> taken = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        Thread consumer = new Thread(() -> {
            try {
                taken.set(queue.dequeue());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                done.countDown();
            }
        });
        consumer.start();
        Thread.sleep(50L);
        Assertions.assertEquals(1L, done.getCount());
        queue.enqueue(task("tsk_late"));
        Assertions.assertTrue(done.await(2, TimeUnit.SECONDS));
        Assertions.assertEquals("tsk_late", taken.get().orElseThrow().id());
    }

    @Test
    void closeReleasesConsumersAndRejectsProducers() throws Exception {
        LocalTaskQueue queue = new LocalTaskQueue();
        CountDownLatch released = new CountDownLatch(1);
        AtomicReference<Optional<Task>> taken = new AtomicReference<>();
        Thread consumer = new Thread(() -> {
            try {
                taken.set(queue.dequeue());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                released.countDown();
            }
        });
        consumer.start();
        Thread.sleep(50L);
        queue.close();
        Assertions.assertTrue(released.await(2, TimeUnit.SECONDS));
        Assertions.assertTrue(taken.get().isEmpty());
        Assertions.assertTrue(queue.isClosed());
        Assertions.assertThrows(QueueClosedException.class, () -> queue.enqueue(task("tsk_x")));
    }

    @Test
    void closedQueueHandsOutNothingEvenIfItemsRemain() throws Exception {
        LocalTaskQueue queue = new LocalTaskQueue();
        queue.enqueue(task("tsk_left"));
        queue.close();
        Assertions.assertTrue(queue.dequeue().isEmpty());
    }

    @Test
    void timedDequeueGivesUp() throws Exception {
        LocalTaskQueue queue = new LocalTaskQueue();
        long start = System.nanoTime();
        Assertions.assertTrue(queue.dequeue(30, TimeUnit.MILLISECONDS).isEmpty());
        Assertions.assertTrue(System.nanoTime() - start >= TimeUnit.MILLISECONDS.toNanos(25));
    }

    private static Task task(String id) {
        return Task.newPending(id, "echo", Map.of("msg", id), "alpha", 1L).withOwner("alpha");
    }
}
