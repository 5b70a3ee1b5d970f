package com.teamchat.gateway.ws;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WsChannelSerialQueueTest {

    @Test
    void shouldRunTasksInArrivalOrder() throws Exception {
        EmbeddedChannel ch = new EmbeddedChannel();
        CountDownLatch firstStarted = new CountDownLatch(1);
        CountDownLatch allowFirstFinish = new CountDownLatch(1);
        List<String> order = new CopyOnWriteArrayList<>();

        CompletableFuture<Void> f1 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.runAsync(() -> {
            firstStarted.countDown();
            await(allowFirstFinish);
            order.add("first");
        }));
        CompletableFuture<Void> f2 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.runAsync(() -> order.add("second")));

        pumpUntil(ch, firstStarted, 1000);
        TimeUnit.MILLISECONDS.sleep(50);
        assertThat(order).isEmpty();

        allowFirstFinish.countDown();
        pumpUntilDone(ch, CompletableFuture.allOf(f1, f2), 2000);
        assertThat(order).containsExactly("first", "second");
    }

    @Test
    void shouldContinueAfterFailure() throws Exception {
        EmbeddedChannel ch = new EmbeddedChannel();
        AtomicBoolean secondRan = new AtomicBoolean(false);

        CompletableFuture<Void> f1 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.failedFuture(new IllegalStateException("boom")));
        CompletableFuture<Void> f2 = WsChannelSerialQueue.enqueue(ch, () -> CompletableFuture.runAsync(() -> secondRan.set(true)));

        pumpUntilDone(ch, f2, 2000);
        assertThat(f1).isCompletedExceptionally();
        assertThat(secondRan).isTrue();
    }

    @Test
    void tryEnqueue_ShouldRejectWhenBacklogFull() throws Exception {
        EmbeddedChannel ch = new EmbeddedChannel();
        CompletableFuture<Void> blocker = new CompletableFuture<>();

        WsChannelSerialQueue.tryEnqueue(ch, () -> blocker, 1);
        CompletableFuture<Void> rejected = WsChannelSerialQueue.tryEnqueue(ch, () -> CompletableFuture.completedFuture(null), 1);

        assertThatThrownBy(rejected::join).hasCauseInstanceOf(RejectedExecutionException.class);
        assertThat(WsChannelSerialQueue.pending(ch)).isEqualTo(1);

        blocker.complete(null);
        ch.runPendingTasks();
        assertThat(WsChannelSerialQueue.pending(ch)).isZero();
    }

    private static void await(CountDownLatch latch) {
        try {
            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void pumpUntil(EmbeddedChannel ch, CountDownLatch latch, long timeoutMs) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (latch.getCount() > 0 && System.currentTimeMillis() < deadline) {
            ch.runPendingTasks();
            TimeUnit.MILLISECONDS.sleep(5);
        }
        assertThat(latch.getCount()).isZero();
    }

    private static void pumpUntilDone(EmbeddedChannel ch, CompletableFuture<?> f, long timeoutMs) throws Exception {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (!f.isDone() && System.currentTimeMillis() < deadline) {
            ch.runPendingTasks();
            TimeUnit.MILLISECONDS.sleep(5);
        }
        f.get(100, TimeUnit.MILLISECONDS);
    }
}
