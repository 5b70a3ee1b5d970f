package com.teamchat.gateway.ws;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * 每个连接一条 Future 链：同一连接的入站命令按到达顺序执行，上一条完成（含失败）后才启动下一条。
 *
 * <p>链尾吞掉异常以保证后续任务继续；返回给调用方的 future 保留异常。任务在 channel 的 eventLoop 上启动。</p>
 */
public final class WsChannelSerialQueue {

    private static final AttributeKey<AtomicReference<CompletableFuture<Void>>> ATTR_TAIL =
            AttributeKey.valueOf("chat:ws:serial:tail");

    private static final AttributeKey<AtomicInteger> ATTR_PENDING =
            AttributeKey.valueOf("chat:ws:serial:pending");

    private WsChannelSerialQueue() {
    }

    public static CompletableFuture<Void> enqueue(Channel channel, Supplier<? extends CompletionStage<?>> task) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(task, "task");

        AtomicReference<CompletableFuture<Void>> tail = attr(channel, ATTR_TAIL, () -> new AtomicReference<>(CompletableFuture.completedFuture(null)));
        AtomicInteger pending = attr(channel, ATTR_PENDING, AtomicInteger::new);

        while (true) {
            CompletableFuture<Void> prev = tail.get();
            CompletableFuture<Void> run = prev
                    .handle((v, e) -> null)
                    .thenCompose(ignored -> startOnEventLoop(channel, task));
            CompletableFuture<Void> next = run.handle((v, e) -> null);
            if (tail.compareAndSet(prev, next)) {
                pending.incrementAndGet();
                run.whenComplete((v, e) -> pending.decrementAndGet());
                return run;
            }
        }
    }

    /**
     * 排队数达到上限时直接失败（ws_queue_full），不入队。
     */
    public static CompletableFuture<Void> tryEnqueue(Channel channel, Supplier<? extends CompletionStage<?>> task, int maxPending) {
        AtomicInteger pending = attr(channel, ATTR_PENDING, AtomicInteger::new);
        if (pending.get() >= Math.max(1, maxPending)) {
            return CompletableFuture.failedFuture(new RejectedExecutionException("ws_queue_full"));
        }
        return enqueue(channel, task);
    }

    static int pending(Channel channel) {
        return attr(channel, ATTR_PENDING, AtomicInteger::new).get();
    }

    private static CompletableFuture<Void> startOnEventLoop(Channel channel, Supplier<? extends CompletionStage<?>> task) {
        CompletableFuture<Void> out = new CompletableFuture<>();
        Runnable start = () -> invoke(task).whenComplete((v, e) -> {
            if (e != null) {
                out.completeExceptionally(e);
            } else {
                out.complete(null);
            }
        });
        if (channel.eventLoop().inEventLoop()) {
            start.run();
        } else {
            channel.eventLoop().execute(start);
        }
        return out;
    }

    private static CompletableFuture<Void> invoke(Supplier<? extends CompletionStage<?>> task) {
        try {
            CompletionStage<?> stage = task.get();
            if (stage == null) {
                return CompletableFuture.completedFuture(null);
            }
            return stage.thenRun(() -> {
            }).toCompletableFuture();
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    private static <T> T attr(Channel channel, AttributeKey<T> key, Supplier<T> init) {
        T existing = channel.attr(key).get();
        if (existing != null) {
            return existing;
        }
        T created = init.get();
        T raced = channel.attr(key).setIfAbsent(created);
        return raced == null ? created : raced;
    }
}
