package com.teamchat.gateway.broadcast;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 后台启动广播监听器，失败按指数退避重试（200ms 起，封顶 5s）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BroadcastRelayListenerStarter implements SmartLifecycle {

    private static final ScheduledExecutorService RETRY_SCHEDULER = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "broadcast-relay-retry");
        t.setDaemon(true);
        return t;
    });

    private final RedisMessageListenerContainer container;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger attempt = new AtomicInteger(0);

    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        scheduleStart(0);
    }

    private void scheduleStart(long delayMs) {
        RETRY_SCHEDULER.schedule(() -> {
            if (!started.get()) {
                return;
            }
            try {
                container.start();
                attempt.set(0);
                log.info("broadcast relay listener started");
            } catch (Exception e) {
                int n = attempt.incrementAndGet();
                log.warn("broadcast relay listener start failed (attempt={}): {}", n, e.toString());
                scheduleStart(backoffMs(n));
            }
        }, Math.max(0, delayMs), TimeUnit.MILLISECONDS);
    }

    static long backoffMs(int attempt) {
        if (attempt <= 0) {
            return 200;
        }
        long v = 200L * (1L << Math.min(6, attempt - 1));
        return Math.min(5000L, v);
    }

    @Override
    public void stop() {
        started.set(false);
        try {
            container.stop();
        } catch (Exception e) {
            log.debug("stop broadcast relay listener failed: {}", e.toString());
        }
    }

    @Override
    public boolean isRunning() {
        return started.get() && container.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
