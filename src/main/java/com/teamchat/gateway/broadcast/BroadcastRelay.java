package com.teamchat.gateway.broadcast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.gateway.config.GatewayProperties;
import com.teamchat.gateway.ws.WsEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 把本机广播经 Redis Pub/Sub 转发给其他实例。投递至多一次，Redis 不可用时只影响跨实例部分。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BroadcastRelay {

    public static final String CHANNEL = "chat:bcast";

    /**
     * Redis 故障后 10 秒内直接跳过 publish，避免每次广播都卡在连接超时上。
     */
    private static final long REDIS_FAIL_FAST_MS = 10_000;
    private static final AtomicLong REDIS_UNAVAILABLE_UNTIL_MS = new AtomicLong(0);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final GatewayProperties gatewayProps;

    public void publish(String topic, WsEnvelope envelope) {
        if (topic == null || envelope == null) {
            return;
        }
        if (shouldFailFast()) {
            return;
        }
        try {
            BroadcastRelayMessage msg = new BroadcastRelayMessage(instanceId(), topic, envelope, System.currentTimeMillis());
            redis.convertAndSend(CHANNEL, objectMapper.writeValueAsString(msg));
        } catch (Exception e) {
            log.debug("broadcast relay publish failed: topic={}, event={}, err={}", topic, envelope.getEvent(), e.toString());
            markRedisDown();
        }
    }

    public String instanceId() {
        return gatewayProps.instanceIdEffective();
    }

    static boolean shouldFailFast() {
        return System.currentTimeMillis() < REDIS_UNAVAILABLE_UNTIL_MS.get();
    }

    static void markRedisDown() {
        long until = System.currentTimeMillis() + REDIS_FAIL_FAST_MS;
        while (true) {
            long prev = REDIS_UNAVAILABLE_UNTIL_MS.get();
            if (prev >= until) {
                return;
            }
            if (REDIS_UNAVAILABLE_UNTIL_MS.compareAndSet(prev, until)) {
                return;
            }
        }
    }

    static void resetFailFast() {
        REDIS_UNAVAILABLE_UNTIL_MS.set(0);
    }
}
