package com.teamchat.gateway.broadcast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.gateway.config.GatewayProperties;
import com.teamchat.gateway.ws.WsEnvelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class BroadcastRelayTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StringRedisTemplate redis = mock(StringRedisTemplate.class);
    private final GatewayProperties props = new GatewayProperties(null, 9001, null, "gw-a", null, null);
    private final BroadcastRelay relay = new BroadcastRelay(redis, objectMapper, props);

    @AfterEach
    void reset() {
        BroadcastRelay.resetFailFast();
    }

    @Test
    void publish_ShouldFailFastAfterRedisError() {
        doThrow(new RedisConnectionFailureException("down")).when(redis).convertAndSend(anyString(), anyString());

        relay.publish("channel:1", envelope());
        relay.publish("channel:1", envelope());

        verify(redis, times(1)).convertAndSend(anyString(), anyString());
        assertThat(BroadcastRelay.shouldFailFast()).isTrue();
    }

    @Test
    void listener_ShouldIgnoreOwnMessagesAndDeliverOthers() throws Exception {
        BroadcastRouter router = mock(BroadcastRouter.class);
        BroadcastRelayListener listener = new BroadcastRelayListener(objectMapper, relay, router);

        String own = objectMapper.writeValueAsString(new BroadcastRelayMessage("gw-a", "channel:1", envelope(), 1L));
        String remote = objectMapper.writeValueAsString(new BroadcastRelayMessage("gw-b", "channel:1", envelope(), 1L));
        listener.onMessage(new DefaultMessage(BroadcastRelay.CHANNEL.getBytes(StandardCharsets.UTF_8), own.getBytes(StandardCharsets.UTF_8)), null);
        verify(router, never()).deliverLocal(anyString(), any(), any());

        listener.onMessage(new DefaultMessage(BroadcastRelay.CHANNEL.getBytes(StandardCharsets.UTF_8), remote.getBytes(StandardCharsets.UTF_8)), null);
        verify(router).deliverLocal(eq("channel:1"), any(WsEnvelope.class), isNull());
    }

    @Test
    void backoff_ShouldGrowAndCap() {
        assertThat(BroadcastRelayListenerStarter.backoffMs(1)).isEqualTo(200);
        assertThat(BroadcastRelayListenerStarter.backoffMs(2)).isEqualTo(400);
        assertThat(BroadcastRelayListenerStarter.backoffMs(5)).isEqualTo(3200);
        assertThat(BroadcastRelayListenerStarter.backoffMs(20)).isEqualTo(5000);
    }

    private static WsEnvelope envelope() {
        WsEnvelope env = new WsEnvelope();
        env.setType(WsEnvelope.PUSH);
        env.setTopic("channel:1");
        env.setEvent("new_message");
        return env;
    }
}
