package com.teamchat.gateway.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.gateway.ws.WsEnvelope;
import com.teamchat.gateway.ws.WsWriter;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class BroadcastRouterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final TopicSubscriptions subscriptions = new TopicSubscriptions();
    private final BroadcastRelay relay = mock(BroadcastRelay.class);
    private final BroadcastRouter router = new BroadcastRouter(subscriptions, relay, new WsWriter(objectMapper, Clock.systemUTC()));

    @Test
    void publishFrom_ShouldSkipExcludedSenderAndRelay() throws Exception {
        EmbeddedChannel sender = new EmbeddedChannel();
        EmbeddedChannel other = new EmbeddedChannel();
        EmbeddedChannel elsewhere = new EmbeddedChannel();
        subscriptions.subscribe("channel:1", sender);
        subscriptions.subscribe("channel:1", other);
        subscriptions.subscribe("channel:2", elsewhere);

        router.publishFrom("channel:1", "user_typing", Map.of("typing", true), sender);

        assertThat((Object) sender.readOutbound()).isNull();
        assertThat((Object) elsewhere.readOutbound()).isNull();
        TextWebSocketFrame frame = other.readOutbound();
        JsonNode node = objectMapper.readTree(frame.text());
        frame.release();
        assertThat(node.get("type").asText()).isEqualTo(WsEnvelope.PUSH);
        assertThat(node.get("topic").asText()).isEqualTo("channel:1");
        assertThat(node.get("event").asText()).isEqualTo("user_typing");
        assertThat(node.get("payload").get("typing").asBoolean()).isTrue();
        verify(relay).publish(eq("channel:1"), any(WsEnvelope.class));
    }

    @Test
    void deliverLocal_ShouldSkipInactiveChannels() {
        EmbeddedChannel alive = new EmbeddedChannel();
        EmbeddedChannel closed = new EmbeddedChannel();
        subscriptions.subscribe("channel:1", alive);
        subscriptions.subscribe("channel:1", closed);
        closed.close();

        WsEnvelope env = new WsEnvelope();
        env.setType(WsEnvelope.PUSH);
        env.setTopic("channel:1");
        env.setEvent("new_message");

        assertThat(router.deliverLocal("channel:1", env, null)).isEqualTo(1);
        TextWebSocketFrame frame = alive.readOutbound();
        assertThat(frame).isNotNull();
        frame.release();
    }
}
