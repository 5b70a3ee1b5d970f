package com.teamchat.gateway.broadcast;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * 接收其他实例转发来的广播，写给本机订阅者。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BroadcastRelayListener implements MessageListener {

    private final ObjectMapper objectMapper;
    private final BroadcastRelay relay;
    private final BroadcastRouter router;

    @Override
    public void onMessage(Message message, byte[] pattern) {
        if (message == null || message.getBody() == null) {
            return;
        }
        String raw = new String(message.getBody(), StandardCharsets.UTF_8);
        BroadcastRelayMessage msg;
        try {
            msg = objectMapper.readValue(raw, BroadcastRelayMessage.class);
        } catch (Exception e) {
            log.debug("broadcast relay message parse failed: {}", e.toString());
            return;
        }
        if (msg == null || msg.topic() == null || msg.envelope() == null) {
            return;
        }
        if (relay.instanceId().equals(msg.origin())) {
            return;
        }
        router.deliverLocal(msg.topic(), msg.envelope(), null);
    }
}
