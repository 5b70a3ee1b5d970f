package com.teamchat.gateway.broadcast;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.util.backoff.FixedBackOff;

@Configuration
public class BroadcastRelayConfig {

    @Bean
    public RedisMessageListenerContainer broadcastRelayListenerContainer(
            RedisConnectionFactory connectionFactory,
            BroadcastRelayListener listener
    ) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer() {
            @Override
            public boolean isAutoStartup() {
                return false;
            }
        };
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(listener, new ChannelTopic(BroadcastRelay.CHANNEL));
        // 由 BroadcastRelayListenerStarter 负责启动与失败重试，Redis 不可用不阻断网关启动
        container.setRecoveryBackoff(new FixedBackOff(1000, FixedBackOff.UNLIMITED_ATTEMPTS));
        return container;
    }
}
