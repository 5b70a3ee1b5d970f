package com.teamchat.gateway.broadcast;

import com.teamchat.domain.service.ChatEventPublisher;
import com.teamchat.gateway.ws.WsEnvelope;
import com.teamchat.gateway.ws.WsWriter;
import io.netty.channel.Channel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * topic 广播：写给本机所有订阅者，再经 {@link BroadcastRelay} 转发给其他实例。
 *
 * <p>至多一次：写失败（连接已断）只记 debug，不重试。</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BroadcastRouter implements ChatEventPublisher {

    private final TopicSubscriptions subscriptions;
    private final BroadcastRelay relay;
    private final WsWriter wsWriter;

    @Override
    public void publish(String topic, String event, Object payload) {
        publishFrom(topic, event, payload, null);
    }

    /**
     * @param exclude 不需要收到的连接（一般是发起方自己），为空表示全部
     */
    public void publishFrom(String topic, String event, Object payload, Channel exclude) {
        if (topic == null || event == null) {
            return;
        }
        WsEnvelope env = wsWriter.push(topic, event, payload);
        deliverLocal(topic, env, exclude);
        relay.publish(topic, env);
    }

    /**
     * 只写本机订阅者；跨实例消息落地时也走这里。
     *
     * @return 实际尝试写出的连接数
     */
    public int deliverLocal(String topic, WsEnvelope env, Channel exclude) {
        int n = 0;
        for (Channel ch : subscriptions.subscribers(topic)) {
            if (ch == null || ch == exclude || !ch.isActive()) {
                continue;
            }
            n++;
            wsWriter.write(ch, env).addListener(f -> {
                if (!f.isSuccess()) {
                    log.debug("broadcast write dropped: topic={}, event={}, channel={}, err={}",
                            topic, env.getEvent(), ch.id().asShortText(), String.valueOf(f.cause()));
                }
            });
        }
        return n;
    }
}
