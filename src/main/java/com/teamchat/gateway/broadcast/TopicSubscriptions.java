package com.teamchat.gateway.broadcast;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本机订阅表：topic -> 订阅了它的 channel。channel 自己也记一份已加入的 topic，断线时反查。
 */
@Component
public class TopicSubscriptions {

    static final AttributeKey<Set<String>> ATTR_TOPICS = AttributeKey.valueOf("chat:ws:topics");

    private final Map<String, Set<Channel>> byTopic = new ConcurrentHashMap<>();

    /**
     * @return false 表示已经订阅过
     */
    public boolean subscribe(String topic, Channel ch) {
        boolean[] added = new boolean[1];
        byTopic.compute(topic, (t, set) -> {
            Set<Channel> s = set == null ? ConcurrentHashMap.newKeySet() : set;
            added[0] = s.add(ch);
            return s;
        });
        topicsOf(ch).add(topic);
        return added[0];
    }

    public boolean unsubscribe(String topic, Channel ch) {
        boolean[] removed = new boolean[1];
        byTopic.computeIfPresent(topic, (t, set) -> {
            removed[0] = set.remove(ch);
            return set.isEmpty() ? null : set;
        });
        topicsOf(ch).remove(topic);
        return removed[0];
    }

    /**
     * 退订该 channel 的全部 topic，返回退订前的 topic 列表。
     */
    public List<String> unsubscribeAll(Channel ch) {
        Set<String> topics = ch.attr(ATTR_TOPICS).getAndSet(null);
        if (topics == null || topics.isEmpty()) {
            return List.of();
        }
        List<String> out = List.copyOf(topics);
        for (String topic : out) {
            byTopic.computeIfPresent(topic, (t, set) -> {
                set.remove(ch);
                return set.isEmpty() ? null : set;
            });
        }
        return out;
    }

    public boolean isSubscribed(Channel ch, String topic) {
        Set<String> topics = ch.attr(ATTR_TOPICS).get();
        return topics != null && topics.contains(topic);
    }

    public List<Channel> subscribers(String topic) {
        Set<Channel> set = byTopic.get(topic);
        return set == null ? List.of() : List.copyOf(set);
    }

    private static Set<String> topicsOf(Channel ch) {
        Set<String> existing = ch.attr(ATTR_TOPICS).get();
        if (existing != null) {
            return existing;
        }
        Set<String> created = ConcurrentHashMap.newKeySet();
        Set<String> raced = ch.attr(ATTR_TOPICS).setIfAbsent(created);
        return raced == null ? created : raced;
    }
}
