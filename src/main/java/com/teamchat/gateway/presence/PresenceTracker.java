package com.teamchat.gateway.presence;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 本机在线表：topic -> connId -> entry。
 *
 * <p>只记录本实例上的连接；跨实例的 presence_diff 通过广播转发，但 presence_state 只反映本机。</p>
 */
@Slf4j
@Component
public class PresenceTracker implements SmartLifecycle {

    private final Map<String, Map<String, PresenceEntry>> byTopic = new ConcurrentHashMap<>();
    /** connId -> 它加入过的 topic，断线时反查用。 */
    private final Map<String, Map<String, Boolean>> topicsByConn = new ConcurrentHashMap<>();

    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public PresenceTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * 同一 (topic, connId) 重复 track 只保留一条：meta 替换，onlineAt 保留。
     */
    public PresenceEntry track(String topic, String connId, long userId, Map<String, Object> meta) {
        if (topic == null || connId == null) {
            throw new IllegalArgumentException("bad_presence_key");
        }
        long now = clock.millis();
        Map<String, Object> safeMeta = meta == null ? Map.of() : Map.copyOf(meta);
        PresenceEntry[] out = new PresenceEntry[1];
        byTopic.compute(topic, (t, conns) -> {
            Map<String, PresenceEntry> m = conns == null ? new ConcurrentHashMap<>() : conns;
            out[0] = m.compute(connId, (c, prev) -> new PresenceEntry(userId, safeMeta,
                    prev == null ? now : prev.onlineAt(), now));
            return m;
        });
        topicsByConn.computeIfAbsent(connId, c -> new ConcurrentHashMap<>()).put(topic, Boolean.TRUE);
        return out[0];
    }

    /**
     * 返回被移除的记录；不存在返回 null。
     */
    public PresenceEntry untrack(String topic, String connId) {
        if (topic == null || connId == null) {
            return null;
        }
        PresenceEntry[] removed = new PresenceEntry[1];
        byTopic.computeIfPresent(topic, (t, conns) -> {
            removed[0] = conns.remove(connId);
            return conns.isEmpty() ? null : conns;
        });
        topicsByConn.computeIfPresent(connId, (c, topics) -> {
            topics.remove(topic);
            return topics.isEmpty() ? null : topics;
        });
        return removed[0];
    }

    /**
     * 从所有 topic 移除该连接。
     *
     * @return topic -> 被移除的记录
     */
    public Map<String, PresenceEntry> untrackConnection(String connId) {
        if (connId == null) {
            return Map.of();
        }
        Map<String, Boolean> topics = topicsByConn.remove(connId);
        if (topics == null || topics.isEmpty()) {
            return Map.of();
        }
        Map<String, PresenceEntry> left = new LinkedHashMap<>();
        for (String topic : topics.keySet()) {
            byTopic.computeIfPresent(topic, (t, conns) -> {
                PresenceEntry e = conns.remove(connId);
                if (e != null) {
                    left.put(topic, e);
                }
                return conns.isEmpty() ? null : conns;
            });
        }
        return left;
    }

    /**
     * 每个用户一条；同一用户多连接时取最近更新的 meta。key 为 userId 字符串。
     */
    public Map<String, PresenceEntry> list(String topic) {
        Map<String, PresenceEntry> conns = topic == null ? null : byTopic.get(topic);
        if (conns == null || conns.isEmpty()) {
            return Map.of();
        }
        Map<String, PresenceEntry> out = new LinkedHashMap<>();
        for (PresenceEntry e : conns.values()) {
            out.merge(String.valueOf(e.userId()), e, (a, b) -> a.updatedAt() >= b.updatedAt() ? a : b);
        }
        return out;
    }

    /**
     * 该用户在 topic 上是否还有其他连接（断开一个连接时用来决定是否发 leave）。
     */
    public boolean isUserPresent(String topic, long userId) {
        Map<String, PresenceEntry> conns = byTopic.get(topic);
        if (conns == null) {
            return false;
        }
        for (PresenceEntry e : conns.values()) {
            if (e.userId() == userId) {
                return true;
            }
        }
        return false;
    }

    /** 转成 presence_state/presence_diff 的 {userId: {metas: [meta]}} 结构。 */
    public static Map<String, Object> toPayload(Map<String, PresenceEntry> byUser) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, PresenceEntry> e : byUser.entrySet()) {
            List<Map<String, Object>> metas = new ArrayList<>(1);
            metas.add(e.getValue().meta());
            out.put(e.getKey(), Map.of("metas", metas));
        }
        return out;
    }

    @Override
    public void start() {
        running.set(true);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        int topics = byTopic.size();
        byTopic.clear();
        topicsByConn.clear();
        log.info("presence tracker stopped, cleared {} topics", topics);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }
}
