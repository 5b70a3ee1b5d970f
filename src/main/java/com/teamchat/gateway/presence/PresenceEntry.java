package com.teamchat.gateway.presence;

import java.util.Map;

/**
 * 某个连接在某个 topic 上的在线记录。
 *
 * @param onlineAt  首次 track 的时间（毫秒），重复 track 不变
 * @param updatedAt 最近一次 track 的时间（毫秒），同一用户多连接时取最新的 meta
 */
public record PresenceEntry(
        long userId,
        Map<String, Object> meta,
        long onlineAt,
        long updatedAt
) {
}
