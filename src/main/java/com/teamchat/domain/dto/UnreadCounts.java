package com.teamchat.domain.dto;

import java.util.Map;

/**
 * 未读数汇总；key 是频道 id / 私聊 id，没有未读的也会出现（值为 0）。
 */
public record UnreadCounts(
        Map<Long, Long> channels,
        Map<Long, Long> conversations,
        long total
) {
}
