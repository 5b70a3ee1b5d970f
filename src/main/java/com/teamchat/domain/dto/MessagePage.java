package com.teamchat.domain.dto;

import com.teamchat.domain.entity.MessageEntity;

import java.util.List;

/**
 * 一页消息，按 id 从新到旧。
 *
 * @param hasMore      是否还有更早的消息
 * @param nextBeforeId 下一页的 beforeId（本页最旧一条的 id）；没有更多时为 null
 */
public record MessagePage(
        List<MessageEntity> messages,
        boolean hasMore,
        Long nextBeforeId
) {
}
