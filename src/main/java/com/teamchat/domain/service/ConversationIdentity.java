package com.teamchat.domain.service;

import com.teamchat.domain.entity.DirectConversationEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 一对一会话的身份：任意两人之间只有一行，按 (min, max) 规范化。
 */
public interface ConversationIdentity {

    /**
     * 查找或创建 a 与 b 的会话。并发首次创建时，唯一索引冲突会转为重新查询。
     */
    DirectConversationEntity findOrCreate(long userA, long userB);

    DirectConversationEntity get(long conversationId);

    boolean canAccessConversation(long conversationId, long userId);

    /**
     * 只修改调用方自己那一侧的归档标记。
     */
    DirectConversationEntity archiveFor(long conversationId, long userId, boolean archived);

    void touchLastMessageAt(long conversationId, LocalDateTime at);

    /** 调用方未归档的会话，最近活跃的在前。 */
    List<DirectConversationEntity> listForUser(long userId);
}
