package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 一对一会话。约束：user1_id &lt; user2_id，且 (user1_id, user2_id) 唯一。
 */
@Data
@TableName("t_direct_conversation")
public class DirectConversationEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long user1Id;

    private Long user2Id;

    private LocalDateTime lastMessageAt;

    private Boolean isArchivedByUser1;

    private Boolean isArchivedByUser2;

    private LocalDateTime createdAt;

    public boolean hasParticipant(long userId) {
        return (user1Id != null && user1Id == userId) || (user2Id != null && user2Id == userId);
    }

    /**
     * 对方 userId；userId 不是参与者时返回 null。
     */
    public Long otherUser(long userId) {
        if (user1Id != null && user1Id == userId) {
            return user2Id;
        }
        if (user2Id != null && user2Id == userId) {
            return user1Id;
        }
        return null;
    }

    public boolean archivedFor(long userId) {
        if (user1Id != null && user1Id == userId) {
            return Boolean.TRUE.equals(isArchivedByUser1);
        }
        return Boolean.TRUE.equals(isArchivedByUser2);
    }
}
