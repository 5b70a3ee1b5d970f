package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 已读位置：每个用户在每个频道/会话里一行，只前进不后退。
 */
@Data
@TableName("t_read_receipt")
public class ReadReceiptEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long userId;

    private Long channelId;

    private Long directConversationId;

    private Long lastReadMessageId;

    private LocalDateTime readAt;
}
