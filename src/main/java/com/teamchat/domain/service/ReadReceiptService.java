package com.teamchat.domain.service;

import com.teamchat.domain.dto.ChatTarget;
import com.teamchat.domain.dto.UnreadCounts;
import com.teamchat.domain.entity.ReadReceiptEntity;

public interface ReadReceiptService {

    /**
     * 把已读位置推进到 messageId；位置只前进，传入更旧的 id 不会回退。
     */
    ReadReceiptEntity markAsRead(long userId, ChatTarget target, long messageId);

    /** 没有记录时返回 null。 */
    ReadReceiptEntity get(long userId, ChatTarget target);

    /**
     * 单个目标的未读数：别人发的、未删除、比已读位置新的消息。
     */
    long unreadCount(long userId, ChatTarget target);

    /** 所有未归档频道（成员）和未归档私聊的未读数。 */
    UnreadCounts unreadCounts(long userId);
}
