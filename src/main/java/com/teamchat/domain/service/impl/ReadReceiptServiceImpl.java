package com.teamchat.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;
import com.teamchat.domain.dto.ChatTarget;
import com.teamchat.domain.dto.UnreadCounts;
import com.teamchat.domain.entity.ChannelMemberEntity;
import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.entity.ReadReceiptEntity;
import com.teamchat.domain.mapper.ChannelMemberMapper;
import com.teamchat.domain.mapper.MessageMapper;
import com.teamchat.domain.mapper.ReadReceiptMapper;
import com.teamchat.domain.service.ReadReceiptService;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
@RequiredArgsConstructor
public class ReadReceiptServiceImpl implements ReadReceiptService {

    private final ReadReceiptMapper readReceiptMapper;
    private final MessageMapper messageMapper;
    private final ChannelMemberMapper channelMemberMapper;
    private final Clock clock;

    @Override
    public ReadReceiptEntity markAsRead(long userId, ChatTarget target, long messageId) {
        MessageEntity m = messageMapper.selectById(messageId);
        if (m == null
                || !Objects.equals(m.getChannelId(), target.channelId())
                || !Objects.equals(m.getDirectConversationId(), target.directConversationId())) {
            throw new ChatException(ErrorCode.MESSAGE_NOT_FOUND);
        }
        LocalDateTime now = LocalDateTime.now(clock);

        ReadReceiptEntity existing = get(userId, target);
        if (existing == null) {
            ReadReceiptEntity r = new ReadReceiptEntity();
            r.setUserId(userId);
            r.setChannelId(target.channelId());
            r.setDirectConversationId(target.directConversationId());
            r.setLastReadMessageId(messageId);
            r.setReadAt(now);
            try {
                readReceiptMapper.insert(r);
                touchMember(userId, target, now);
                return r;
            } catch (DuplicateKeyException e) {
                existing = get(userId, target);
                if (existing == null) {
                    throw e;
                }
            }
        }

        // 条件更新：只有更大的 messageId 才会覆盖
        int n = readReceiptMapper.update(null, new LambdaUpdateWrapper<ReadReceiptEntity>()
                .eq(ReadReceiptEntity::getId, existing.getId())
                .lt(ReadReceiptEntity::getLastReadMessageId, messageId)
                .set(ReadReceiptEntity::getLastReadMessageId, messageId)
                .set(ReadReceiptEntity::getReadAt, now));
        if (n > 0) {
            existing.setLastReadMessageId(messageId);
            existing.setReadAt(now);
            touchMember(userId, target, now);
        }
        return existing;
    }

    @Override
    public ReadReceiptEntity get(long userId, ChatTarget target) {
        return readReceiptMapper.selectOne(new LambdaQueryWrapper<ReadReceiptEntity>()
                .eq(ReadReceiptEntity::getUserId, userId)
                .eq(target.isChannel(), ReadReceiptEntity::getChannelId, target.channelId())
                .eq(!target.isChannel(), ReadReceiptEntity::getDirectConversationId, target.directConversationId())
                .last("limit 1"));
    }

    @Override
    public long unreadCount(long userId, ChatTarget target) {
        ReadReceiptEntity receipt = get(userId, target);
        Long lastRead = receipt == null ? null : receipt.getLastReadMessageId();
        Long n = messageMapper.selectCount(new LambdaQueryWrapper<MessageEntity>()
                .eq(target.isChannel(), MessageEntity::getChannelId, target.channelId())
                .eq(!target.isChannel(), MessageEntity::getDirectConversationId, target.directConversationId())
                .ne(MessageEntity::getUserId, userId)
                .eq(MessageEntity::getIsDeleted, false)
                .gt(lastRead != null, MessageEntity::getId, lastRead));
        return n == null ? 0L : n;
    }

    @Override
    public UnreadCounts unreadCounts(long userId) {
        Map<Long, Long> channels = toCounts(messageMapper.selectChannelUnreadCountsForUser(userId), "channelId");
        Map<Long, Long> conversations = toCounts(messageMapper.selectConversationUnreadCountsForUser(userId), "conversationId");
        long total = 0;
        for (Long v : channels.values()) {
            total += v;
        }
        for (Long v : conversations.values()) {
            total += v;
        }
        return new UnreadCounts(channels, conversations, total);
    }

    private static Map<Long, Long> toCounts(List<Map<String, Object>> rows, String idKey) {
        Map<Long, Long> out = new LinkedHashMap<>();
        if (rows == null) {
            return out;
        }
        for (Map<String, Object> row : rows) {
            Object id = row.get(idKey);
            Object cnt = row.get("unreadCount");
            if (!(id instanceof Number)) {
                continue;
            }
            out.put(((Number) id).longValue(), cnt instanceof Number ? ((Number) cnt).longValue() : 0L);
        }
        return out;
    }

    private void touchMember(long userId, ChatTarget target, LocalDateTime at) {
        if (!target.isChannel()) {
            return;
        }
        channelMemberMapper.update(null, new LambdaUpdateWrapper<ChannelMemberEntity>()
                .eq(ChannelMemberEntity::getChannelId, target.channelId())
                .eq(ChannelMemberEntity::getUserId, userId)
                .set(ChannelMemberEntity::getLastReadAt, at));
    }
}
