package com.teamchat.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;
import com.teamchat.domain.dto.ChatEvents;
import com.teamchat.domain.dto.ChatTarget;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.entity.ChannelMemberEntity;
import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.enums.MemberRole;
import com.teamchat.domain.enums.MessageType;
import com.teamchat.domain.mapper.ChannelMapper;
import com.teamchat.domain.mapper.ChannelMemberMapper;
import com.teamchat.domain.mapper.MessageMapper;
import com.teamchat.domain.service.ChatEventPublisher;
import com.teamchat.domain.service.ConversationIdentity;
import com.teamchat.domain.service.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Slf4j
@Service
@RequiredArgsConstructor
public class MessageStoreImpl implements MessageStore {

    private final MessageMapper messageMapper;
    private final ChannelMapper channelMapper;
    private final ChannelMemberMapper channelMemberMapper;
    private final ConversationIdentity conversationIdentity;
    private final ChatEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    public MessageEntity create(CreateMessageCommand cmd) {
        if (cmd == null) {
            throw ChatException.invalid("message", "missing");
        }
        if ((cmd.channelId() == null) == (cmd.directConversationId() == null)) {
            throw ChatException.invalid("target", "exactly_one_target");
        }
        ChatTarget target = new ChatTarget(cmd.channelId(), cmd.directConversationId());

        MessageType type = resolveType(cmd);
        if (type.isRequiresAuthor() && (cmd.userId() == null || cmd.userId() <= 0)) {
            throw ChatException.invalid("user_id", "missing_author");
        }
        if (!type.isRequiresAuthor() && cmd.userId() != null) {
            throw ChatException.invalid("user_id", "system_message_has_no_author");
        }
        String content = normalizeContent(cmd.content(), type);

        if (target.isChannel()) {
            ChannelEntity channel = channelMapper.selectById(target.channelId());
            if (channel == null) {
                throw new ChatException(ErrorCode.CHANNEL_NOT_FOUND);
            }
            if (channel.archived()) {
                throw new ChatException(ErrorCode.CHANNEL_ARCHIVED);
            }
        } else {
            conversationIdentity.get(target.directConversationId());
        }

        if (cmd.parentMessageId() != null) {
            MessageEntity parent = messageMapper.selectById(cmd.parentMessageId());
            if (parent == null || parent.deleted()) {
                throw ChatException.invalid("parent_message_id", "parent_not_found");
            }
            if (!Objects.equals(parent.getChannelId(), target.channelId())
                    || !Objects.equals(parent.getDirectConversationId(), target.directConversationId())) {
                throw ChatException.invalid("parent_message_id", "parent_in_other_target");
            }
        }

        LocalDateTime now = LocalDateTime.now(clock);
        MessageEntity m = new MessageEntity();
        m.setContent(content);
        m.setMessageType(type);
        m.setUserId(cmd.userId());
        m.setChannelId(target.channelId());
        m.setDirectConversationId(target.directConversationId());
        m.setParentMessageId(cmd.parentMessageId());
        m.setIsDeleted(false);
        m.setMetadata(cmd.metadata());
        m.setAttachments(cmd.attachments());
        m.setCreatedAt(now);
        m.setUpdatedAt(now);
        messageMapper.insert(m);

        if (!target.isChannel()) {
            conversationIdentity.touchLastMessageAt(target.directConversationId(), now);
        }
        eventPublisher.publish(target.topic(), ChatEvents.NEW_MESSAGE, Map.of("message", m));
        return m;
    }

    @Override
    public MessageEntity createSystemMessage(long channelId, String content, Map<String, Object> metadata) {
        return create(new CreateMessageCommand(null, channelId, null, content, MessageType.SYSTEM, null, metadata, null));
    }

    @Override
    public MessageEntity edit(long messageId, long editorId, String content) {
        MessageEntity m = get(messageId);
        if (!canEdit(m, editorId)) {
            throw new ChatException(ErrorCode.FORBIDDEN);
        }
        String normalized = normalizeContent(content, m.getMessageType());
        LocalDateTime now = LocalDateTime.now(clock);
        messageMapper.update(null, new LambdaUpdateWrapper<MessageEntity>()
                .eq(MessageEntity::getId, messageId)
                .set(MessageEntity::getContent, normalized)
                .set(MessageEntity::getEditedAt, now));
        m.setContent(normalized);
        m.setEditedAt(now);
        eventPublisher.publish(topicOf(m), ChatEvents.MESSAGE_UPDATED, Map.of("message", m));
        return m;
    }

    @Override
    public MessageEntity delete(long messageId, long requesterId) {
        MessageEntity m = get(messageId);
        if (!canDelete(m, requesterId)) {
            throw new ChatException(ErrorCode.FORBIDDEN);
        }
        messageMapper.update(null, new LambdaUpdateWrapper<MessageEntity>()
                .eq(MessageEntity::getId, messageId)
                .set(MessageEntity::getIsDeleted, true));
        m.setIsDeleted(true);
        log.info("message deleted: messageId={}, authorId={}, requesterId={}", messageId, m.getUserId(), requesterId);
        eventPublisher.publish(topicOf(m), ChatEvents.MESSAGE_DELETED, Map.of("message", m));
        return m;
    }

    @Override
    public boolean canEdit(MessageEntity message, long userId) {
        if (message == null || message.getMessageType() == null || !message.getMessageType().isEditable()) {
            return false;
        }
        return message.getUserId() != null && message.getUserId() == userId;
    }

    @Override
    public boolean canDelete(MessageEntity message, long userId) {
        if (message == null) {
            return false;
        }
        if (message.getUserId() != null && message.getUserId() == userId) {
            return true;
        }
        if (message.getChannelId() == null) {
            return false;
        }
        ChannelMemberEntity member = channelMemberMapper.selectOne(new LambdaQueryWrapper<ChannelMemberEntity>()
                .eq(ChannelMemberEntity::getChannelId, message.getChannelId())
                .eq(ChannelMemberEntity::getUserId, userId)
                .last("limit 1"));
        MemberRole role = member == null ? null : member.getRole();
        return role != null && role.canModerate();
    }

    @Override
    public MessageEntity get(long messageId) {
        MessageEntity m = messageMapper.selectById(messageId);
        if (m == null || m.deleted()) {
            throw new ChatException(ErrorCode.MESSAGE_NOT_FOUND);
        }
        return m;
    }

    @Override
    public MessagePage list(ChatTarget target, int limit, Long beforeId) {
        int size = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
        LambdaQueryWrapper<MessageEntity> q = new LambdaQueryWrapper<MessageEntity>()
                .eq(target.isChannel(), MessageEntity::getChannelId, target.channelId())
                .eq(!target.isChannel(), MessageEntity::getDirectConversationId, target.directConversationId())
                .eq(MessageEntity::getIsDeleted, false)
                .lt(beforeId != null, MessageEntity::getId, beforeId)
                .orderByDesc(MessageEntity::getId)
                .last("limit " + (size + 1));
        List<MessageEntity> rows = messageMapper.selectList(q);
        if (rows == null || rows.isEmpty()) {
            return new MessagePage(List.of(), false, null);
        }
        boolean hasMore = rows.size() > size;
        List<MessageEntity> page = hasMore ? new ArrayList<>(rows.subList(0, size)) : rows;
        Long next = hasMore ? page.get(page.size() - 1).getId() : null;
        return new MessagePage(page, hasMore, next);
    }

    @Override
    public MessagePage search(long requesterId, String query, ChatTarget scope, Long authorId, int limit, Long beforeId) {
        String term = query == null ? "" : query.trim();
        if (term.isEmpty()) {
            throw ChatException.invalid("q", "missing_query");
        }
        if (term.length() > MAX_QUERY_LENGTH) {
            throw ChatException.invalid("q", "query_too_long");
        }
        int size = Math.max(1, Math.min(MAX_PAGE_SIZE, limit));
        LambdaQueryWrapper<MessageEntity> q = new LambdaQueryWrapper<MessageEntity>()
                .like(MessageEntity::getContent, term)
                .eq(MessageEntity::getIsDeleted, false)
                .eq(authorId != null, MessageEntity::getUserId, authorId)
                .lt(beforeId != null, MessageEntity::getId, beforeId);
        if (scope != null) {
            q.eq(scope.isChannel(), MessageEntity::getChannelId, scope.channelId())
                    .eq(!scope.isChannel(), MessageEntity::getDirectConversationId, scope.directConversationId());
        } else {
            // requesterId 是 long，直接拼进子查询
            q.and(w -> w.inSql(MessageEntity::getChannelId,
                            "select channel_id from t_channel_member where user_id = " + requesterId)
                    .or()
                    .inSql(MessageEntity::getDirectConversationId,
                            "select id from t_direct_conversation where user1_id = " + requesterId
                                    + " or user2_id = " + requesterId));
        }
        q.orderByDesc(MessageEntity::getId).last("limit " + (size + 1));
        List<MessageEntity> rows = messageMapper.selectList(q);
        if (rows == null || rows.isEmpty()) {
            return new MessagePage(List.of(), false, null);
        }
        boolean hasMore = rows.size() > size;
        List<MessageEntity> page = hasMore ? new ArrayList<>(rows.subList(0, size)) : rows;
        Long next = hasMore ? page.get(page.size() - 1).getId() : null;
        return new MessagePage(page, hasMore, next);
    }

    @Override
    public List<MessageEntity> thread(long parentMessageId) {
        List<MessageEntity> rows = messageMapper.selectList(new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getParentMessageId, parentMessageId)
                .eq(MessageEntity::getIsDeleted, false)
                .orderByAsc(MessageEntity::getId));
        return rows == null ? List.of() : rows;
    }

    @Override
    public long replyCount(long parentMessageId) {
        return messageMapper.countReplies(parentMessageId);
    }

    private static MessageType resolveType(CreateMessageCommand cmd) {
        if (cmd.type() != null) {
            return cmd.type();
        }
        return cmd.parentMessageId() == null ? MessageType.TEXT : MessageType.THREAD;
    }

    private static String normalizeContent(String content, MessageType type) {
        String c = content == null ? "" : content.trim();
        if (c.isEmpty()) {
            throw ChatException.invalid("content", type == MessageType.SYSTEM ? "missing_system_text" : "empty_content");
        }
        if (c.length() > MAX_CONTENT_LENGTH) {
            throw ChatException.invalid("content", "content_too_long");
        }
        return c;
    }

    private static String topicOf(MessageEntity m) {
        return new ChatTarget(m.getChannelId(), m.getDirectConversationId()).topic();
    }
}
