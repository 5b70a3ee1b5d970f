package com.teamchat.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;
import com.teamchat.domain.entity.DirectConversationEntity;
import com.teamchat.domain.mapper.DirectConversationMapper;
import com.teamchat.domain.mapper.UserMapper;
import com.teamchat.domain.service.ConversationIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationIdentityImpl implements ConversationIdentity {

    private final DirectConversationMapper conversationMapper;
    private final UserMapper userMapper;

    @Override
    public DirectConversationEntity findOrCreate(long userA, long userB) {
        if (userA <= 0 || userB <= 0) {
            throw ChatException.invalid("user_id", "bad_user_id");
        }
        if (userA == userB) {
            throw ChatException.invalid("user_id", "cannot_message_self");
        }
        long user1 = Math.min(userA, userB);
        long user2 = Math.max(userA, userB);

        DirectConversationEntity existing = selectPair(user1, user2);
        if (existing != null) {
            return existing;
        }
        long other = userA == user1 ? user2 : user1;
        if (userMapper.selectById(other) == null) {
            throw new ChatException(ErrorCode.USER_NOT_FOUND);
        }

        DirectConversationEntity c = new DirectConversationEntity();
        c.setUser1Id(user1);
        c.setUser2Id(user2);
        c.setIsArchivedByUser1(false);
        c.setIsArchivedByUser2(false);
        try {
            conversationMapper.insert(c);
        } catch (DuplicateKeyException e) {
            // 并发首次创建：以先落库的那一行为准
            DirectConversationEntity winner = selectPair(user1, user2);
            if (winner == null) {
                throw e;
            }
            return winner;
        }
        log.info("direct conversation created: id={}, user1={}, user2={}", c.getId(), user1, user2);
        return c;
    }

    @Override
    public DirectConversationEntity get(long conversationId) {
        DirectConversationEntity c = conversationMapper.selectById(conversationId);
        if (c == null) {
            throw new ChatException(ErrorCode.CONVERSATION_NOT_FOUND);
        }
        return c;
    }

    @Override
    public boolean canAccessConversation(long conversationId, long userId) {
        DirectConversationEntity c = conversationMapper.selectById(conversationId);
        return c != null && c.hasParticipant(userId);
    }

    @Override
    public DirectConversationEntity archiveFor(long conversationId, long userId, boolean archived) {
        DirectConversationEntity c = get(conversationId);
        if (!c.hasParticipant(userId)) {
            throw new ChatException(ErrorCode.FORBIDDEN);
        }
        LambdaUpdateWrapper<DirectConversationEntity> u = new LambdaUpdateWrapper<DirectConversationEntity>()
                .eq(DirectConversationEntity::getId, conversationId);
        if (c.getUser1Id() == userId) {
            u.set(DirectConversationEntity::getIsArchivedByUser1, archived);
            c.setIsArchivedByUser1(archived);
        } else {
            u.set(DirectConversationEntity::getIsArchivedByUser2, archived);
            c.setIsArchivedByUser2(archived);
        }
        conversationMapper.update(null, u);
        return c;
    }

    @Override
    public void touchLastMessageAt(long conversationId, LocalDateTime at) {
        conversationMapper.update(null, new LambdaUpdateWrapper<DirectConversationEntity>()
                .eq(DirectConversationEntity::getId, conversationId)
                .set(DirectConversationEntity::getLastMessageAt, at));
    }

    @Override
    public List<DirectConversationEntity> listForUser(long userId) {
        List<DirectConversationEntity> rows = conversationMapper.selectList(new LambdaQueryWrapper<DirectConversationEntity>()
                .and(w -> w
                        .nested(a -> a.eq(DirectConversationEntity::getUser1Id, userId)
                                .eq(DirectConversationEntity::getIsArchivedByUser1, false))
                        .or()
                        .nested(b -> b.eq(DirectConversationEntity::getUser2Id, userId)
                                .eq(DirectConversationEntity::getIsArchivedByUser2, false)))
                .orderByDesc(DirectConversationEntity::getLastMessageAt)
                .orderByDesc(DirectConversationEntity::getId));
        return rows == null ? List.of() : rows;
    }

    private DirectConversationEntity selectPair(long user1, long user2) {
        return conversationMapper.selectOne(new LambdaQueryWrapper<DirectConversationEntity>()
                .eq(DirectConversationEntity::getUser1Id, user1)
                .eq(DirectConversationEntity::getUser2Id, user2)
                .last("limit 1"));
    }
}
