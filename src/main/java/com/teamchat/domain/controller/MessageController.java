package com.teamchat.domain.controller;

import com.teamchat.auth.web.AuthContext;
import com.teamchat.common.api.Result;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;
import com.teamchat.common.ratelimit.RateLimit;
import com.teamchat.common.ratelimit.RateLimitKey;
import com.teamchat.domain.dto.ChatTarget;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.service.ConversationIdentity;
import com.teamchat.domain.service.MembershipRegistry;
import com.teamchat.domain.service.MessageStore;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单条消息的读取、编辑、删除、话题，以及跨目标搜索。
 * 看不到所在频道/会话的消息一律按 message_not_found 处理。
 */
@RequiredArgsConstructor
@RestController
@RequestMapping("/messages")
public class MessageController {

    private final MessageStore messageStore;
    private final MembershipRegistry membershipRegistry;
    private final ConversationIdentity conversationIdentity;

    @GetMapping("/search")
    @RateLimit(name = "message_search", windowSeconds = 60, max = 30, key = RateLimitKey.USER)
    public Result<MessagePage> search(@RequestParam("q") String q,
                                      @RequestParam(value = "channelId", required = false) Long channelId,
                                      @RequestParam(value = "conversationId", required = false) Long conversationId,
                                      @RequestParam(value = "userId", required = false) Long authorId,
                                      @RequestParam(value = "beforeId", required = false) Long beforeId,
                                      @RequestParam(value = "limit", defaultValue = "20") int limit) {
        long userId = AuthContext.requireUserId();
        ChatTarget scope = null;
        if (channelId != null || conversationId != null) {
            scope = new ChatTarget(channelId, conversationId);
            if (!canAccess(scope, userId)) {
                throw new ChatException(scope.isChannel() ? ErrorCode.CHANNEL_NOT_FOUND : ErrorCode.CONVERSATION_NOT_FOUND);
            }
        }
        return Result.ok(messageStore.search(userId, q, scope, authorId, limit, beforeId));
    }

    @GetMapping("/{id}")
    public Result<MessageEntity> get(@PathVariable("id") long messageId) {
        return Result.ok(requireVisible(messageId, AuthContext.requireUserId()));
    }

    @PutMapping("/{id}")
    public Result<MessageEntity> edit(@PathVariable("id") long messageId, @RequestBody EditMessageRequest req) {
        long userId = AuthContext.requireUserId();
        requireVisible(messageId, userId);
        return Result.ok(messageStore.edit(messageId, userId, req == null ? null : req.content));
    }

    @DeleteMapping("/{id}")
    public Result<MessageEntity> delete(@PathVariable("id") long messageId) {
        long userId = AuthContext.requireUserId();
        requireVisible(messageId, userId);
        return Result.ok(messageStore.delete(messageId, userId));
    }

    @GetMapping("/{id}/thread")
    public Result<Map<String, Object>> thread(@PathVariable("id") long messageId) {
        MessageEntity parent = requireVisible(messageId, AuthContext.requireUserId());
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("parentMessage", parent);
        out.put("threadMessages", messageStore.thread(messageId));
        out.put("replyCount", messageStore.replyCount(messageId));
        return Result.ok(out);
    }

    private MessageEntity requireVisible(long messageId, long userId) {
        MessageEntity m = messageStore.get(messageId);
        ChatTarget target = new ChatTarget(m.getChannelId(), m.getDirectConversationId());
        if (!canAccess(target, userId)) {
            throw new ChatException(ErrorCode.MESSAGE_NOT_FOUND);
        }
        return m;
    }

    private boolean canAccess(ChatTarget target, long userId) {
        return target.isChannel()
                ? membershipRegistry.canAccessChannel(target.channelId(), userId)
                : conversationIdentity.canAccessConversation(target.directConversationId(), userId);
    }

    @Data
    public static class EditMessageRequest {
        private String content;
    }
}
