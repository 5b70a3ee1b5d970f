package com.teamchat.domain.controller;

import com.teamchat.auth.web.AuthContext;
import com.teamchat.common.api.Result;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;
import com.teamchat.domain.dto.ChatTarget;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.entity.DirectConversationEntity;
import com.teamchat.domain.entity.ReadReceiptEntity;
import com.teamchat.domain.service.ConversationIdentity;
import com.teamchat.domain.service.MessageStore;
import com.teamchat.domain.service.ReadReceiptService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
@RestController
@RequestMapping("/conversations")
public class ConversationController {

    private final ConversationIdentity conversationIdentity;
    private final MessageStore messageStore;
    private final ReadReceiptService readReceiptService;

    /**
     * 找到或创建与对方的一对一会话；两人之间永远只有一个。
     */
    @PostMapping("/with/{userId}")
    public Result<DirectConversationEntity> with(@PathVariable("userId") long otherUserId) {
        long userId = AuthContext.requireUserId();
        return Result.ok(conversationIdentity.findOrCreate(userId, otherUserId));
    }

    @GetMapping
    public Result<List<DirectConversationEntity>> list() {
        return Result.ok(conversationIdentity.listForUser(AuthContext.requireUserId()));
    }

    @GetMapping("/{id}/messages")
    public Result<MessagePage> messages(@PathVariable("id") long conversationId,
                                        @RequestParam(value = "beforeId", required = false) Long beforeId,
                                        @RequestParam(value = "limit", defaultValue = "50") int limit) {
        long userId = AuthContext.requireUserId();
        requireAccess(conversationId, userId);
        return Result.ok(messageStore.list(ChatTarget.conversation(conversationId), limit, beforeId));
    }

    @PostMapping("/{id}/read")
    public Result<Map<String, Object>> markAsRead(@PathVariable("id") long conversationId,
                                                  @RequestBody MarkReadRequest req) {
        long userId = AuthContext.requireUserId();
        if (req == null || req.messageId == null) {
            throw ChatException.invalid("message_id", "missing_message_id");
        }
        requireAccess(conversationId, userId);
        ChatTarget target = ChatTarget.conversation(conversationId);
        ReadReceiptEntity r = readReceiptService.markAsRead(userId, target, req.messageId);
        return Result.ok(Map.of(
                "lastReadMessageId", String.valueOf(r.getLastReadMessageId()),
                "unreadCount", readReceiptService.unreadCount(userId, target)));
    }

    @GetMapping("/{id}/unread-count")
    public Result<Map<String, Long>> unreadCount(@PathVariable("id") long conversationId) {
        long userId = AuthContext.requireUserId();
        requireAccess(conversationId, userId);
        return Result.ok(Map.of("unreadCount",
                readReceiptService.unreadCount(userId, ChatTarget.conversation(conversationId))));
    }

    @PostMapping("/{id}/archive")
    public Result<DirectConversationEntity> archive(@PathVariable("id") long conversationId) {
        return Result.ok(conversationIdentity.archiveFor(conversationId, AuthContext.requireUserId(), true));
    }

    @PostMapping("/{id}/unarchive")
    public Result<DirectConversationEntity> unarchive(@PathVariable("id") long conversationId) {
        return Result.ok(conversationIdentity.archiveFor(conversationId, AuthContext.requireUserId(), false));
    }

    private void requireAccess(long conversationId, long userId) {
        if (!conversationIdentity.canAccessConversation(conversationId, userId)) {
            throw new ChatException(ErrorCode.CONVERSATION_NOT_FOUND);
        }
    }

    @Data
    public static class MarkReadRequest {
        private Long messageId;
    }
}
