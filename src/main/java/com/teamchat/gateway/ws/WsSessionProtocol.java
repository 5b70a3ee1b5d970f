package com.teamchat.gateway.ws;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;
import com.teamchat.config.ChatDbExecutorProperties;
import com.teamchat.domain.cache.UserSnapshotCache;
import com.teamchat.domain.dto.ChatEvents;
import com.teamchat.domain.dto.ChatTarget;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.entity.DirectConversationEntity;
import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.enums.MessageType;
import com.teamchat.domain.service.ConversationIdentity;
import com.teamchat.domain.service.MembershipRegistry;
import com.teamchat.domain.service.MessageStore;
import com.teamchat.domain.service.ReadReceiptService;
import com.teamchat.gateway.broadcast.BroadcastRouter;
import com.teamchat.gateway.broadcast.TopicSubscriptions;
import com.teamchat.gateway.presence.PresenceEntry;
import com.teamchat.gateway.presence.PresenceTracker;
import com.teamchat.gateway.session.SessionRegistry;
import io.netty.channel.Channel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 一个连接上的 join/leave/ping/command 处理。
 *
 * <p>调用方（{@link WsFrameHandler}）保证同一连接的帧串行进入；DB 调用都在 chatDbExecutor 上执行并带超时，
 * 回包与订阅/presence 变更回到 channel 的 eventLoop 上做。</p>
 */
@Slf4j
@Component
public class WsSessionProtocol {

    static final int JOIN_HISTORY_LIMIT = 50;
    static final int LOAD_MORE_DEFAULT_LIMIT = 25;
    static final int LOAD_MORE_MAX_LIMIT = 50;

    private static final TypeReference<List<Map<String, Object>>> ATTACHMENTS_TYPE = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final SessionRegistry sessionRegistry;
    private final TopicSubscriptions subscriptions;
    private final PresenceTracker presence;
    private final BroadcastRouter router;
    private final WsWriter wsWriter;
    private final MembershipRegistry membershipRegistry;
    private final ConversationIdentity conversationIdentity;
    private final MessageStore messageStore;
    private final ReadReceiptService readReceiptService;
    private final UserSnapshotCache userSnapshotCache;
    private final Executor dbExecutor;
    private final long timeoutMs;
    private final Clock clock;

    public WsSessionProtocol(ObjectMapper objectMapper,
                             SessionRegistry sessionRegistry,
                             TopicSubscriptions subscriptions,
                             PresenceTracker presence,
                             BroadcastRouter router,
                             WsWriter wsWriter,
                             MembershipRegistry membershipRegistry,
                             ConversationIdentity conversationIdentity,
                             MessageStore messageStore,
                             ReadReceiptService readReceiptService,
                             UserSnapshotCache userSnapshotCache,
                             @Qualifier("chatDbExecutor") Executor dbExecutor,
                             ChatDbExecutorProperties dbExecutorProps,
                             Clock clock) {
        this.objectMapper = objectMapper;
        this.sessionRegistry = sessionRegistry;
        this.subscriptions = subscriptions;
        this.presence = presence;
        this.router = router;
        this.wsWriter = wsWriter;
        this.membershipRegistry = membershipRegistry;
        this.conversationIdentity = conversationIdentity;
        this.messageStore = messageStore;
        this.readReceiptService = readReceiptService;
        this.userSnapshotCache = userSnapshotCache;
        this.dbExecutor = dbExecutor;
        this.timeoutMs = dbExecutorProps.timeoutMsEffective();
        this.clock = clock;
    }

    /**
     * 处理一帧。返回的 stage 完成时本帧的回包已提交写出。
     */
    public CompletionStage<?> handle(Channel ch, WsEnvelope msg) {
        if (StrUtil.isBlank(msg.getType())) {
            violation(ch, msg, "missing_type");
            return done();
        }
        return switch (msg.getType()) {
            case WsEnvelope.JOIN -> join(ch, msg);
            case WsEnvelope.LEAVE -> leave(ch, msg);
            case WsEnvelope.PING -> {
                wsWriter.writePong(ch, msg);
                yield done();
            }
            case WsEnvelope.COMMAND -> command(ch, msg);
            default -> {
                violation(ch, msg, "unknown_type");
                yield done();
            }
        };
    }

    // ---------------------------------------------------------------- join / leave

    private CompletionStage<?> join(Channel ch, WsEnvelope msg) {
        ChatTarget target = ChatTarget.parseTopic(msg.getTopic());
        if (target == null) {
            violation(ch, msg, "bad_topic");
            return done();
        }
        long userId = sessionRegistry.userId(ch);
        if (subscriptions.isSubscribed(ch, msg.getTopic())) {
            wsWriter.writeReplyError(ch, msg, "already_joined");
            return done();
        }
        return onDb(ch, msg, () -> {
            boolean allowed = target.isChannel()
                    ? membershipRegistry.canAccessChannel(target.channelId(), userId)
                    : conversationIdentity.canAccessConversation(target.directConversationId(), userId);
            if (!allowed) {
                return null;
            }
            MessagePage history = messageStore.list(target, JOIN_HISTORY_LIMIT, null);
            return new JoinContext(history, presenceMeta(userId));
        }, ctx -> {
            if (!ch.isActive() || sessionRegistry.connId(ch) == null) {
                // DB 查询期间连接已断开并清理过，不能再登记订阅或 presence
                log.debug("ws join dropped, connection gone: userId={}, topic={}", userId, msg.getTopic());
                return;
            }
            if (ctx == null) {
                // 越权订阅：直接终止连接，不留任何订阅或 presence
                log.info("ws join denied: userId={}, topic={}", userId, msg.getTopic());
                wsWriter.writeError(ch, "unauthorized", msg.getRef(), msg.getTopic());
                ch.close();
                return;
            }
            String topic = msg.getTopic();
            subscriptions.subscribe(topic, ch);
            PresenceEntry entry = presence.track(topic, sessionRegistry.connId(ch), userId, ctx.meta());

            wsWriter.writeOk(ch, msg, Map.of("topic", topic));
            wsWriter.write(ch, wsWriter.push(topic, ChatEvents.MESSAGES_LOADED, messagesPayload(ctx.history())));
            wsWriter.write(ch, wsWriter.push(topic, ChatEvents.PRESENCE_STATE, PresenceTracker.toPayload(presence.list(topic))));
            router.publishFrom(topic, ChatEvents.PRESENCE_DIFF,
                    presenceDiff(Map.of(String.valueOf(userId), entry), Map.of()), ch);
        });
    }

    private CompletionStage<?> leave(Channel ch, WsEnvelope msg) {
        String topic = msg.getTopic();
        if (topic == null || !subscriptions.unsubscribe(topic, ch)) {
            wsWriter.writeReplyError(ch, msg, "not_joined");
            return done();
        }
        long userId = sessionRegistry.userId(ch);
        PresenceEntry removed = presence.untrack(topic, sessionRegistry.connId(ch));
        if (removed != null && !presence.isUserPresent(topic, userId)) {
            router.publishFrom(topic, ChatEvents.PRESENCE_DIFF,
                    presenceDiff(Map.of(), Map.of(String.valueOf(userId), removed)), ch);
        }
        wsWriter.writeOk(ch, msg, Map.of("topic", topic));
        return done();
    }

    /**
     * 断线清理：退订全部 topic，移除 presence，对已经没有其他连接的用户广播 leave。
     */
    public void onDisconnect(Channel ch) {
        String connId = sessionRegistry.connId(ch);
        Long userId = sessionRegistry.userId(ch);
        subscriptions.unsubscribeAll(ch);
        Map<String, PresenceEntry> left = presence.untrackConnection(connId);
        for (Map.Entry<String, PresenceEntry> e : left.entrySet()) {
            String topic = e.getKey();
            PresenceEntry entry = e.getValue();
            if (presence.isUserPresent(topic, entry.userId())) {
                continue;
            }
            router.publish(topic, ChatEvents.PRESENCE_DIFF,
                    presenceDiff(Map.of(), Map.of(String.valueOf(entry.userId()), entry)));
        }
        sessionRegistry.unbind(ch);
        if (userId != null) {
            log.debug("ws session closed: userId={}, connId={}, topics={}", userId, connId, left.keySet());
        }
    }

    // ---------------------------------------------------------------- commands

    private CompletionStage<?> command(Channel ch, WsEnvelope msg) {
        String topic = msg.getTopic();
        ChatTarget target = ChatTarget.parseTopic(topic);
        if (target == null || !subscriptions.isSubscribed(ch, topic)) {
            wsWriter.writeReplyError(ch, msg, "not_joined");
            return done();
        }
        long userId = sessionRegistry.userId(ch);
        JsonNode p = msg.getPayload() == null ? MissingNode.getInstance() : msg.getPayload();
        String event = msg.getEvent() == null ? "" : msg.getEvent();

        return switch (event) {
            case "new_message" -> reply(ch, msg, () -> Map.of("message", messageStore.create(newMessage(userId, target, p))));
            case "edit_message" -> reply(ch, msg, () -> {
                long messageId = requireId(p, "messageId");
                requireInTarget(messageId, target);
                return Map.of("message", messageStore.edit(messageId, userId, p.path("content").asText(null)));
            });
            case "delete_message" -> reply(ch, msg, () -> {
                long messageId = requireId(p, "messageId");
                requireInTarget(messageId, target);
                return Map.of("message", messageStore.delete(messageId, userId));
            });
            case "typing" -> typing(ch, msg, userId, p.path("typing").asBoolean(false));
            case "load_more" -> reply(ch, msg, () -> {
                Long beforeId = p.hasNonNull("beforeId") ? p.path("beforeId").asLong() : null;
                int limit = p.hasNonNull("limit") ? p.path("limit").asInt(LOAD_MORE_DEFAULT_LIMIT) : LOAD_MORE_DEFAULT_LIMIT;
                limit = Math.max(1, Math.min(LOAD_MORE_MAX_LIMIT, limit));
                return messagesPayload(messageStore.list(target, limit, beforeId));
            });
            case "get_thread" -> reply(ch, msg, () -> {
                long messageId = requireId(p, "messageId");
                MessageEntity parent = requireInTarget(messageId, target);
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("parentMessage", parent);
                out.put("threadMessages", messageStore.thread(messageId));
                out.put("replyCount", messageStore.replyCount(messageId));
                return out;
            });
            case "archive" -> {
                if (target.isChannel()) {
                    wsWriter.writeReplyError(ch, msg, "unsupported_command");
                    yield done();
                }
                boolean archived = p.path("archived").asBoolean(true);
                yield reply(ch, msg, () -> {
                    DirectConversationEntity c = conversationIdentity.archiveFor(target.directConversationId(), userId, archived);
                    return Map.of("archived", c.archivedFor(userId));
                });
            }
            case "mark_as_read" -> reply(ch, msg, () -> {
                long messageId = requireId(p, "messageId");
                readReceiptService.markAsRead(userId, target, messageId);
                return Map.of("messageId", String.valueOf(messageId));
            });
            default -> {
                wsWriter.writeReplyError(ch, msg, "unknown_command");
                yield done();
            }
        };
    }

    /**
     * typing 不落库、不回包，只广播给同 topic 的其他连接。
     */
    private CompletionStage<?> typing(Channel ch, WsEnvelope msg, long userId, boolean typing) {
        return onDb(ch, msg, () -> userSnapshotCache.get(userId), user -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("user", user);
            payload.put("typing", typing);
            payload.put("timestamp", Instant.now(clock).toString());
            router.publishFrom(msg.getTopic(), ChatEvents.USER_TYPING, payload, ch);
        });
    }

    private MessageStore.CreateMessageCommand newMessage(long userId, ChatTarget target, JsonNode p) {
        MessageType type = null;
        if (p.hasNonNull("messageType")) {
            type = MessageType.fromString(p.path("messageType").asText());
            if (type == null || type == MessageType.SYSTEM) {
                throw ChatException.invalid("messageType", "bad_message_type");
            }
        }
        Long parentId = p.hasNonNull("parentMessageId") ? p.path("parentMessageId").asLong() : null;
        List<Map<String, Object>> attachments = p.hasNonNull("attachments")
                ? objectMapper.convertValue(p.get("attachments"), ATTACHMENTS_TYPE)
                : null;
        Map<String, Object> metadata = p.hasNonNull("metadata")
                ? objectMapper.convertValue(p.get("metadata"), METADATA_TYPE)
                : null;
        return new MessageStore.CreateMessageCommand(userId, target.channelId(), target.directConversationId(),
                p.path("content").asText(null), type, parentId, metadata, attachments);
    }

    private MessageEntity requireInTarget(long messageId, ChatTarget target) {
        MessageEntity m = messageStore.get(messageId);
        if (!Objects.equals(m.getChannelId(), target.channelId())
                || !Objects.equals(m.getDirectConversationId(), target.directConversationId())) {
            throw new ChatException(ErrorCode.MESSAGE_NOT_FOUND);
        }
        return m;
    }

    private static long requireId(JsonNode p, String field) {
        long id = p.path(field).asLong(0);
        if (id <= 0) {
            throw ChatException.invalid(field, "missing_" + StrUtil.toUnderlineCase(field));
        }
        return id;
    }

    // ---------------------------------------------------------------- helpers

    private CompletionStage<?> reply(Channel ch, WsEnvelope msg, Supplier<Object> work) {
        return onDb(ch, msg, work, result -> wsWriter.writeOk(ch, msg, result));
    }

    /**
     * work 在 DB 线程池执行（带超时），then 回到 eventLoop 执行；任一步失败都回 reply(error)。
     */
    private <T> CompletionStage<?> onDb(Channel ch, WsEnvelope msg, Supplier<T> work, Consumer<T> then) {
        CompletableFuture<T> f;
        try {
            f = CompletableFuture.supplyAsync(work, dbExecutor).orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            wsWriter.writeReplyError(ch, msg, "server_busy");
            return done();
        }
        return f.handleAsync((value, err) -> {
            if (err != null) {
                replyFailure(ch, msg, err);
                return null;
            }
            try {
                then.accept(value);
            } catch (RuntimeException e) {
                replyFailure(ch, msg, e);
            }
            return null;
        }, ch.eventLoop());
    }

    private void replyFailure(Channel ch, WsEnvelope msg, Throwable err) {
        Throwable cause = unwrap(err);
        if (cause instanceof ChatException ce) {
            WsEnvelope out = new WsEnvelope();
            out.setType(WsEnvelope.REPLY);
            out.setEvent(WsEnvelope.STATUS_ERROR);
            out.setRef(msg.getRef());
            out.setTopic(msg.getTopic());
            out.setReason(ce.getReason());
            out.setPayload(ce.getFieldErrors().isEmpty() ? null : wsWriter.toPayload(ce.getFieldErrors()));
            out.setTs(clock.millis());
            wsWriter.write(ch, out);
            return;
        }
        if (cause instanceof TimeoutException) {
            log.warn("ws command timeout: type={}, event={}, topic={}", msg.getType(), msg.getEvent(), msg.getTopic());
            wsWriter.writeReplyError(ch, msg, "timeout");
            return;
        }
        if (cause instanceof RejectedExecutionException) {
            wsWriter.writeReplyError(ch, msg, "server_busy");
            return;
        }
        if (cause instanceof IllegalArgumentException iae && iae.getMessage() != null) {
            wsWriter.writeReplyError(ch, msg, iae.getMessage());
            return;
        }
        log.warn("ws command failed: type={}, event={}, topic={}", msg.getType(), msg.getEvent(), msg.getTopic(), cause);
        wsWriter.writeReplyError(ch, msg, "internal_error");
    }

    /**
     * 协议违规：回 error 后终止连接。
     */
    private void violation(Channel ch, WsEnvelope msg, String reason) {
        log.debug("ws protocol violation: reason={}, type={}, topic={}", reason, msg.getType(), msg.getTopic());
        wsWriter.writeError(ch, reason, msg.getRef(), msg.getTopic());
        ch.close();
    }

    private Map<String, Object> presenceMeta(long userId) {
        UserSnapshotCache.Snapshot u = userSnapshotCache.get(userId);
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("userId", String.valueOf(userId));
        if (u != null) {
            meta.put("username", u.username());
            meta.put("firstName", u.firstName());
            meta.put("lastName", u.lastName());
            meta.put("displayName", u.displayName());
            meta.put("avatarUrl", u.avatarUrl());
            meta.put("status", u.status() == null ? null : u.status().getDesc());
        }
        meta.put("onlineAt", Instant.now(clock).toString());
        // Map.copyOf 不接受 null value
        meta.values().removeIf(Objects::isNull);
        return meta;
    }

    private static Map<String, Object> messagesPayload(MessagePage page) {
        List<MessageEntity> chronological = new ArrayList<>(page.messages());
        Collections.reverse(chronological);
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("messages", chronological);
        out.put("hasMore", page.hasMore());
        return out;
    }

    private static Map<String, Object> presenceDiff(Map<String, PresenceEntry> joins, Map<String, PresenceEntry> leaves) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("joins", PresenceTracker.toPayload(joins));
        out.put("leaves", PresenceTracker.toPayload(leaves));
        return out;
    }

    private static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while (cur instanceof CompletionException && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    private static CompletionStage<?> done() {
        return CompletableFuture.completedFuture(null);
    }

    private record JoinContext(MessagePage history, Map<String, Object> meta) {
    }
}
