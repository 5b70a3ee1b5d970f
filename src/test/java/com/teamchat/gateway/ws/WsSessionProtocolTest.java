package com.teamchat.gateway.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import com.teamchat.domain.enums.UserStatus;
import com.teamchat.domain.service.ConversationIdentity;
import com.teamchat.domain.service.MembershipRegistry;
import com.teamchat.domain.service.MessageStore;
import com.teamchat.domain.service.ReadReceiptService;
import com.teamchat.gateway.broadcast.BroadcastRelay;
import com.teamchat.gateway.broadcast.BroadcastRouter;
import com.teamchat.gateway.broadcast.TopicSubscriptions;
import com.teamchat.gateway.presence.PresenceTracker;
import com.teamchat.gateway.session.SessionRegistry;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WsSessionProtocolTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final Clock clock = Clock.systemUTC();
    private final SessionRegistry sessionRegistry = new SessionRegistry();
    private final TopicSubscriptions subscriptions = new TopicSubscriptions();
    private final PresenceTracker presence = new PresenceTracker(clock);
    private final WsWriter wsWriter = new WsWriter(objectMapper, clock);
    private final BroadcastRouter router = new BroadcastRouter(subscriptions, mock(BroadcastRelay.class), wsWriter);
    private final MembershipRegistry membershipRegistry = mock(MembershipRegistry.class);
    private final ConversationIdentity conversationIdentity = mock(ConversationIdentity.class);
    private final MessageStore messageStore = mock(MessageStore.class);
    private final ReadReceiptService readReceiptService = mock(ReadReceiptService.class);
    private final UserSnapshotCache userSnapshotCache = mock(UserSnapshotCache.class);

    private WsSessionProtocol protocol;

    @BeforeEach
    void setUp() {
        protocol = protocolWith(Runnable::run);
        when(userSnapshotCache.get(anyLong())).thenAnswer(inv -> {
            long id = inv.getArgument(0);
            return new UserSnapshotCache.Snapshot(id, "u" + id, null, null, "u" + id, null, UserStatus.ONLINE);
        });
        when(membershipRegistry.canAccessChannel(eq(1L), anyLong())).thenReturn(true);
        when(messageStore.list(any(ChatTarget.class), anyInt(), isNull()))
                .thenReturn(new MessagePage(List.of(message(2L), message(1L)), true, 1L));
    }

    @Test
    void join_ShouldReplyOkThenHistoryThenPresenceState() throws Exception {
        EmbeddedChannel ch = connected(7L);

        handle(ch, join("channel:1", "r1"));

        List<JsonNode> out = drain(ch);
        assertThat(out).hasSize(3);
        assertThat(out.get(0).get("type").asText()).isEqualTo(WsEnvelope.REPLY);
        assertThat(out.get(0).get("event").asText()).isEqualTo(WsEnvelope.STATUS_OK);
        assertThat(out.get(0).get("ref").asText()).isEqualTo("r1");
        assertThat(out.get(1).get("event").asText()).isEqualTo("messages_loaded");
        assertThat(out.get(1).get("payload").get("hasMore").asBoolean()).isTrue();
        JsonNode messages = out.get(1).get("payload").get("messages");
        assertThat(messages.get(0).get("id").asLong()).isEqualTo(1L);
        assertThat(messages.get(1).get("id").asLong()).isEqualTo(2L);
        assertThat(out.get(2).get("event").asText()).isEqualTo("presence_state");
        assertThat(out.get(2).get("payload").has("7")).isTrue();
        assertThat(out.get(2).get("payload").get("7").get("metas").get(0).get("username").asText()).isEqualTo("u7");
        assertThat(subscriptions.isSubscribed(ch, "channel:1")).isTrue();
    }

    @Test
    void join_ShouldAnnouncePresenceToOthersOnly() throws Exception {
        EmbeddedChannel first = connected(7L);
        handle(first, join("channel:1", "a"));
        drain(first);

        EmbeddedChannel second = connected(8L);
        handle(second, join("channel:1", "b"));

        List<JsonNode> seenByFirst = drain(first);
        assertThat(seenByFirst).hasSize(1);
        assertThat(seenByFirst.get(0).get("event").asText()).isEqualTo("presence_diff");
        assertThat(seenByFirst.get(0).get("payload").get("joins").has("8")).isTrue();
        List<JsonNode> seenBySecond = drain(second);
        assertThat(seenBySecond).noneMatch(n -> "presence_diff".equals(n.path("event").asText()));
        assertThat(seenBySecond.get(2).get("payload").has("7")).isTrue();
    }

    @Test
    void join_ShouldCloseConnectionWhenAccessDenied() throws Exception {
        EmbeddedChannel ch = connected(7L);

        handle(ch, join("channel:99", "r1"));

        List<JsonNode> out = drain(ch);
        assertThat(out).hasSize(1);
        assertThat(out.get(0).get("type").asText()).isEqualTo(WsEnvelope.ERROR);
        assertThat(out.get(0).get("reason").asText()).isEqualTo("unauthorized");
        assertThat(ch.isActive()).isFalse();
        assertThat(subscriptions.subscribers("channel:99")).isEmpty();
        assertThat(presence.list("channel:99")).isEmpty();
    }

    @Test
    void badTopic_ShouldBeProtocolViolation() throws Exception {
        EmbeddedChannel ch = connected(7L);

        handle(ch, join("room:1", "r1"));

        assertThat(drain(ch).get(0).get("reason").asText()).isEqualTo("bad_topic");
        assertThat(ch.isActive()).isFalse();
    }

    @Test
    void command_ShouldRequireJoin() throws Exception {
        EmbeddedChannel ch = connected(7L);

        handle(ch, command("channel:1", "new_message", "{\"content\":\"hi\"}"));

        JsonNode reply = drain(ch).get(0);
        assertThat(reply.get("event").asText()).isEqualTo(WsEnvelope.STATUS_ERROR);
        assertThat(reply.get("reason").asText()).isEqualTo("not_joined");
        verify(messageStore, never()).create(any());
    }

    @Test
    void newMessage_ShouldReplyWithCreatedMessage() throws Exception {
        EmbeddedChannel ch = connected(7L);
        handle(ch, join("channel:1", "j"));
        drain(ch);
        when(messageStore.create(any())).thenReturn(message(3L));

        handle(ch, command("channel:1", "new_message", "{\"content\":\"hi\"}"));

        JsonNode reply = drain(ch).get(0);
        assertThat(reply.get("event").asText()).isEqualTo(WsEnvelope.STATUS_OK);
        assertThat(reply.get("payload").get("message").get("id").asLong()).isEqualTo(3L);
    }

    @Test
    void newMessage_ShouldReplyValidationErrorWithFields() throws Exception {
        EmbeddedChannel ch = connected(7L);
        handle(ch, join("channel:1", "j"));
        drain(ch);
        when(messageStore.create(any())).thenThrow(ChatException.invalid("content", "empty_content"));

        handle(ch, command("channel:1", "new_message", "{\"content\":\"\"}"));

        JsonNode reply = drain(ch).get(0);
        assertThat(reply.get("reason").asText()).isEqualTo(ErrorCode.VALIDATION_FAILED.getReason());
        assertThat(reply.get("payload").get("content").asText()).isEqualTo("empty_content");
        assertThat(ch.isActive()).isTrue();
    }

    @Test
    void typing_ShouldReachOthersButNotSender() throws Exception {
        EmbeddedChannel sender = connected(7L);
        EmbeddedChannel other = connected(8L);
        handle(sender, join("channel:1", "a"));
        handle(other, join("channel:1", "b"));
        drain(sender);
        drain(other);

        handle(sender, command("channel:1", "typing", "{\"typing\":true}"));

        assertThat(drain(sender)).isEmpty();
        List<JsonNode> seen = drain(other);
        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).get("event").asText()).isEqualTo("user_typing");
        assertThat(seen.get(0).get("payload").get("typing").asBoolean()).isTrue();
        assertThat(seen.get(0).get("payload").get("user").get("username").asText()).isEqualTo("u7");
    }

    @Test
    void disconnect_ShouldBroadcastLeaveWhenLastConnectionGone() throws Exception {
        EmbeddedChannel leaving = connected(7L);
        EmbeddedChannel watcher = connected(8L);
        handle(leaving, join("channel:1", "a"));
        handle(watcher, join("channel:1", "b"));
        drain(leaving);
        drain(watcher);

        protocol.onDisconnect(leaving);

        List<JsonNode> seen = drain(watcher);
        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).get("payload").get("leaves").has("7")).isTrue();
        assertThat(presence.isUserPresent("channel:1", 7L)).isFalse();
        assertThat(sessionRegistry.size()).isEqualTo(1);
    }

    @Test
    void ping_ShouldPong() throws Exception {
        EmbeddedChannel ch = connected(7L);
        WsEnvelope ping = new WsEnvelope();
        ping.setType(WsEnvelope.PING);
        ping.setRef("p1");

        handle(ch, ping);

        JsonNode pong = drain(ch).get(0);
        assertThat(pong.get("type").asText()).isEqualTo(WsEnvelope.PONG);
        assertThat(pong.get("ref").asText()).isEqualTo("p1");
    }

    @Test
    void join_ShouldNotTrackConnectionThatClosedWhileLoading() throws Exception {
        List<Runnable> dbTasks = new ArrayList<>();
        WsSessionProtocol slowDb = protocolWith(dbTasks::add);
        EmbeddedChannel ch = connected(7L);

        slowDb.handle(ch, join("channel:1", "r1"));
        ch.close();
        slowDb.onDisconnect(ch);
        dbTasks.forEach(Runnable::run);
        ch.runPendingTasks();

        assertThat(presence.list("channel:1")).isEmpty();
        assertThat(subscriptions.subscribers("channel:1")).isEmpty();
        assertThat(sessionRegistry.connId(ch)).isNull();
        assertThat(sessionRegistry.size()).isZero();
    }

    @Test
    void joinAfterDisconnect_ShouldNotBeAnnouncedToOthers() throws Exception {
        List<Runnable> dbTasks = new ArrayList<>();
        WsSessionProtocol slowDb = protocolWith(dbTasks::add);
        EmbeddedChannel watcher = connected(8L);
        handle(watcher, join("channel:1", "w"));
        drain(watcher);
        EmbeddedChannel gone = connected(7L);

        slowDb.handle(gone, join("channel:1", "r1"));
        gone.close();
        slowDb.onDisconnect(gone);
        dbTasks.forEach(Runnable::run);
        gone.runPendingTasks();

        assertThat(drain(watcher)).isEmpty();
        assertThat(presence.isUserPresent("channel:1", 7L)).isFalse();
    }

    @Test
    void editMessage_ShouldReplyWithEditedMessage() throws Exception {
        EmbeddedChannel ch = joined(7L, "channel:1");
        when(messageStore.get(3L)).thenReturn(message(3L));
        MessageEntity edited = message(3L);
        edited.setContent("fixed");
        when(messageStore.edit(3L, 7L, "fixed")).thenReturn(edited);

        handle(ch, command("channel:1", "edit_message", "{\"messageId\":\"3\",\"content\":\"fixed\"}"));

        JsonNode reply = drain(ch).get(0);
        assertThat(reply.get("event").asText()).isEqualTo(WsEnvelope.STATUS_OK);
        assertThat(reply.get("payload").get("message").get("content").asText()).isEqualTo("fixed");
    }

    @Test
    void editMessage_ShouldRejectMessageFromAnotherTopic() throws Exception {
        EmbeddedChannel ch = joined(7L, "channel:1");
        MessageEntity elsewhere = message(9L);
        elsewhere.setChannelId(2L);
        when(messageStore.get(9L)).thenReturn(elsewhere);

        handle(ch, command("channel:1", "edit_message", "{\"messageId\":9,\"content\":\"x\"}"));
        handle(ch, command("channel:1", "delete_message", "{\"messageId\":9}"));

        List<JsonNode> replies = drain(ch);
        assertThat(replies).hasSize(2);
        assertThat(replies).allMatch(r -> "message_not_found".equals(r.path("reason").asText()));
        verify(messageStore, never()).edit(anyLong(), anyLong(), any());
        verify(messageStore, never()).delete(anyLong(), anyLong());
    }

    @Test
    void editMessage_ShouldRequireMessageId() throws Exception {
        EmbeddedChannel ch = joined(7L, "channel:1");

        handle(ch, command("channel:1", "edit_message", "{\"content\":\"x\"}"));

        JsonNode reply = drain(ch).get(0);
        assertThat(reply.get("reason").asText()).isEqualTo(ErrorCode.VALIDATION_FAILED.getReason());
        assertThat(reply.get("payload").get("messageId").asText()).isEqualTo("missing_message_id");
    }

    @Test
    void deleteMessage_ShouldBroadcastPlaceholderToSubscribers() throws Exception {
        EmbeddedChannel author = joined(7L, "channel:1");
        EmbeddedChannel other = joined(8L, "channel:1");
        drain(author);
        when(messageStore.get(3L)).thenReturn(message(3L));
        when(messageStore.delete(3L, 7L)).thenAnswer(inv -> {
            MessageEntity m = message(3L);
            m.setIsDeleted(true);
            router.publish("channel:1", ChatEvents.MESSAGE_DELETED, Map.of("message", m));
            return m;
        });

        handle(author, command("channel:1", "delete_message", "{\"messageId\":3}"));

        List<JsonNode> seenByAuthor = drain(author);
        JsonNode reply = seenByAuthor.stream().filter(n -> WsEnvelope.REPLY.equals(n.path("type").asText())).findFirst().orElseThrow();
        assertThat(reply.get("payload").get("message").get("content").asText()).isEqualTo(MessageEntity.DELETED_PLACEHOLDER);
        List<JsonNode> seenByOther = drain(other);
        assertThat(seenByOther).hasSize(1);
        assertThat(seenByOther.get(0).get("event").asText()).isEqualTo(ChatEvents.MESSAGE_DELETED);
        assertThat(seenByOther.get(0).get("payload").get("message").get("content").asText()).isEqualTo("[deleted]");
    }

    @Test
    void loadMore_ShouldClampLimitAndReturnChronologicalPage() throws Exception {
        EmbeddedChannel ch = joined(7L, "channel:1");
        when(messageStore.list(ChatTarget.channel(1L), 50, 5L))
                .thenReturn(new MessagePage(List.of(message(4L), message(3L)), true, 3L));

        handle(ch, command("channel:1", "load_more", "{\"beforeId\":5,\"limit\":500}"));

        JsonNode payload = drain(ch).get(0).get("payload");
        assertThat(payload.get("hasMore").asBoolean()).isTrue();
        assertThat(payload.get("messages").get(0).get("id").asLong()).isEqualTo(3L);
        assertThat(payload.get("messages").get(1).get("id").asLong()).isEqualTo(4L);
    }

    @Test
    void loadMore_ShouldDefaultTo25() throws Exception {
        EmbeddedChannel ch = joined(7L, "channel:1");
        when(messageStore.list(ChatTarget.channel(1L), 25, 5L)).thenReturn(new MessagePage(List.of(), false, null));

        handle(ch, command("channel:1", "load_more", "{\"beforeId\":5}"));

        assertThat(drain(ch).get(0).get("payload").get("hasMore").asBoolean()).isFalse();
        verify(messageStore).list(ChatTarget.channel(1L), 25, 5L);
    }

    @Test
    void getThread_ShouldReturnParentRepliesAndCount() throws Exception {
        EmbeddedChannel ch = joined(7L, "channel:1");
        when(messageStore.get(3L)).thenReturn(message(3L));
        when(messageStore.thread(3L)).thenReturn(List.of(message(4L), message(6L)));
        when(messageStore.replyCount(3L)).thenReturn(2L);

        handle(ch, command("channel:1", "get_thread", "{\"messageId\":3}"));

        JsonNode payload = drain(ch).get(0).get("payload");
        assertThat(payload.get("parentMessage").get("id").asLong()).isEqualTo(3L);
        assertThat(payload.get("threadMessages").get(0).get("id").asLong()).isEqualTo(4L);
        assertThat(payload.get("threadMessages").get(1).get("id").asLong()).isEqualTo(6L);
        assertThat(payload.get("replyCount").asLong()).isEqualTo(2L);
    }

    @Test
    void archive_ShouldBeUnsupportedOnChannelTopic() throws Exception {
        EmbeddedChannel ch = joined(7L, "channel:1");

        handle(ch, command("channel:1", "archive", "{\"archived\":true}"));

        assertThat(drain(ch).get(0).get("reason").asText()).isEqualTo("unsupported_command");
        verify(conversationIdentity, never()).archiveFor(anyLong(), anyLong(), anyBoolean());
    }

    @Test
    void archive_ShouldArchiveConversationForCaller() throws Exception {
        when(conversationIdentity.canAccessConversation(30L, 7L)).thenReturn(true);
        EmbeddedChannel ch = joined(7L, "conversation:30");
        DirectConversationEntity c = new DirectConversationEntity();
        c.setId(30L);
        c.setUser1Id(7L);
        c.setUser2Id(8L);
        c.setIsArchivedByUser1(true);
        c.setIsArchivedByUser2(false);
        when(conversationIdentity.archiveFor(30L, 7L, true)).thenReturn(c);

        handle(ch, command("conversation:30", "archive", "{\"archived\":true}"));

        JsonNode reply = drain(ch).get(0);
        assertThat(reply.get("event").asText()).isEqualTo(WsEnvelope.STATUS_OK);
        assertThat(reply.get("payload").get("archived").asBoolean()).isTrue();
    }

    @Test
    void markAsRead_ShouldAdvanceReceiptForTopic() throws Exception {
        EmbeddedChannel ch = joined(7L, "channel:1");

        handle(ch, command("channel:1", "mark_as_read", "{\"messageId\":3}"));

        JsonNode reply = drain(ch).get(0);
        assertThat(reply.get("event").asText()).isEqualTo(WsEnvelope.STATUS_OK);
        assertThat(reply.get("payload").get("messageId").asText()).isEqualTo("3");
        verify(readReceiptService).markAsRead(7L, ChatTarget.channel(1L), 3L);
    }

    @Test
    void unknownCommand_ShouldReplyError() throws Exception {
        EmbeddedChannel ch = joined(7L, "channel:1");

        handle(ch, command("channel:1", "shout", "{}"));

        assertThat(drain(ch).get(0).get("reason").asText()).isEqualTo("unknown_command");
        assertThat(ch.isActive()).isTrue();
    }

    private WsSessionProtocol protocolWith(Executor dbExecutor) {
        return new WsSessionProtocol(objectMapper, sessionRegistry, subscriptions, presence, router, wsWriter,
                membershipRegistry, conversationIdentity, messageStore, readReceiptService, userSnapshotCache,
                dbExecutor, new ChatDbExecutorProperties(null, null, null, 1000L), clock);
    }

    private EmbeddedChannel joined(long userId, String topic) throws Exception {
        EmbeddedChannel ch = connected(userId);
        handle(ch, join(topic, "j" + userId));
        drain(ch);
        return ch;
    }

    private EmbeddedChannel connected(long userId) {
        EmbeddedChannel ch = new EmbeddedChannel();
        sessionRegistry.bind(ch, userId, null);
        return ch;
    }

    private void handle(EmbeddedChannel ch, WsEnvelope msg) {
        protocol.handle(ch, msg);
        ch.runPendingTasks();
    }

    private List<JsonNode> drain(EmbeddedChannel ch) throws Exception {
        ch.runPendingTasks();
        List<JsonNode> out = new ArrayList<>();
        TextWebSocketFrame frame;
        while ((frame = ch.readOutbound()) != null) {
            out.add(objectMapper.readTree(frame.text()));
            frame.release();
        }
        return out;
    }

    private static WsEnvelope join(String topic, String ref) {
        WsEnvelope env = new WsEnvelope();
        env.setType(WsEnvelope.JOIN);
        env.setTopic(topic);
        env.setRef(ref);
        return env;
    }

    private WsEnvelope command(String topic, String event, String payloadJson) throws Exception {
        WsEnvelope env = new WsEnvelope();
        env.setType(WsEnvelope.COMMAND);
        env.setTopic(topic);
        env.setEvent(event);
        env.setRef("c-" + event);
        env.setPayload(objectMapper.readTree(payloadJson));
        return env;
    }

    private static MessageEntity message(long id) {
        MessageEntity m = new MessageEntity();
        m.setId(id);
        m.setUserId(7L);
        m.setChannelId(1L);
        m.setContent("m" + id);
        m.setMessageType(MessageType.TEXT);
        m.setIsDeleted(false);
        return m;
    }
}
