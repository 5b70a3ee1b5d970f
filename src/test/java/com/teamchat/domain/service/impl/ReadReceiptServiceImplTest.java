package com.teamchat.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;
import com.teamchat.domain.MybatisLambdaCache;
import com.teamchat.domain.dto.ChatTarget;
import com.teamchat.domain.dto.UnreadCounts;
import com.teamchat.domain.entity.ChannelMemberEntity;
import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.entity.ReadReceiptEntity;
import com.teamchat.domain.mapper.ChannelMemberMapper;
import com.teamchat.domain.mapper.MessageMapper;
import com.teamchat.domain.mapper.ReadReceiptMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DuplicateKeyException;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReadReceiptServiceImplTest {

    private final ReadReceiptMapper receiptMapper = mock(ReadReceiptMapper.class);
    private final MessageMapper messageMapper = mock(MessageMapper.class);
    private final ChannelMemberMapper memberMapper = mock(ChannelMemberMapper.class);
    private final ReadReceiptServiceImpl service = new ReadReceiptServiceImpl(receiptMapper, messageMapper, memberMapper, Clock.systemUTC());

    @BeforeAll
    static void initLambdaCache() {
        MybatisLambdaCache.init(ReadReceiptEntity.class, ChannelMemberEntity.class, MessageEntity.class);
    }

    @Test
    void markAsRead_ShouldInsertFirstMarker() {
        when(messageMapper.selectById(50L)).thenReturn(message(50L, 10L));

        ReadReceiptEntity r = service.markAsRead(1L, ChatTarget.channel(10L), 50L);

        assertThat(r.getLastReadMessageId()).isEqualTo(50L);
        verify(receiptMapper).insert(r);
        verify(memberMapper).update(any(), any());
    }

    @Test
    void markAsRead_ShouldNotMoveBackwards() {
        when(messageMapper.selectById(40L)).thenReturn(message(40L, 10L));
        when(receiptMapper.selectOne(any())).thenReturn(receipt(50L));
        when(receiptMapper.update(any(), any())).thenReturn(0);

        ReadReceiptEntity r = service.markAsRead(1L, ChatTarget.channel(10L), 40L);

        assertThat(r.getLastReadMessageId()).isEqualTo(50L);
        verify(memberMapper, never()).update(any(), any());
    }

    @Test
    void markAsRead_ShouldAdvanceMarker() {
        when(messageMapper.selectById(60L)).thenReturn(message(60L, 10L));
        when(receiptMapper.selectOne(any())).thenReturn(receipt(50L));
        when(receiptMapper.update(any(), any())).thenReturn(1);

        ReadReceiptEntity r = service.markAsRead(1L, ChatTarget.channel(10L), 60L);

        assertThat(r.getLastReadMessageId()).isEqualTo(60L);
    }

    @Test
    void markAsRead_ShouldFallBackToUpdateOnConcurrentInsert() {
        when(messageMapper.selectById(60L)).thenReturn(message(60L, 10L));
        when(receiptMapper.selectOne(any())).thenReturn(null, receipt(50L));
        when(receiptMapper.insert(any(ReadReceiptEntity.class))).thenThrow(new DuplicateKeyException("uk_user_target"));
        when(receiptMapper.update(any(), any())).thenReturn(1);

        assertThat(service.markAsRead(1L, ChatTarget.channel(10L), 60L).getLastReadMessageId()).isEqualTo(60L);
    }

    @Test
    void markAsRead_ShouldRejectMessageFromOtherTarget() {
        when(messageMapper.selectById(60L)).thenReturn(message(60L, 11L));

        assertThatThrownBy(() -> service.markAsRead(1L, ChatTarget.channel(10L), 60L))
                .isInstanceOfSatisfying(ChatException.class, e -> assertThat(e.getCode()).isEqualTo(ErrorCode.MESSAGE_NOT_FOUND));
    }

    @Test
    @SuppressWarnings("unchecked")
    void unreadCount_ShouldCountOthersMessagesAfterMarker() {
        when(receiptMapper.selectOne(any())).thenReturn(receipt(50L));
        when(messageMapper.selectCount(any())).thenReturn(3L);

        assertThat(service.unreadCount(1L, ChatTarget.channel(10L))).isEqualTo(3L);

        ArgumentCaptor<LambdaQueryWrapper<MessageEntity>> q = ArgumentCaptor.forClass(LambdaQueryWrapper.class);
        verify(messageMapper).selectCount(q.capture());
        String sql = q.getValue().getSqlSegment();
        assertThat(sql).contains("channel_id =").contains("user_id <>").contains("is_deleted =").contains("id >");
        assertThat(q.getValue().getParamNameValuePairs()).containsValue(50L);
    }

    @Test
    @SuppressWarnings("unchecked")
    void unreadCount_WithoutMarkerCountsEverythingFromOthers() {
        when(receiptMapper.selectOne(any())).thenReturn(null);
        when(messageMapper.selectCount(any())).thenReturn(7L);

        assertThat(service.unreadCount(1L, ChatTarget.conversation(20L))).isEqualTo(7L);

        ArgumentCaptor<LambdaQueryWrapper<MessageEntity>> q = ArgumentCaptor.forClass(LambdaQueryWrapper.class);
        verify(messageMapper).selectCount(q.capture());
        String sql = q.getValue().getSqlSegment();
        assertThat(sql).contains("direct_conversation_id =").doesNotContain("id >");
    }

    @Test
    void unreadCounts_ShouldCollectRowsAndTotal() {
        when(messageMapper.selectChannelUnreadCountsForUser(1L))
                .thenReturn(List.of(row("channelId", 10L, 4L), row("channelId", 11L, 0L)));
        when(messageMapper.selectConversationUnreadCountsForUser(1L))
                .thenReturn(List.of(row("conversationId", 20L, 2L)));

        UnreadCounts counts = service.unreadCounts(1L);

        assertThat(counts.channels()).containsExactly(Map.entry(10L, 4L), Map.entry(11L, 0L));
        assertThat(counts.conversations()).containsExactly(Map.entry(20L, 2L));
        assertThat(counts.total()).isEqualTo(6L);
    }

    @Test
    void unreadCounts_ShouldBeEmptyWhenNothingJoined() {
        when(messageMapper.selectChannelUnreadCountsForUser(1L)).thenReturn(List.of());
        when(messageMapper.selectConversationUnreadCountsForUser(1L)).thenReturn(null);

        UnreadCounts counts = service.unreadCounts(1L);

        assertThat(counts.channels()).isEmpty();
        assertThat(counts.conversations()).isEmpty();
        assertThat(counts.total()).isZero();
    }

    private static Map<String, Object> row(String idKey, long id, long unread) {
        Map<String, Object> row = new HashMap<>();
        row.put(idKey, id);
        row.put("unreadCount", unread);
        return row;
    }

    private static MessageEntity message(long id, long channelId) {
        MessageEntity m = new MessageEntity();
        m.setId(id);
        m.setChannelId(channelId);
        return m;
    }

    private static ReadReceiptEntity receipt(long lastRead) {
        ReadReceiptEntity r = new ReadReceiptEntity();
        r.setId(99L);
        r.setUserId(1L);
        r.setChannelId(10L);
        r.setLastReadMessageId(lastRead);
        return r;
    }
}
