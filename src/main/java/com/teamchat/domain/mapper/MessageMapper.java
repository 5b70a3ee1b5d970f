package com.teamchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.teamchat.domain.entity.MessageEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;
import java.util.Map;

public interface MessageMapper extends BaseMapper<MessageEntity> {

    @Select("""
            select count(*)
            from t_message
            where parent_message_id = #{parentId}
              and is_deleted = 0
            """)
    long countReplies(@Param("parentId") long parentId);

    /**
     * 每个未归档、自己是成员的频道的未读数；别人发的、未删除、比已读位置新的消息。
     * 列：channelId, unreadCount
     */
    @Select("""
            select cm.channel_id as channelId, count(m.id) as unreadCount
            from t_channel_member cm
            join t_channel c on c.id = cm.channel_id and c.is_archived = 0
            left join t_read_receipt rr on rr.user_id = cm.user_id and rr.channel_id = cm.channel_id
            left join t_message m on m.channel_id = cm.channel_id
                and m.user_id <> cm.user_id
                and m.is_deleted = 0
                and (rr.last_read_message_id is null or m.id > rr.last_read_message_id)
            where cm.user_id = #{userId}
            group by cm.channel_id
            """)
    List<Map<String, Object>> selectChannelUnreadCountsForUser(@Param("userId") long userId);

    /**
     * 自己这一侧未归档的私聊的未读数。
     * 列：conversationId, unreadCount
     */
    @Select("""
            select dc.id as conversationId, count(m.id) as unreadCount
            from t_direct_conversation dc
            left join t_read_receipt rr on rr.user_id = #{userId} and rr.direct_conversation_id = dc.id
            left join t_message m on m.direct_conversation_id = dc.id
                and m.user_id <> #{userId}
                and m.is_deleted = 0
                and (rr.last_read_message_id is null or m.id > rr.last_read_message_id)
            where (dc.user1_id = #{userId} and dc.is_archived_by_user1 = 0)
               or (dc.user2_id = #{userId} and dc.is_archived_by_user2 = 0)
            group by dc.id
            """)
    List<Map<String, Object>> selectConversationUnreadCountsForUser(@Param("userId") long userId);
}
