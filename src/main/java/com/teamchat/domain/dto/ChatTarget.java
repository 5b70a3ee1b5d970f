package com.teamchat.domain.dto;

import com.teamchat.common.error.ChatException;

/**
 * 消息目标：频道或一对一会话，二者恰好一个非空。同时决定广播 topic。
 */
public record ChatTarget(Long channelId, Long directConversationId) {

    public static final String CHANNEL_PREFIX = "channel:";
    public static final String CONVERSATION_PREFIX = "conversation:";

    public ChatTarget {
        if ((channelId == null) == (directConversationId == null)) {
            throw ChatException.invalid("target", "exactly_one_target");
        }
    }

    public static ChatTarget channel(long channelId) {
        return new ChatTarget(channelId, null);
    }

    public static ChatTarget conversation(long conversationId) {
        return new ChatTarget(null, conversationId);
    }

    public boolean isChannel() {
        return channelId != null;
    }

    public long id() {
        return isChannel() ? channelId : directConversationId;
    }

    public String topic() {
        return isChannel() ? CHANNEL_PREFIX + channelId : CONVERSATION_PREFIX + directConversationId;
    }

    /**
     * 解析 "channel:123" / "conversation:456"；格式不对返回 null。
     */
    public static ChatTarget parseTopic(String topic) {
        if (topic == null) {
            return null;
        }
        try {
            if (topic.startsWith(CHANNEL_PREFIX)) {
                long id = Long.parseLong(topic.substring(CHANNEL_PREFIX.length()));
                return id > 0 ? channel(id) : null;
            }
            if (topic.startsWith(CONVERSATION_PREFIX)) {
                long id = Long.parseLong(topic.substring(CONVERSATION_PREFIX.length()));
                return id > 0 ? conversation(id) : null;
            }
        } catch (NumberFormatException e) {
            return null;
        }
        return null;
    }
}
