package com.teamchat.domain.dto;

/**
 * 推送事件名（WS push 的 event 字段）。
 */
public final class ChatEvents {

    private ChatEvents() {
    }

    public static final String NEW_MESSAGE = "new_message";
    public static final String MESSAGE_UPDATED = "message_updated";
    public static final String MESSAGE_DELETED = "message_deleted";
    public static final String USER_TYPING = "user_typing";
    public static final String MESSAGES_LOADED = "messages_loaded";
    public static final String PRESENCE_STATE = "presence_state";
    public static final String PRESENCE_DIFF = "presence_diff";
}
