package com.teamchat.domain.service;

import com.teamchat.domain.dto.ChatTarget;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.entity.MessageEntity;
import com.teamchat.domain.enums.MessageType;

import java.util.List;
import java.util.Map;

public interface MessageStore {

    int MAX_CONTENT_LENGTH = 4000;
    int MAX_PAGE_SIZE = 100;
    int MAX_QUERY_LENGTH = 100;

    /**
     * @param userId   作者；系统消息必须为空
     * @param type     为空时按 TEXT 处理；有 parentMessageId 时按 THREAD 处理
     */
    record CreateMessageCommand(
            Long userId,
            Long channelId,
            Long directConversationId,
            String content,
            MessageType type,
            Long parentMessageId,
            Map<String, Object> metadata,
            List<Map<String, Object>> attachments
    ) {
        public static CreateMessageCommand text(long userId, ChatTarget target, String content) {
            return new CreateMessageCommand(userId, target.channelId(), target.directConversationId(),
                    content, MessageType.TEXT, null, null, null);
        }
    }

    /**
     * 创建消息并广播 new_message。
     *
     * @throws com.teamchat.common.error.ChatException validation_failed / channel_archived / channel_not_found / conversation_not_found
     */
    MessageEntity create(CreateMessageCommand cmd);

    /**
     * 系统消息：无作者，metadata 描述触发动作。
     */
    MessageEntity createSystemMessage(long channelId, String content, Map<String, Object> metadata);

    MessageEntity edit(long messageId, long editorId, String content);

    MessageEntity delete(long messageId, long requesterId);

    /** 只有作者能编辑，系统消息不可编辑。 */
    boolean canEdit(MessageEntity message, long userId);

    /** 作者，或频道 admin/owner；私聊消息只有作者。 */
    boolean canDelete(MessageEntity message, long userId);

    /** 未删除的消息，不存在或已删除抛 message_not_found。 */
    MessageEntity get(long messageId);

    /**
     * 按 id 游标分页，从新到旧，不含已删除。
     *
     * @param beforeId 为 null 时从最新开始；否则只取 id &lt; beforeId
     */
    MessagePage list(ChatTarget target, int limit, Long beforeId);

    /**
     * 按内容子串搜索，从新到旧，不含已删除。
     * scope 为空时只在 requester 所在频道和参与的私聊里搜；scope 的访问权限由调用方校验。
     *
     * @param authorId 可选，只搜某个作者
     */
    MessagePage search(long requesterId, String query, ChatTarget scope, Long authorId, int limit, Long beforeId);

    /** 话题回复，按 id 升序，不含已删除。 */
    List<MessageEntity> thread(long parentMessageId);

    long replyCount(long parentMessageId);
}
