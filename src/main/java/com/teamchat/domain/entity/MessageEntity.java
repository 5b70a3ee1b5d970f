package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.teamchat.domain.enums.MessageType;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Data
@TableName(value = "t_message", autoResultMap = true)
public class MessageEntity {

    public static final String DELETED_PLACEHOLDER = "[deleted]";

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    @JsonIgnore
    private String content;

    /** 见 {@link MessageType}（数据库存数字）。 */
    private MessageType messageType;

    /** 作者；系统消息为空。 */
    private Long userId;

    /** 与 directConversationId 二选一，数据库 check 约束兜底。 */
    private Long channelId;

    private Long directConversationId;

    /** 话题父消息。 */
    private Long parentMessageId;

    private LocalDateTime editedAt;

    private Boolean isDeleted;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> metadata;

    /** 上传服务产出的附件描述 {url, type, size}，这里不解析。 */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<Map<String, Object>> attachments;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @JsonIgnore
    public String getContent() {
        return content;
    }

    @JsonProperty("content")
    public String getContentForJson() {
        if (deleted()) {
            return DELETED_PLACEHOLDER;
        }
        return content;
    }

    public boolean deleted() {
        return Boolean.TRUE.equals(isDeleted);
    }
}
