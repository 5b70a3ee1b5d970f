package com.teamchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 消息种类（对应表字段：t_message.message_type）。
 *
 * <p>数字与类型映射：</p>
 * <ul>
 *   <li>1 = 文本（TEXT）</li>
 *   <li>2 = 图片（IMAGE）</li>
 *   <li>3 = 文件（FILE）</li>
 *   <li>4 = 系统消息（SYSTEM）：无作者，metadata 描述触发它的动作</li>
 *   <li>5 = 话题回复（THREAD）</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum MessageType {

    TEXT(1, "text", true, true),

    IMAGE(2, "image", true, true),

    FILE(3, "file", true, true),

    SYSTEM(4, "system", false, false),

    THREAD(5, "thread", true, true);

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    /** 是否必须有作者（user_id 非空）。 */
    private final boolean requiresAuthor;

    /** 作者是否可以编辑。 */
    private final boolean editable;

    /**
     * 协议层字符串（"text" / "TEXT"）转枚举；无法识别时返回 null。
     */
    public static MessageType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (MessageType t : values()) {
            if (t.name().equalsIgnoreCase(v) || t.desc.equalsIgnoreCase(v)) {
                return t;
            }
        }
        return null;
    }
}
