package com.teamchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 频道成员角色（对应表字段：t_channel_member.role）。
 *
 * <ul>
 *   <li>1 = 所有者（OWNER）</li>
 *   <li>2 = 管理员（ADMIN）</li>
 *   <li>3 = 普通成员（MEMBER）</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum MemberRole {

    /** 1 = owner */
    OWNER(1, "owner"),

    /** 2 = admin */
    ADMIN(2, "admin"),

    /** 3 = member */
    MEMBER(3, "member");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;

    /** 可以删除他人消息、归档频道、重置邀请码。 */
    public boolean canModerate() {
        return this == OWNER || this == ADMIN;
    }

    /** 接受 "admin" / "ADMIN"；无法识别返回 null。 */
    public static MemberRole fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (MemberRole r : values()) {
            if (r.name().equalsIgnoreCase(v) || r.desc.equalsIgnoreCase(v)) {
                return r;
            }
        }
        return null;
    }
}
