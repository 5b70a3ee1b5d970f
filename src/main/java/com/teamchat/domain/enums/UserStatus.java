package com.teamchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 用户在线状态（对应表字段：t_user.status），会出现在 presence 元数据里。
 */
@Getter
@RequiredArgsConstructor
public enum UserStatus {

    ONLINE(1, "online"),

    AWAY(2, "away"),

    BUSY(3, "busy"),

    OFFLINE(0, "offline");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;
}
