package com.teamchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum NotificationPreference {

    ALL(1, "all"),

    MENTIONS(2, "mentions"),

    NONE(0, "none");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;
}
