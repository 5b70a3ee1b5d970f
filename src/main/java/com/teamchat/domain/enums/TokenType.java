package com.teamchat.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 凭证类型（对应表字段：t_auth_token.token_type）。
 *
 * <ul>
 *   <li>1 = access：短有效期，用于 HTTP 与 WS 握手鉴权</li>
 *   <li>2 = refresh：长有效期，只用于换发新的一对 token，且只能用一次</li>
 * </ul>
 */
@Getter
@RequiredArgsConstructor
public enum TokenType {

    ACCESS(1, "access"),

    REFRESH(2, "refresh");

    @EnumValue
    private final Integer code;

    @JsonValue
    private final String desc;
}
