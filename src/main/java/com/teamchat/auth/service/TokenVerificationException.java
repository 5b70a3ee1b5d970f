package com.teamchat.auth.service;

import lombok.Getter;

import java.util.Locale;

/**
 * token 校验失败。message 为 token_expired / token_revoked 等，直接作为对外 reason。
 */
@Getter
public class TokenVerificationException extends RuntimeException {

    public enum Reason {
        EXPIRED,
        REVOKED,
        NOT_FOUND,
        VERSION_MISMATCH,
        WRONG_TYPE
    }

    private final Reason reason;

    public TokenVerificationException(Reason reason) {
        super("token_" + reason.name().toLowerCase(Locale.ROOT));
        this.reason = reason;
    }
}
