package com.teamchat.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param accessTokenTtlSeconds  access token 有效期，默认 15 分钟
 * @param refreshTokenTtlSeconds refresh token 有效期，默认 30 天
 */
@ConfigurationProperties(prefix = "chat.auth")
public record AuthProperties(
        Long accessTokenTtlSeconds,
        Long refreshTokenTtlSeconds
) {

    public static final long DEFAULT_ACCESS_TTL_SECONDS = 900;
    public static final long DEFAULT_REFRESH_TTL_SECONDS = 2_592_000;

    public long accessTokenTtlSecondsEffective() {
        Long v = accessTokenTtlSeconds;
        if (v == null || v <= 0) {
            return DEFAULT_ACCESS_TTL_SECONDS;
        }
        return v;
    }

    public long refreshTokenTtlSecondsEffective() {
        Long v = refreshTokenTtlSeconds;
        if (v == null || v <= 0) {
            return DEFAULT_REFRESH_TTL_SECONDS;
        }
        return v;
    }
}
