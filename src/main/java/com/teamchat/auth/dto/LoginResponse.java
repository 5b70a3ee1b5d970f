package com.teamchat.auth.dto;

/**
 * 登录 / 刷新的返回：一对新 token 加当前用户快照。
 */
public record LoginResponse(
        UserResponse user,
        String tokenType,
        String accessToken,
        long accessTtlSeconds,
        String refreshToken,
        long refreshTtlSeconds
) {
    public static LoginResponse bearer(UserResponse user, String access, long accessTtl, String refresh, long refreshTtl) {
        return new LoginResponse(user, "Bearer", access, accessTtl, refresh, refreshTtl);
    }
}
