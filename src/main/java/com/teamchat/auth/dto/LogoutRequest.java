package com.teamchat.auth.dto;

/**
 * @param refreshToken 可选；带上时一并拉黑
 */
public record LogoutRequest(
        String refreshToken
) {
}
