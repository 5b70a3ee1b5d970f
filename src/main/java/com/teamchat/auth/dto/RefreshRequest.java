package com.teamchat.auth.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record RefreshRequest(
        @NotBlank(message = "missing_refresh_token") String refreshToken,
        Map<String, Object> deviceInfo
) {
}
