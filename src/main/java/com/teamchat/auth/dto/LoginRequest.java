package com.teamchat.auth.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * @param username   用户名或邮箱
 * @param deviceInfo 客户端自报的设备信息，原样记到 token 行
 */
public record LoginRequest(
        @NotBlank(message = "missing_username") String username,
        @NotBlank(message = "missing_password") String password,
        Map<String, Object> deviceInfo
) {
}
