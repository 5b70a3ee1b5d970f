package com.teamchat.auth.dto;

import java.time.LocalDateTime;

public record VerifyResponse(
        long userId,
        LocalDateTime expiresAt
) {
}
