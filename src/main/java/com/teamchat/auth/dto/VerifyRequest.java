package com.teamchat.auth.dto;

import jakarta.validation.constraints.NotBlank;

public record VerifyRequest(
        @NotBlank(message = "missing_access_token") String accessToken
) {
}
