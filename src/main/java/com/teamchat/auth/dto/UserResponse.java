package com.teamchat.auth.dto;

import com.teamchat.domain.entity.UserEntity;

public record UserResponse(
        long userId,
        String username,
        String email,
        String displayName,
        String avatarUrl
) {
    public static UserResponse of(UserEntity u) {
        return new UserResponse(u.getId(), u.getUsername(), u.getEmail(), u.displayName(), u.getAvatarUrl());
    }
}
