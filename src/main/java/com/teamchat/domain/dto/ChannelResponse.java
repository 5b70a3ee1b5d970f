package com.teamchat.domain.dto;

import com.teamchat.domain.entity.ChannelEntity;

import java.time.LocalDateTime;

/**
 * 对外的频道视图。邀请码只在创建者/管理员能看到的接口里带出。
 */
public record ChannelResponse(
        Long id,
        String name,
        String description,
        String topic,
        boolean isPrivate,
        boolean isArchived,
        Long createdBy,
        Integer maxMembers,
        String inviteCode,
        LocalDateTime createdAt
) {

    public static ChannelResponse of(ChannelEntity c, boolean withInviteCode) {
        return new ChannelResponse(
                c.getId(),
                c.getName(),
                c.getDescription(),
                c.getTopic(),
                c.privateChannel(),
                c.archived(),
                c.getCreatedBy(),
                c.getMaxMembers(),
                withInviteCode ? c.getInviteCode() : null,
                c.getCreatedAt()
        );
    }
}
