package com.teamchat.domain.service;

import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.entity.ChannelMemberEntity;
import com.teamchat.domain.enums.MemberRole;

import java.util.List;

/**
 * 频道与成员关系。
 */
public interface MembershipRegistry {

    record CreateChannelCommand(
            String name,
            String description,
            String topic,
            boolean isPrivate,
            Integer maxMembers
    ) {
    }

    /**
     * 字段为 null 表示不修改；description/topic 传空串表示清空。
     */
    record UpdateChannelCommand(
            String name,
            String description,
            String topic,
            Integer maxMembers
    ) {
    }

    /**
     * 创建频道，创建者同时成为 owner 成员；私有频道生成邀请码。
     */
    ChannelEntity createChannel(long creatorId, CreateChannelCommand cmd);

    ChannelEntity getChannel(long channelId);

    /** owner/admin 修改名称、描述、话题、人数上限。 */
    ChannelEntity updateChannel(long channelId, long requesterId, UpdateChannelCommand cmd);

    /**
     * 以 member 身份加入。
     *
     * @throws com.teamchat.common.error.ChatException channel_not_found / channel_archived / already_member / channel_full
     */
    ChannelMemberEntity join(long channelId, long userId);

    ChannelMemberEntity join(long channelId, long userId, MemberRole role);

    /**
     * 通过邀请码加入私有、未归档的频道；其余校验同 {@link #join(long, long)}。
     */
    ChannelMemberEntity joinByInvite(String inviteCode, long userId);

    /**
     * 退出频道。最后一个 owner 离开时不会自动提升其他成员。
     */
    void leave(long channelId, long userId);

    /** 公开频道对所有人可见；私有频道只对成员可见。 */
    boolean canAccessChannel(long channelId, long userId);

    /** 非成员返回 null。 */
    MemberRole roleOf(long channelId, long userId);

    boolean canModerate(long channelId, long userId);

    /**
     * 能看到频道的人都能看成员列表，按加入时间排序。
     */
    List<ChannelMemberEntity> listMembers(long channelId, long requesterId);

    /**
     * 只有 owner 能调整他人角色，不能改自己的。
     *
     * @throws com.teamchat.common.error.ChatException forbidden / not_member / validation_failed
     */
    ChannelMemberEntity updateRole(long channelId, long requesterId, long targetUserId, MemberRole role);

    ChannelEntity setArchived(long channelId, long requesterId, boolean archived);

    String regenerateInviteCode(long channelId, long requesterId);

    List<ChannelEntity> listPublicChannels();

    List<ChannelEntity> listUserChannels(long userId);
}
