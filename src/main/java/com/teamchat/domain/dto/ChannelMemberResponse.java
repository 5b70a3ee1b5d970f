package com.teamchat.domain.dto;

import com.teamchat.domain.cache.UserSnapshotCache;
import com.teamchat.domain.entity.ChannelMemberEntity;
import com.teamchat.domain.enums.MemberRole;

import java.time.LocalDateTime;

/**
 * 成员列表的一行；user 取自快照缓存，用户已被删除时为 null。
 */
public record ChannelMemberResponse(
        Long userId,
        MemberRole role,
        LocalDateTime joinedAt,
        LocalDateTime lastReadAt,
        UserSnapshotCache.Snapshot user
) {

    public static ChannelMemberResponse of(ChannelMemberEntity m, UserSnapshotCache.Snapshot user) {
        return new ChannelMemberResponse(m.getUserId(), m.getRole(), m.getJoinedAt(), m.getLastReadAt(), user);
    }
}
