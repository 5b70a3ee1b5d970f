package com.teamchat.domain.controller;

import com.teamchat.auth.web.AuthContext;
import com.teamchat.common.api.Result;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;
import com.teamchat.common.ratelimit.RateLimit;
import com.teamchat.common.ratelimit.RateLimitKey;
import com.teamchat.domain.cache.UserSnapshotCache;
import com.teamchat.domain.dto.ChannelMemberResponse;
import com.teamchat.domain.dto.ChannelResponse;
import com.teamchat.domain.dto.ChatTarget;
import com.teamchat.domain.dto.MessagePage;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.entity.ChannelMemberEntity;
import com.teamchat.domain.entity.ReadReceiptEntity;
import com.teamchat.domain.enums.MemberRole;
import com.teamchat.domain.service.MembershipRegistry;
import com.teamchat.domain.service.MessageStore;
import com.teamchat.domain.service.ReadReceiptService;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
@RestController
@RequestMapping("/channels")
public class ChannelController {

    private final MembershipRegistry membershipRegistry;
    private final MessageStore messageStore;
    private final ReadReceiptService readReceiptService;
    private final UserSnapshotCache userSnapshotCache;

    @PostMapping
    @RateLimit(name = "channel_create", windowSeconds = 60, max = 10, key = RateLimitKey.USER)
    public Result<ChannelResponse> create(@RequestBody CreateChannelRequest req) {
        long userId = AuthContext.requireUserId();
        if (req == null) {
            throw ChatException.invalid("name", "missing_name");
        }
        ChannelEntity channel = membershipRegistry.createChannel(userId, new MembershipRegistry.CreateChannelCommand(
                req.name, req.description, req.topic, Boolean.TRUE.equals(req.isPrivate), req.maxMembers));
        return Result.ok(ChannelResponse.of(channel, true));
    }

    @GetMapping("/public")
    public Result<List<ChannelResponse>> listPublic() {
        return Result.ok(membershipRegistry.listPublicChannels().stream()
                .map(c -> ChannelResponse.of(c, false))
                .toList());
    }

    @GetMapping("/mine")
    public Result<List<ChannelResponse>> listMine() {
        long userId = AuthContext.requireUserId();
        return Result.ok(membershipRegistry.listUserChannels(userId).stream()
                .map(c -> ChannelResponse.of(c, false))
                .toList());
    }

    @GetMapping("/{id}")
    public Result<ChannelResponse> get(@PathVariable("id") long channelId) {
        long userId = AuthContext.requireUserId();
        requireAccess(channelId, userId);
        ChannelEntity channel = membershipRegistry.getChannel(channelId);
        return Result.ok(ChannelResponse.of(channel, membershipRegistry.canModerate(channelId, userId)));
    }

    @PutMapping("/{id}")
    public Result<ChannelResponse> update(@PathVariable("id") long channelId, @RequestBody UpdateChannelRequest req) {
        long userId = AuthContext.requireUserId();
        ChannelEntity channel = membershipRegistry.updateChannel(channelId, userId, req == null ? null
                : new MembershipRegistry.UpdateChannelCommand(req.name, req.description, req.topic, req.maxMembers));
        return Result.ok(ChannelResponse.of(channel, true));
    }

    /**
     * 频道不物理删除，等同归档。
     */
    @DeleteMapping("/{id}")
    public Result<Void> delete(@PathVariable("id") long channelId) {
        membershipRegistry.setArchived(channelId, AuthContext.requireUserId(), true);
        return Result.okVoid();
    }

    @GetMapping("/{id}/members")
    public Result<Map<String, Object>> members(@PathVariable("id") long channelId) {
        long userId = AuthContext.requireUserId();
        List<ChannelMemberResponse> members = membershipRegistry.listMembers(channelId, userId).stream()
                .map(m -> ChannelMemberResponse.of(m, userSnapshotCache.get(m.getUserId())))
                .toList();
        return Result.ok(Map.of("members", members, "totalCount", members.size()));
    }

    @PutMapping("/{id}/members/{userId}/role")
    public Result<ChannelMemberResponse> updateRole(@PathVariable("id") long channelId,
                                                    @PathVariable("userId") long targetUserId,
                                                    @RequestBody UpdateRoleRequest req) {
        long userId = AuthContext.requireUserId();
        MemberRole role = MemberRole.fromString(req == null ? null : req.role);
        ChannelMemberEntity m = membershipRegistry.updateRole(channelId, userId, targetUserId, role);
        return Result.ok(ChannelMemberResponse.of(m, userSnapshotCache.get(targetUserId)));
    }

    /**
     * 把已读位置推进到 messageId，返回推进后剩余的未读数。
     */
    @PostMapping("/{id}/read")
    public Result<Map<String, Object>> markAsRead(@PathVariable("id") long channelId, @RequestBody MarkReadRequest req) {
        long userId = AuthContext.requireUserId();
        if (req == null || req.messageId == null) {
            throw ChatException.invalid("message_id", "missing_message_id");
        }
        requireAccess(channelId, userId);
        ChatTarget target = ChatTarget.channel(channelId);
        ReadReceiptEntity r = readReceiptService.markAsRead(userId, target, req.messageId);
        return Result.ok(Map.of(
                "lastReadMessageId", String.valueOf(r.getLastReadMessageId()),
                "unreadCount", readReceiptService.unreadCount(userId, target)));
    }

    @GetMapping("/{id}/unread-count")
    public Result<Map<String, Long>> unreadCount(@PathVariable("id") long channelId) {
        long userId = AuthContext.requireUserId();
        requireAccess(channelId, userId);
        return Result.ok(Map.of("unreadCount", readReceiptService.unreadCount(userId, ChatTarget.channel(channelId))));
    }

    /**
     * 历史消息（从新到旧），与 WS load_more 同一套游标。
     */
    @GetMapping("/{id}/messages")
    public Result<MessagePage> messages(@PathVariable("id") long channelId,
                                        @RequestParam(value = "beforeId", required = false) Long beforeId,
                                        @RequestParam(value = "limit", defaultValue = "50") int limit) {
        long userId = AuthContext.requireUserId();
        requireAccess(channelId, userId);
        return Result.ok(messageStore.list(ChatTarget.channel(channelId), limit, beforeId));
    }

    @PostMapping("/{id}/join")
    public Result<ChannelMemberEntity> join(@PathVariable("id") long channelId) {
        long userId = AuthContext.requireUserId();
        ChannelEntity channel = membershipRegistry.getChannel(channelId);
        if (channel.privateChannel()) {
            // 私有频道只能凭邀请码加入，不暴露频道是否存在
            throw new ChatException(ErrorCode.CHANNEL_NOT_FOUND);
        }
        return Result.ok(membershipRegistry.join(channelId, userId));
    }

    @PostMapping("/join-by-invite")
    @RateLimit(name = "channel_join_invite", windowSeconds = 60, max = 10, key = RateLimitKey.USER)
    public Result<ChannelMemberEntity> joinByInvite(@RequestBody JoinByInviteRequest req) {
        long userId = AuthContext.requireUserId();
        return Result.ok(membershipRegistry.joinByInvite(req == null ? null : req.inviteCode, userId));
    }

    @PostMapping("/{id}/leave")
    public Result<Void> leave(@PathVariable("id") long channelId) {
        membershipRegistry.leave(channelId, AuthContext.requireUserId());
        return Result.okVoid();
    }

    @PostMapping("/{id}/archive")
    public Result<ChannelResponse> archive(@PathVariable("id") long channelId) {
        ChannelEntity channel = membershipRegistry.setArchived(channelId, AuthContext.requireUserId(), true);
        return Result.ok(ChannelResponse.of(channel, false));
    }

    @PostMapping("/{id}/unarchive")
    public Result<ChannelResponse> unarchive(@PathVariable("id") long channelId) {
        ChannelEntity channel = membershipRegistry.setArchived(channelId, AuthContext.requireUserId(), false);
        return Result.ok(ChannelResponse.of(channel, false));
    }

    @PostMapping("/{id}/invite-code")
    public Result<Map<String, String>> regenerateInviteCode(@PathVariable("id") long channelId) {
        String code = membershipRegistry.regenerateInviteCode(channelId, AuthContext.requireUserId());
        return Result.ok(Map.of("inviteCode", code));
    }

    private void requireAccess(long channelId, long userId) {
        if (!membershipRegistry.canAccessChannel(channelId, userId)) {
            throw new ChatException(ErrorCode.CHANNEL_NOT_FOUND);
        }
    }

    @Data
    public static class CreateChannelRequest {
        private String name;
        private String description;
        private String topic;
        private Boolean isPrivate;
        private Integer maxMembers;
    }

    @Data
    public static class UpdateChannelRequest {
        private String name;
        private String description;
        private String topic;
        private Integer maxMembers;
    }

    @Data
    public static class UpdateRoleRequest {
        private String role;
    }

    @Data
    public static class MarkReadRequest {
        private Long messageId;
    }

    @Data
    public static class JoinByInviteRequest {
        private String inviteCode;
    }
}
