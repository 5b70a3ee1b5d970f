package com.teamchat.domain.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;
import com.teamchat.domain.entity.ChannelEntity;
import com.teamchat.domain.entity.ChannelMemberEntity;
import com.teamchat.domain.enums.MemberRole;
import com.teamchat.domain.enums.NotificationPreference;
import com.teamchat.domain.mapper.ChannelMapper;
import com.teamchat.domain.mapper.ChannelMemberMapper;
import com.teamchat.domain.service.MembershipRegistry;
import com.teamchat.domain.service.MessageStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipRegistryImpl implements MembershipRegistry {

    static final int INVITE_CODE_LENGTH = 10;
    private static final int MAX_NAME_LENGTH = 80;
    private static final int MAX_DESCRIPTION_LENGTH = 250;
    private static final int MAX_TOPIC_LENGTH = 250;
    private static final int MAX_MEMBERS_LIMIT = 10_000;
    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_-]+$");

    private static final SecureRandom RANDOM = new SecureRandom();

    private final ChannelMapper channelMapper;
    private final ChannelMemberMapper channelMemberMapper;
    private final MessageStore messageStore;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    @Override
    @Transactional
    public ChannelEntity createChannel(long creatorId, CreateChannelCommand cmd) {
        if (creatorId <= 0) {
            throw new ChatException(ErrorCode.UNAUTHORIZED);
        }
        String name = normalizeName(cmd.name());
        String description = normalizeText(cmd.description(), "description", MAX_DESCRIPTION_LENGTH);
        String topic = normalizeText(cmd.topic(), "topic", MAX_TOPIC_LENGTH);
        Integer maxMembers = checkMaxMembers(cmd.maxMembers());
        Long taken = channelMapper.selectCount(new LambdaQueryWrapper<ChannelEntity>().eq(ChannelEntity::getName, name));
        if (taken != null && taken > 0) {
            throw new ChatException(ErrorCode.CHANNEL_NAME_TAKEN);
        }

        ChannelEntity channel = new ChannelEntity();
        channel.setName(name);
        channel.setDescription(description);
        channel.setTopic(topic);
        channel.setIsPrivate(cmd.isPrivate());
        channel.setIsArchived(false);
        channel.setCreatedBy(creatorId);
        channel.setMaxMembers(maxMembers);
        channel.setInviteCode(cmd.isPrivate() ? newInviteCode() : null);
        try {
            channelMapper.insert(channel);
        } catch (DuplicateKeyException e) {
            throw new ChatException(ErrorCode.CHANNEL_NAME_TAKEN);
        }
        channelMemberMapper.insert(newMember(channel.getId(), creatorId, MemberRole.OWNER));
        log.info("channel created: channelId={}, name={}, private={}, creatorId={}", channel.getId(), name, channel.privateChannel(), creatorId);
        return channel;
    }

    @Override
    public ChannelEntity getChannel(long channelId) {
        ChannelEntity channel = channelMapper.selectById(channelId);
        if (channel == null) {
            throw new ChatException(ErrorCode.CHANNEL_NOT_FOUND);
        }
        return channel;
    }

    @Override
    public ChannelEntity updateChannel(long channelId, long requesterId, UpdateChannelCommand cmd) {
        ChannelEntity channel = getChannel(channelId);
        requireModerator(channelId, requesterId);
        if (cmd == null) {
            return channel;
        }
        LambdaUpdateWrapper<ChannelEntity> update = new LambdaUpdateWrapper<ChannelEntity>()
                .eq(ChannelEntity::getId, channelId);
        boolean changed = false;
        if (cmd.name() != null) {
            String name = normalizeName(cmd.name());
            if (!name.equals(channel.getName())) {
                Long taken = channelMapper.selectCount(new LambdaQueryWrapper<ChannelEntity>()
                        .eq(ChannelEntity::getName, name)
                        .ne(ChannelEntity::getId, channelId));
                if (taken != null && taken > 0) {
                    throw new ChatException(ErrorCode.CHANNEL_NAME_TAKEN);
                }
                update.set(ChannelEntity::getName, name);
                channel.setName(name);
                changed = true;
            }
        }
        if (cmd.description() != null) {
            String description = normalizeText(cmd.description(), "description", MAX_DESCRIPTION_LENGTH);
            update.set(ChannelEntity::getDescription, description);
            channel.setDescription(description);
            changed = true;
        }
        if (cmd.topic() != null) {
            String topic = normalizeText(cmd.topic(), "topic", MAX_TOPIC_LENGTH);
            update.set(ChannelEntity::getTopic, topic);
            channel.setTopic(topic);
            changed = true;
        }
        if (cmd.maxMembers() != null) {
            Integer maxMembers = checkMaxMembers(cmd.maxMembers());
            update.set(ChannelEntity::getMaxMembers, maxMembers);
            channel.setMaxMembers(maxMembers);
            changed = true;
        }
        if (!changed) {
            return channel;
        }
        try {
            channelMapper.update(null, update);
        } catch (DuplicateKeyException e) {
            throw new ChatException(ErrorCode.CHANNEL_NAME_TAKEN);
        }
        log.info("channel updated: channelId={}, by={}", channelId, requesterId);
        return channel;
    }

    @Override
    public ChannelMemberEntity join(long channelId, long userId) {
        return join(channelId, userId, MemberRole.MEMBER);
    }

    @Override
    public ChannelMemberEntity join(long channelId, long userId, MemberRole role) {
        ChannelMemberEntity member = transactionTemplate.execute(status -> {
            // 锁住频道行，人数检查与插入之间不会被并发 join 穿透
            ChannelEntity channel = channelMapper.selectOne(new LambdaQueryWrapper<ChannelEntity>()
                    .eq(ChannelEntity::getId, channelId)
                    .last("for update"));
            if (channel == null) {
                throw new ChatException(ErrorCode.CHANNEL_NOT_FOUND);
            }
            if (channel.archived()) {
                throw new ChatException(ErrorCode.CHANNEL_ARCHIVED);
            }
            if (findMember(channelId, userId) != null) {
                throw new ChatException(ErrorCode.ALREADY_MEMBER);
            }
            if (channel.getMaxMembers() != null) {
                Long count = channelMemberMapper.selectCount(new LambdaQueryWrapper<ChannelMemberEntity>()
                        .eq(ChannelMemberEntity::getChannelId, channelId));
                if (count != null && count >= channel.getMaxMembers()) {
                    throw new ChatException(ErrorCode.CHANNEL_FULL);
                }
            }
            ChannelMemberEntity m = newMember(channelId, userId, role == null ? MemberRole.MEMBER : role);
            try {
                channelMemberMapper.insert(m);
            } catch (DuplicateKeyException e) {
                throw new ChatException(ErrorCode.ALREADY_MEMBER);
            }
            return m;
        });
        log.info("channel joined: channelId={}, userId={}, role={}", channelId, userId, member == null ? null : member.getRole());
        announce(channelId, userId, "joined");
        return member;
    }

    @Override
    public ChannelMemberEntity joinByInvite(String inviteCode, long userId) {
        String code = inviteCode == null ? "" : inviteCode.trim();
        if (code.isEmpty()) {
            throw new ChatException(ErrorCode.INVITE_NOT_FOUND);
        }
        ChannelEntity channel = channelMapper.selectOne(new LambdaQueryWrapper<ChannelEntity>()
                .eq(ChannelEntity::getInviteCode, code)
                .last("limit 1"));
        if (channel == null || !channel.privateChannel() || channel.archived()) {
            throw new ChatException(ErrorCode.INVITE_NOT_FOUND);
        }
        return join(channel.getId(), userId);
    }

    @Override
    public void leave(long channelId, long userId) {
        ChannelEntity channel = getChannel(channelId);
        int n = channelMemberMapper.delete(new LambdaQueryWrapper<ChannelMemberEntity>()
                .eq(ChannelMemberEntity::getChannelId, channelId)
                .eq(ChannelMemberEntity::getUserId, userId));
        if (n <= 0) {
            throw new ChatException(ErrorCode.NOT_MEMBER);
        }
        log.info("channel left: channelId={}, userId={}", channelId, userId);
        if (!channel.archived()) {
            announce(channelId, userId, "left");
        }
    }

    @Override
    public boolean canAccessChannel(long channelId, long userId) {
        ChannelEntity channel = channelMapper.selectById(channelId);
        if (channel == null) {
            return false;
        }
        return !channel.privateChannel() || findMember(channelId, userId) != null;
    }

    @Override
    public MemberRole roleOf(long channelId, long userId) {
        ChannelMemberEntity m = findMember(channelId, userId);
        return m == null ? null : m.getRole();
    }

    @Override
    public boolean canModerate(long channelId, long userId) {
        MemberRole role = roleOf(channelId, userId);
        return role != null && role.canModerate();
    }

    @Override
    public List<ChannelMemberEntity> listMembers(long channelId, long requesterId) {
        if (!canAccessChannel(channelId, requesterId)) {
            throw new ChatException(ErrorCode.CHANNEL_NOT_FOUND);
        }
        List<ChannelMemberEntity> rows = channelMemberMapper.selectList(new LambdaQueryWrapper<ChannelMemberEntity>()
                .eq(ChannelMemberEntity::getChannelId, channelId)
                .orderByAsc(ChannelMemberEntity::getJoinedAt)
                .orderByAsc(ChannelMemberEntity::getId));
        return rows == null ? List.of() : rows;
    }

    @Override
    public ChannelMemberEntity updateRole(long channelId, long requesterId, long targetUserId, MemberRole role) {
        if (role == null) {
            throw ChatException.invalid("role", "bad_role");
        }
        getChannel(channelId);
        if (roleOf(channelId, requesterId) != MemberRole.OWNER) {
            throw new ChatException(ErrorCode.FORBIDDEN);
        }
        if (requesterId == targetUserId) {
            throw ChatException.invalid("user_id", "cannot_change_own_role");
        }
        ChannelMemberEntity target = findMember(channelId, targetUserId);
        if (target == null) {
            throw new ChatException(ErrorCode.NOT_MEMBER);
        }
        if (target.getRole() == role) {
            return target;
        }
        channelMemberMapper.update(null, new LambdaUpdateWrapper<ChannelMemberEntity>()
                .eq(ChannelMemberEntity::getId, target.getId())
                .set(ChannelMemberEntity::getRole, role));
        log.info("channel role changed: channelId={}, userId={}, {} -> {}, by={}",
                channelId, targetUserId, target.getRole(), role, requesterId);
        target.setRole(role);
        return target;
    }

    @Override
    public ChannelEntity setArchived(long channelId, long requesterId, boolean archived) {
        ChannelEntity channel = getChannel(channelId);
        requireModerator(channelId, requesterId);
        if (channel.archived() == archived) {
            return channel;
        }
        channelMapper.update(null, new LambdaUpdateWrapper<ChannelEntity>()
                .eq(ChannelEntity::getId, channelId)
                .set(ChannelEntity::getIsArchived, archived));
        channel.setIsArchived(archived);
        log.info("channel {}: channelId={}, by={}", archived ? "archived" : "unarchived", channelId, requesterId);
        return channel;
    }

    @Override
    public String regenerateInviteCode(long channelId, long requesterId) {
        ChannelEntity channel = getChannel(channelId);
        requireModerator(channelId, requesterId);
        if (!channel.privateChannel()) {
            throw ChatException.invalid("channel_id", "channel_not_private");
        }
        String code = newInviteCode();
        channelMapper.update(null, new LambdaUpdateWrapper<ChannelEntity>()
                .eq(ChannelEntity::getId, channelId)
                .set(ChannelEntity::getInviteCode, code));
        return code;
    }

    @Override
    public List<ChannelEntity> listPublicChannels() {
        List<ChannelEntity> rows = channelMapper.selectList(new LambdaQueryWrapper<ChannelEntity>()
                .eq(ChannelEntity::getIsPrivate, false)
                .eq(ChannelEntity::getIsArchived, false)
                .orderByAsc(ChannelEntity::getName));
        return rows == null ? List.of() : rows;
    }

    @Override
    public List<ChannelEntity> listUserChannels(long userId) {
        List<ChannelMemberEntity> memberships = channelMemberMapper.selectList(new LambdaQueryWrapper<ChannelMemberEntity>()
                .eq(ChannelMemberEntity::getUserId, userId)
                .select(ChannelMemberEntity::getChannelId));
        if (memberships == null || memberships.isEmpty()) {
            return List.of();
        }
        List<Long> ids = memberships.stream().map(ChannelMemberEntity::getChannelId).toList();
        List<ChannelEntity> rows = channelMapper.selectList(new LambdaQueryWrapper<ChannelEntity>()
                .in(ChannelEntity::getId, ids)
                .orderByAsc(ChannelEntity::getName));
        return rows == null ? List.of() : rows;
    }

    static String newInviteCode() {
        StringBuilder sb = new StringBuilder(INVITE_CODE_LENGTH);
        while (sb.length() < INVITE_CODE_LENGTH) {
            byte[] bytes = new byte[8];
            RANDOM.nextBytes(bytes);
            String s = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
            for (int i = 0; i < s.length(); i++) {
                char c = s.charAt(i);
                if (Character.isLetterOrDigit(c)) {
                    sb.append(c);
                }
            }
        }
        return sb.substring(0, INVITE_CODE_LENGTH);
    }

    private void announce(long channelId, long userId, String action) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("membership", action);
        metadata.put("userId", String.valueOf(userId));
        try {
            messageStore.createSystemMessage(channelId, "user " + userId + " " + action + " the channel", metadata);
        } catch (ChatException e) {
            // 成员变更已提交，系统消息失败不回滚
            log.warn("membership system message failed: channelId={}, userId={}, action={}, reason={}",
                    channelId, userId, action, e.getReason());
        }
    }

    private void requireModerator(long channelId, long userId) {
        if (!canModerate(channelId, userId)) {
            throw new ChatException(ErrorCode.FORBIDDEN);
        }
    }

    private ChannelMemberEntity findMember(long channelId, long userId) {
        return channelMemberMapper.selectOne(new LambdaQueryWrapper<ChannelMemberEntity>()
                .eq(ChannelMemberEntity::getChannelId, channelId)
                .eq(ChannelMemberEntity::getUserId, userId)
                .last("limit 1"));
    }

    private ChannelMemberEntity newMember(long channelId, long userId, MemberRole role) {
        ChannelMemberEntity m = new ChannelMemberEntity();
        m.setChannelId(channelId);
        m.setUserId(userId);
        m.setRole(role);
        m.setJoinedAt(LocalDateTime.now(clock));
        m.setIsMuted(false);
        m.setNotificationPreference(NotificationPreference.ALL);
        return m;
    }

    /** 空白视为清空，返回 null。 */
    private static String normalizeText(String raw, String field, int maxLength) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String v = raw.trim();
        if (v.length() > maxLength) {
            throw ChatException.invalid(field, field + "_too_long");
        }
        return v;
    }

    private static Integer checkMaxMembers(Integer maxMembers) {
        if (maxMembers != null && (maxMembers < 1 || maxMembers > MAX_MEMBERS_LIMIT)) {
            throw ChatException.invalid("max_members", "max_members_out_of_range");
        }
        return maxMembers;
    }

    private static String normalizeName(String raw) {
        String name = raw == null ? "" : raw.trim();
        if (name.isEmpty()) {
            throw ChatException.invalid("name", "missing_name");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw ChatException.invalid("name", "name_too_long");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw ChatException.invalid("name", "bad_name");
        }
        return name.toLowerCase(Locale.ROOT);
    }
}
