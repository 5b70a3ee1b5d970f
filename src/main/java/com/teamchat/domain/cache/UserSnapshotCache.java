package com.teamchat.domain.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.teamchat.domain.entity.UserEntity;
import com.teamchat.domain.enums.UserStatus;
import com.teamchat.domain.mapper.UserMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 用户展示信息的本机缓存。WS join/typing 每次都要带上用户名和展示名，不想每次都回源 DB。
 */
@Slf4j
@Component
@EnableConfigurationProperties(UserSnapshotCacheProperties.class)
public class UserSnapshotCache {

    private final UserSnapshotCacheProperties props;
    private final UserMapper userMapper;
    private final Cache<Long, Snapshot> local;

    public UserSnapshotCache(UserSnapshotCacheProperties props, UserMapper userMapper) {
        this.props = props;
        this.userMapper = userMapper;
        this.local = Caffeine.newBuilder()
                .maximumSize(Math.max(1, props.getMaximumSize()))
                .expireAfterWrite(Duration.ofSeconds(Math.max(1, props.getExpireAfterWriteSeconds())))
                .build();
    }

    /**
     * 用户不存在时返回 null。
     */
    public Snapshot get(long userId) {
        if (userId <= 0) {
            return null;
        }
        if (props.isEnabled()) {
            Snapshot hit = local.getIfPresent(userId);
            if (hit != null) {
                return hit;
            }
        }
        UserEntity user = userMapper.selectById(userId);
        if (user == null) {
            log.debug("user snapshot miss: userId={} not found", userId);
            return null;
        }
        Snapshot s = Snapshot.of(user);
        if (props.isEnabled()) {
            local.put(userId, s);
        }
        return s;
    }

    public record Snapshot(
            Long userId,
            String username,
            String firstName,
            String lastName,
            String displayName,
            String avatarUrl,
            UserStatus status
    ) {
        public static Snapshot of(UserEntity u) {
            return new Snapshot(u.getId(), u.getUsername(), u.getFirstName(), u.getLastName(),
                    u.displayName(), u.getAvatarUrl(), u.getStatus());
        }
    }
}
