package com.teamchat.domain.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * presence 元数据与 typing 事件用到的用户快照本机缓存。
 */
@ConfigurationProperties(prefix = "chat.cache.user-snapshot")
public class UserSnapshotCacheProperties {

    private boolean enabled = true;

    /** Caffeine 最大条目数。 */
    private long maximumSize = 50_000;

    /** 写入后过期（秒）。改了资料的用户最多这么久后可见。 */
    private long expireAfterWriteSeconds = 300;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getMaximumSize() {
        return maximumSize;
    }

    public void setMaximumSize(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public long getExpireAfterWriteSeconds() {
        return expireAfterWriteSeconds;
    }

    public void setExpireAfterWriteSeconds(long expireAfterWriteSeconds) {
        this.expireAfterWriteSeconds = expireAfterWriteSeconds;
    }
}
