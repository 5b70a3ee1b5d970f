package com.teamchat.common.ratelimit;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param enabled               是否启用
 * @param trustForwardedHeaders 是否信任 X-Forwarded-For / X-Real-IP（只有在反向代理之后才打开）
 * @param failOpen              Redis 不可用时是否放行
 * @param keyPrefix             Redis key 前缀
 */
@ConfigurationProperties(prefix = "chat.ratelimit")
public record RateLimitProperties(
        Boolean enabled,
        Boolean trustForwardedHeaders,
        Boolean failOpen,
        String keyPrefix
) {

    public boolean enabledEffective() {
        return enabled == null || enabled;
    }

    public boolean trustForwardedHeadersEffective() {
        return trustForwardedHeaders != null && trustForwardedHeaders;
    }

    public boolean failOpenEffective() {
        return failOpen == null || failOpen;
    }

    public String keyPrefixEffective() {
        return keyPrefix == null || keyPrefix.isBlank() ? "chat:rl:" : keyPrefix;
    }
}
