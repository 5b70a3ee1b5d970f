package com.teamchat.gateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.UUID;

/**
 * @param instanceId        实例标识，跨实例广播时用来识别“自己发的消息”；为空时取 host:port
 * @param readerIdleSeconds 这么久没收到任何帧（含 ping）就断开
 */
@ConfigurationProperties(prefix = "chat.gateway.ws")
public record GatewayProperties(
        String host,
        Integer port,
        String path,
        String instanceId,
        Integer readerIdleSeconds,
        Integer maxFrameBytes
) {

    private static final String FALLBACK_INSTANCE = "gw-" + UUID.randomUUID().toString().substring(0, 8);

    public String hostEffective() {
        return host == null || host.isBlank() ? "0.0.0.0" : host.trim();
    }

    public int portEffective() {
        return port == null || port <= 0 ? 9001 : port;
    }

    public String pathEffective() {
        if (path == null || path.isBlank()) {
            return "/ws";
        }
        String p = path.trim();
        return p.startsWith("/") ? p : "/" + p;
    }

    public String instanceIdEffective() {
        if (instanceId != null && !instanceId.isBlank()) {
            return instanceId.trim();
        }
        if (port != null && port > 0) {
            return hostEffective() + ":" + port;
        }
        return FALLBACK_INSTANCE;
    }

    public int readerIdleSecondsEffective() {
        return readerIdleSeconds == null || readerIdleSeconds <= 0 ? 90 : readerIdleSeconds;
    }

    public int maxFrameBytesEffective() {
        return maxFrameBytes == null || maxFrameBytes < 1024 ? 65536 : maxFrameBytes;
    }
}
