package com.teamchat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WS 命令落库线程池。Netty eventLoop 里不做任何阻塞 DB 调用。
 *
 * @param timeoutMs 单个命令的 DB 阶段超时，超时回 timeout
 */
@ConfigurationProperties(prefix = "chat.executors.db")
public record ChatDbExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity,
        Long timeoutMs
) {

    public int corePoolSizeEffective() {
        Integer v = corePoolSize;
        if (v == null) {
            return 8;
        }
        return Math.max(1, v);
    }

    public int maxPoolSizeEffective() {
        Integer v = maxPoolSize;
        if (v == null) {
            return 32;
        }
        return Math.max(corePoolSizeEffective(), v);
    }

    public int queueCapacityEffective() {
        Integer v = queueCapacity;
        if (v == null) {
            return 10_000;
        }
        return Math.max(0, v);
    }

    public long timeoutMsEffective() {
        Long v = timeoutMs;
        if (v == null || v <= 0) {
            return 3_000;
        }
        return v;
    }
}
