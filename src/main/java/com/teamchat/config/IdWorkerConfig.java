package com.teamchat.config;

import com.baomidou.mybatisplus.core.incrementer.DefaultIdentifierGenerator;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 多实例部署时给雪花 id 分配不同 workerId，保证消息 id 全局唯一且大致按时间递增（分页游标依赖这一点）。
 *
 * <p>优先 chat.id.worker-id；未配置时取 instance-id 末尾数字减一（gw-1 -> 0）；都没有则用 MyBatis-Plus 默认。</p>
 */
@Slf4j
@Configuration
public class IdWorkerConfig {

    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)$");

    private final long datacenterId;
    private final long workerId;
    private final String instanceId;

    public IdWorkerConfig(
            @Value("${chat.id.datacenter-id:1}") long datacenterId,
            @Value("${chat.id.worker-id:-1}") long workerId,
            @Value("${chat.gateway.ws.instance-id:}") String instanceId
    ) {
        this.datacenterId = datacenterId;
        this.workerId = workerId;
        this.instanceId = instanceId;
    }

    @Bean
    public IdentifierGenerator identifierGenerator() {
        long wid = workerId >= 0 ? workerId : workerIdFromInstance(instanceId);
        if (wid < 0) {
            log.info("id worker: default sequence (no chat.id.worker-id, instanceId={})", instanceId);
            return DefaultIdentifierGenerator.getInstance();
        }
        long w = Math.floorMod(wid, 32L);
        long dc = Math.floorMod(datacenterId, 32L);
        IdWorker.initSequence(w, dc);
        log.info("id worker: workerId={}, datacenterId={}, instanceId={}", w, dc, instanceId);
        return new DefaultIdentifierGenerator(w, dc);
    }

    static long workerIdFromInstance(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            return -1;
        }
        Matcher m = TRAILING_NUMBER.matcher(instanceId.trim());
        if (!m.find()) {
            return -1;
        }
        try {
            return Long.parseLong(m.group(1)) - 1;
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
