package com.teamchat.config;

import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.api.exception.FlywayValidateException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 开发期迁移脚本被改过时 validate 会失败：先 repair 校验和再 migrate。生产可用 chat.flyway.auto-repair=false 关闭。
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "chat.flyway.auto-repair", havingValue = "true", matchIfMissing = true)
public class FlywayAutoRepairConfig {

    @Bean
    public FlywayMigrationStrategy flywayMigrationStrategy() {
        return flyway -> {
            try {
                flyway.validate();
            } catch (FlywayValidateException e) {
                log.warn("flyway validate failed, running repair before migrate: {}", e.getMessage());
                flyway.repair();
            }
            flyway.migrate();
        };
    }
}
