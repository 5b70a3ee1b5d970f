package com.teamchat.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@EnableConfigurationProperties(ChatDbExecutorProperties.class)
public class ChatExecutorsConfig {

    @Bean("chatDbExecutor")
    public Executor chatDbExecutor(ChatDbExecutorProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("chat-db-");
        executor.setCorePoolSize(props.corePoolSizeEffective());
        executor.setMaxPoolSize(props.maxPoolSizeEffective());
        executor.setQueueCapacity(props.queueCapacityEffective());
        // 队列满直接拒绝，由调用方回 server_busy，而不是在 eventLoop 上同步执行
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setAwaitTerminationSeconds(10);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
