package com.teamchat.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * HTTP 与 WS 共用同一个 ObjectMapper：id 输出成字符串，null 字段不输出。
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer chatJacksonCustomizer() {
        return builder -> {
            IdLongJsonSerializer idSerializer = new IdLongJsonSerializer();
            builder.serializerByType(Long.class, idSerializer);
            builder.serializerByType(Long.TYPE, idSerializer);
            builder.serializationInclusion(JsonInclude.Include.NON_NULL);
        };
    }
}
