package com.teamchat.domain.service;

/**
 * 领域层向订阅者广播事件的出口，由网关的广播路由实现。
 */
public interface ChatEventPublisher {

    void publish(String topic, String event, Object payload);
}
