package com.teamchat.common.ratelimit;

public enum RateLimitKey {
    /** 按客户端 IP */
    IP,
    /** 按已登录 userId */
    USER,
    /** 按 IP + 请求体里的 username（登录/注册） */
    IP_USERNAME
}
