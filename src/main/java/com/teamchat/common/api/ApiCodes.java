package com.teamchat.common.api;

/**
 * 业务错误码，按 HTTP 语义分段。
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** 已登录但无权限 */
    public static final int FORBIDDEN = 40300;

    /** 频道 / 会话 / 消息不存在 */
    public static final int NOT_FOUND = 40400;

    /** 状态冲突：已是成员、频道已满、已归档、重名等 */
    public static final int CONFLICT = 40900;

    /** 请求过于频繁 */
    public static final int TOO_MANY_REQUESTS = 42900;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;
}
