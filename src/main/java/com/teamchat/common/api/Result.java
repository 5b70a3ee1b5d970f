package com.teamchat.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * HTTP 接口统一返回结构。
 *
 * <ul>
 *   <li>ok：业务是否成功。</li>
 *   <li>code：成功为 0，失败取 {@link ApiCodes} 中的值。</li>
 *   <li>message：snake_case 原因串，例如 channel_full。</li>
 *   <li>data：成功时的数据；校验失败时可携带字段级错误。</li>
 *   <li>ts：服务端时间戳（毫秒）。</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Result<T>(
        boolean ok,
        int code,
        String message,
        T data,
        long ts
) {

    public static <T> Result<T> ok(T data) {
        return new Result<>(true, 0, "ok", data, System.currentTimeMillis());
    }

    /** record 已经生成了 ok() 访问器，所以无数据的成功返回单独命名。 */
    public static <T> Result<T> okVoid() {
        return new Result<>(true, 0, "ok", null, System.currentTimeMillis());
    }

    public static <T> Result<T> fail(int code, String message) {
        return new Result<>(false, code, message, null, System.currentTimeMillis());
    }

    public static <T> Result<T> fail(int code, String message, T detail) {
        return new Result<>(false, code, message, detail, System.currentTimeMillis());
    }
}
