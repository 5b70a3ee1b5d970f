package com.teamchat.auth.web;

import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;

/**
 * 请求级“当前用户”。由 {@link AccessTokenInterceptor} 写入，afterCompletion 清理，避免线程复用串号。
 */
public final class AuthContext {

    private static final ThreadLocal<Long> USER_ID = new ThreadLocal<>();
    private static final ThreadLocal<String> ACCESS_TOKEN = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void set(Long userId, String accessToken) {
        USER_ID.set(userId);
        ACCESS_TOKEN.set(accessToken);
    }

    public static Long getUserId() {
        return USER_ID.get();
    }

    public static String getAccessToken() {
        return ACCESS_TOKEN.get();
    }

    /**
     * 需要登录的接口用这个取 userId；未登录直接抛 unauthorized。
     */
    public static long requireUserId() {
        Long uid = USER_ID.get();
        if (uid == null || uid <= 0) {
            throw new ChatException(ErrorCode.UNAUTHORIZED);
        }
        return uid;
    }

    public static void clear() {
        USER_ID.remove();
        ACCESS_TOKEN.remove();
    }
}
