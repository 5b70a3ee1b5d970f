package com.teamchat.common.error;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 领域异常：service 层统一抛出，message 即 snake_case 的 reason。
 *
 * <p>继承 IllegalArgumentException，保持“业务失败 = IAE(reason)”的既有约定。</p>
 */
@Getter
public class ChatException extends IllegalArgumentException {

    private final ErrorCode code;

    /** 字段级错误（仅 VALIDATION_FAILED 使用），field -> reason。 */
    private final Map<String, String> fieldErrors;

    public ChatException(ErrorCode code) {
        this(code, Collections.emptyMap());
    }

    public ChatException(ErrorCode code, Map<String, String> fieldErrors) {
        super(code.getReason());
        this.code = code;
        this.fieldErrors = fieldErrors == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public static ChatException invalid(String field, String reason) {
        Map<String, String> errors = new LinkedHashMap<>();
        errors.put(field, reason);
        return new ChatException(ErrorCode.VALIDATION_FAILED, errors);
    }

    public String getReason() {
        return code.getReason();
    }
}
