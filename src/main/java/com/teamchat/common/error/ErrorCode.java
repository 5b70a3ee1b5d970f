package com.teamchat.common.error;

import com.teamchat.common.api.ApiCodes;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * 领域错误码。reason 会原样出现在 HTTP Result.message 与 WS error 回包里。
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    VALIDATION_FAILED("validation_failed", HttpStatus.BAD_REQUEST, ApiCodes.BAD_REQUEST),

    UNAUTHORIZED("unauthorized", HttpStatus.UNAUTHORIZED, ApiCodes.UNAUTHORIZED),
    FORBIDDEN("forbidden", HttpStatus.FORBIDDEN, ApiCodes.FORBIDDEN),

    USER_NOT_FOUND("user_not_found", HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND),
    CHANNEL_NOT_FOUND("channel_not_found", HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND),
    CONVERSATION_NOT_FOUND("conversation_not_found", HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND),
    MESSAGE_NOT_FOUND("message_not_found", HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND),
    INVITE_NOT_FOUND("invite_not_found", HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND),
    NOT_MEMBER("not_member", HttpStatus.NOT_FOUND, ApiCodes.NOT_FOUND),

    ALREADY_MEMBER("already_member", HttpStatus.CONFLICT, ApiCodes.CONFLICT),
    CHANNEL_FULL("channel_full", HttpStatus.CONFLICT, ApiCodes.CONFLICT),
    CHANNEL_ARCHIVED("channel_archived", HttpStatus.CONFLICT, ApiCodes.CONFLICT),
    CHANNEL_NAME_TAKEN("channel_name_taken", HttpStatus.CONFLICT, ApiCodes.CONFLICT),
    USERNAME_TAKEN("username_taken", HttpStatus.CONFLICT, ApiCodes.CONFLICT),
    EMAIL_TAKEN("email_taken", HttpStatus.CONFLICT, ApiCodes.CONFLICT);

    private final String reason;
    private final HttpStatus status;
    private final int apiCode;
}
