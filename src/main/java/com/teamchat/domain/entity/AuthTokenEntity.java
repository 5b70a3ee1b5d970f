package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.teamchat.domain.enums.TokenType;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 已签发的 access/refresh token。只存 sha256(raw)，明文只在签发时返回一次。
 */
@Data
@TableName(value = "t_auth_token", autoResultMap = true)
public class AuthTokenEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long userId;

    /** sha256(raw token) 的小写 hex，全局唯一。 */
    private String tokenHash;

    private TokenType tokenType;

    /** 签发时用户的 token_version。 */
    private Long tokenVersion;

    private LocalDateTime expiresAt;

    private LocalDateTime lastUsedAt;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private Map<String, Object> deviceInfo;

    private String ipAddress;

    private LocalDateTime createdAt;

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt == null || now.isAfter(expiresAt);
    }
}
