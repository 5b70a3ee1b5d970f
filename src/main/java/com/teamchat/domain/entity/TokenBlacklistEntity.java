package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * token 黑名单（只追加）。未过期的条目会让同 hash 的 token 立即不可用。
 */
@Data
@TableName("t_token_blacklist")
public class TokenBlacklistEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String tokenHash;

    private Long userId;

    /** logout / rotated / revoked 等。 */
    private String reason;

    private LocalDateTime expiresAt;

    private LocalDateTime createdAt;
}
