package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.teamchat.domain.enums.UserStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@AllArgsConstructor
@NoArgsConstructor
@Builder
@Data
@TableName("t_user")
public class UserEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private String username;

    private String email;

    @JsonIgnore
    private String passwordHash;

    private String firstName;

    private String lastName;

    private String avatarUrl;

    /** 在线状态：见 {@link UserStatus}（数据库存数字）。 */
    private UserStatus status;

    /**
     * 凭证版本号，签发 token 时写入 token 行；递增即可让该用户全部旧 token 失效。
     */
    @JsonIgnore
    private Long tokenVersion;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    /**
     * 展示名：有 first/last name 时拼接，否则退回 username。
     */
    public String displayName() {
        String first = firstName == null ? "" : firstName.trim();
        String last = lastName == null ? "" : lastName.trim();
        String full = (first + " " + last).trim();
        return full.isEmpty() ? username : full;
    }
}
