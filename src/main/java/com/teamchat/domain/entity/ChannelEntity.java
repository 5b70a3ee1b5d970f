package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_channel")
public class ChannelEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    /** 唯一，入库前转小写。 */
    private String name;

    private String description;

    private String topic;

    private Boolean isPrivate;

    /** 已归档：可读，但拒绝新消息与新成员。 */
    private Boolean isArchived;

    private Long createdBy;

    /** 为空表示不限人数。 */
    private Integer maxMembers;

    /** 仅私有频道有邀请码。 */
    private String inviteCode;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean privateChannel() {
        return Boolean.TRUE.equals(isPrivate);
    }

    public boolean archived() {
        return Boolean.TRUE.equals(isArchived);
    }
}
