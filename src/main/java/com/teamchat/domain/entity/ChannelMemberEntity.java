package com.teamchat.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.teamchat.domain.enums.MemberRole;
import com.teamchat.domain.enums.NotificationPreference;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_channel_member")
public class ChannelMemberEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long channelId;

    private Long userId;

    private MemberRole role;

    private LocalDateTime joinedAt;

    private LocalDateTime lastReadAt;

    private Boolean isMuted;

    private NotificationPreference notificationPreference;
}
