package com.teamchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.teamchat.domain.entity.ChannelMemberEntity;

public interface ChannelMemberMapper extends BaseMapper<ChannelMemberEntity> {
}
