package com.teamchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.teamchat.domain.entity.ChannelEntity;

public interface ChannelMapper extends BaseMapper<ChannelEntity> {
}
