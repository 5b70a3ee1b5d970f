package com.teamchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.teamchat.domain.entity.DirectConversationEntity;

public interface DirectConversationMapper extends BaseMapper<DirectConversationEntity> {
}
