package com.teamchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.teamchat.domain.entity.AuthTokenEntity;

public interface AuthTokenMapper extends BaseMapper<AuthTokenEntity> {
}
