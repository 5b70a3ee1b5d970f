package com.teamchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.teamchat.domain.entity.ReadReceiptEntity;

public interface ReadReceiptMapper extends BaseMapper<ReadReceiptEntity> {
}
