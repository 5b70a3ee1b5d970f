package com.teamchat.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.teamchat.domain.entity.TokenBlacklistEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;

public interface TokenBlacklistMapper extends BaseMapper<TokenBlacklistEntity> {

    /**
     * 同一 token_hash 重复拉黑时忽略（黑名单只追加）。
     */
    @Insert("""
            insert ignore into t_token_blacklist(id, token_hash, user_id, reason, expires_at, created_at)
            values (#{e.id}, #{e.tokenHash}, #{e.userId}, #{e.reason}, #{e.expiresAt}, now(3))
            """)
    int insertIgnore(@Param("e") TokenBlacklistEntity entity);
}
