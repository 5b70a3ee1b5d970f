package com.teamchat.auth.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.teamchat.domain.entity.AuthTokenEntity;
import com.teamchat.domain.entity.TokenBlacklistEntity;
import com.teamchat.domain.mapper.AuthTokenMapper;
import com.teamchat.domain.mapper.TokenBlacklistMapper;
import com.teamchat.domain.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
@RequiredArgsConstructor
public class MybatisCredentialStore implements CredentialStore {

    private final AuthTokenMapper authTokenMapper;
    private final TokenBlacklistMapper blacklistMapper;
    private final UserMapper userMapper;

    @Override
    public void saveToken(AuthTokenEntity token) {
        if (authTokenMapper.insert(token) != 1) {
            throw new IllegalStateException("insert auth token failed");
        }
    }

    @Override
    public AuthTokenEntity findTokenByHash(String tokenHash) {
        return authTokenMapper.selectOne(new LambdaQueryWrapper<AuthTokenEntity>()
                .eq(AuthTokenEntity::getTokenHash, tokenHash)
                .last("limit 1"));
    }

    @Override
    public void touchLastUsed(long tokenId, LocalDateTime usedAt) {
        authTokenMapper.update(null, new LambdaUpdateWrapper<AuthTokenEntity>()
                .eq(AuthTokenEntity::getId, tokenId)
                .set(AuthTokenEntity::getLastUsedAt, usedAt));
    }

    @Override
    public boolean addToBlacklist(TokenBlacklistEntity entry) {
        if (entry.getId() == null) {
            entry.setId(IdWorker.getId());
        }
        return blacklistMapper.insertIgnore(entry) == 1;
    }

    @Override
    public boolean isBlacklisted(String tokenHash, LocalDateTime now) {
        Long n = blacklistMapper.selectCount(new LambdaQueryWrapper<TokenBlacklistEntity>()
                .eq(TokenBlacklistEntity::getTokenHash, tokenHash)
                .gt(TokenBlacklistEntity::getExpiresAt, now));
        return n != null && n > 0;
    }

    @Override
    public Long currentTokenVersion(long userId) {
        return userMapper.selectTokenVersion(userId);
    }

    @Override
    public void bumpTokenVersion(long userId) {
        userMapper.incrementTokenVersion(userId);
    }
}
