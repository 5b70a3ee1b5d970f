package com.teamchat.auth.service;

import com.teamchat.domain.entity.AuthTokenEntity;
import com.teamchat.domain.entity.TokenBlacklistEntity;

import java.time.LocalDateTime;

/**
 * 凭证持久化：token 行、黑名单、用户 token_version。
 *
 * <p>实现必须保证：token_hash 唯一；黑名单按 token_hash 去重且只追加；版本号递增是原子的。</p>
 */
public interface CredentialStore {

    void saveToken(AuthTokenEntity token);

    /** 不存在时返回 null。 */
    AuthTokenEntity findTokenByHash(String tokenHash);

    void touchLastUsed(long tokenId, LocalDateTime usedAt);

    /**
     * 追加黑名单条目。
     *
     * @return 本次是否新插入；同一 hash 已在黑名单时返回 false
     */
    boolean addToBlacklist(TokenBlacklistEntity entry);

    boolean isBlacklisted(String tokenHash, LocalDateTime now);

    /** 用户不存在时返回 null。 */
    Long currentTokenVersion(long userId);

    void bumpTokenVersion(long userId);
}
