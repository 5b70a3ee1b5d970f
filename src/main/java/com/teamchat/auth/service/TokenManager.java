package com.teamchat.auth.service;

import com.teamchat.auth.config.AuthProperties;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;
import com.teamchat.domain.entity.AuthTokenEntity;
import com.teamchat.domain.entity.TokenBlacklistEntity;
import com.teamchat.domain.enums.TokenType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.Map;

/**
 * 不透明 token 的签发、校验、轮换与吊销。
 *
 * <ul>
 *   <li>token 是 32 字节随机串，库里只存 sha256(raw)，明文只在签发时返回一次</li>
 *   <li>每个 token 记录签发时用户的 token_version；{@link #revokeAll} 递增版本即可让全部旧 token 失效</li>
 *   <li>refresh token 只能用一次：{@link #rotate} 会把用过的 hash 拉黑</li>
 * </ul>
 */
@Slf4j
@Service
public class TokenManager {

    public record IssuedToken(String rawToken, AuthTokenEntity token) {
    }

    public record TokenPair(IssuedToken access, IssuedToken refresh) {
    }

    private final CredentialStore store;
    private final TokenHasher hasher;
    private final AuthProperties props;
    private final Clock clock;

    private final SecureRandom secureRandom = new SecureRandom();

    public TokenManager(CredentialStore store, TokenHasher hasher, AuthProperties props, Clock clock) {
        this.store = store;
        this.hasher = hasher;
        this.props = props;
        this.clock = clock;
    }

    public IssuedToken issue(long userId, TokenType type, Map<String, Object> deviceInfo, String ip) {
        Long version = store.currentTokenVersion(userId);
        if (version == null) {
            throw new ChatException(ErrorCode.USER_NOT_FOUND);
        }
        String raw = randomToken();
        LocalDateTime now = LocalDateTime.now(clock);

        AuthTokenEntity token = new AuthTokenEntity();
        token.setUserId(userId);
        token.setTokenHash(hasher.sha256Hex(raw));
        token.setTokenType(type);
        token.setTokenVersion(version);
        token.setExpiresAt(now.plusSeconds(ttlSeconds(type)));
        token.setDeviceInfo(deviceInfo);
        token.setIpAddress(ip);
        token.setCreatedAt(now);
        store.saveToken(token);
        return new IssuedToken(raw, token);
    }

    public TokenPair issuePair(long userId, Map<String, Object> deviceInfo, String ip) {
        return new TokenPair(
                issue(userId, TokenType.ACCESS, deviceInfo, ip),
                issue(userId, TokenType.REFRESH, deviceInfo, ip)
        );
    }

    /**
     * 不限定类型的校验。
     */
    public AuthTokenEntity verify(String rawToken) {
        return verify(rawToken, null);
    }

    /**
     * 校验顺序：黑名单 -> 是否存在 -> 类型 -> 过期 -> 版本。成功后只更新 last_used_at。
     *
     * @param expectedType 为 null 时不校验类型
     */
    public AuthTokenEntity verify(String rawToken, TokenType expectedType) {
        if (rawToken == null || rawToken.isBlank()) {
            throw new TokenVerificationException(TokenVerificationException.Reason.NOT_FOUND);
        }
        String hash = hasher.sha256Hex(rawToken);
        LocalDateTime now = LocalDateTime.now(clock);

        if (store.isBlacklisted(hash, now)) {
            throw new TokenVerificationException(TokenVerificationException.Reason.REVOKED);
        }
        AuthTokenEntity token = store.findTokenByHash(hash);
        if (token == null) {
            throw new TokenVerificationException(TokenVerificationException.Reason.NOT_FOUND);
        }
        if (expectedType != null && token.getTokenType() != expectedType) {
            throw new TokenVerificationException(TokenVerificationException.Reason.WRONG_TYPE);
        }
        if (token.isExpiredAt(now)) {
            throw new TokenVerificationException(TokenVerificationException.Reason.EXPIRED);
        }
        Long current = store.currentTokenVersion(token.getUserId());
        if (current == null || !current.equals(token.getTokenVersion())) {
            throw new TokenVerificationException(TokenVerificationException.Reason.VERSION_MISMATCH);
        }

        store.touchLastUsed(token.getId(), now);
        token.setLastUsedAt(now);
        return token;
    }

    /**
     * 用 refresh token 换一对新 token；旧 refresh token 被拉黑。
     *
     * <p>并发重放时只有一个请求能把 hash 写进黑名单，另一个拿到 REVOKED。</p>
     */
    public TokenPair rotate(String rawRefreshToken, Map<String, Object> deviceInfo, String ip) {
        AuthTokenEntity consumed = verify(rawRefreshToken, TokenType.REFRESH);
        boolean claimed = store.addToBlacklist(blacklistEntry(consumed.getTokenHash(), consumed.getUserId(), "rotated", consumed.getExpiresAt()));
        if (!claimed) {
            throw new TokenVerificationException(TokenVerificationException.Reason.REVOKED);
        }
        return issuePair(consumed.getUserId(), deviceInfo, ip);
    }

    /**
     * 单个 token 吊销（登出）。未知 token 也会入黑名单，按 refresh 有效期过期。
     */
    public void blacklist(String rawToken, String reason) {
        if (rawToken == null || rawToken.isBlank()) {
            return;
        }
        String hash = hasher.sha256Hex(rawToken);
        AuthTokenEntity token = store.findTokenByHash(hash);
        LocalDateTime expiresAt = token == null
                ? LocalDateTime.now(clock).plusSeconds(props.refreshTokenTtlSecondsEffective())
                : token.getExpiresAt();
        Long userId = token == null ? null : token.getUserId();
        store.addToBlacklist(blacklistEntry(hash, userId, reason, expiresAt));
    }

    /**
     * 递增用户版本号，之前签发的所有 token 立即失效。
     */
    public void revokeAll(long userId, String reason) {
        store.bumpTokenVersion(userId);
        log.info("revoke all tokens: userId={}, reason={}", userId, reason);
    }

    public long ttlSeconds(TokenType type) {
        return type == TokenType.ACCESS
                ? props.accessTokenTtlSecondsEffective()
                : props.refreshTokenTtlSecondsEffective();
    }

    private TokenBlacklistEntity blacklistEntry(String hash, Long userId, String reason, LocalDateTime expiresAt) {
        TokenBlacklistEntity entry = new TokenBlacklistEntity();
        entry.setTokenHash(hash);
        entry.setUserId(userId);
        entry.setReason(reason);
        entry.setExpiresAt(expiresAt);
        return entry;
    }

    private String randomToken() {
        byte[] bytes = new byte[32];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
