package com.teamchat.auth.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.toolkit.support.SFunction;
import com.teamchat.auth.dto.LoginRequest;
import com.teamchat.auth.dto.LoginResponse;
import com.teamchat.auth.dto.RefreshRequest;
import com.teamchat.auth.dto.RegisterRequest;
import com.teamchat.auth.dto.UserResponse;
import com.teamchat.auth.dto.VerifyResponse;
import com.teamchat.common.error.ChatException;
import com.teamchat.common.error.ErrorCode;
import com.teamchat.domain.entity.AuthTokenEntity;
import com.teamchat.domain.entity.UserEntity;
import com.teamchat.domain.enums.TokenType;
import com.teamchat.domain.enums.UserStatus;
import com.teamchat.domain.mapper.UserMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * 注册、登录与 token 生命周期的 HTTP 入口逻辑。token 本身的规则在 {@link TokenManager}。
 */
@Slf4j
@Service
public class AuthService {

    private final UserMapper userMapper;
    private final TokenManager tokenManager;
    private final BCryptPasswordEncoder passwordEncoder;

    public AuthService(UserMapper userMapper, TokenManager tokenManager, BCryptPasswordEncoder passwordEncoder) {
        this.userMapper = userMapper;
        this.tokenManager = tokenManager;
        this.passwordEncoder = passwordEncoder;
    }

    public UserResponse register(RegisterRequest request) {
        String username = request.username().trim();
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        if (exists(UserEntity::getUsername, username)) {
            throw new ChatException(ErrorCode.USERNAME_TAKEN);
        }
        if (exists(UserEntity::getEmail, email)) {
            throw new ChatException(ErrorCode.EMAIL_TAKEN);
        }

        UserEntity user = new UserEntity();
        user.setUsername(username);
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setFirstName(blankToNull(request.firstName()));
        user.setLastName(blankToNull(request.lastName()));
        user.setStatus(UserStatus.OFFLINE);
        user.setTokenVersion(1L);
        try {
            userMapper.insert(user);
        } catch (DuplicateKeyException e) {
            // 并发注册同名：唯一索引兜底
            throw new ChatException(ErrorCode.USERNAME_TAKEN);
        }
        log.info("user registered: userId={}, username={}", user.getId(), username);
        return UserResponse.of(user);
    }

    /**
     * 用户名或邮箱 + 密码登录，签发一对 token。
     */
    public LoginResponse login(LoginRequest request, String ip) {
        String principal = request.username().trim();
        UserEntity user = principal.contains("@")
                ? userMapper.selectOne(new LambdaQueryWrapper<UserEntity>()
                        .eq(UserEntity::getEmail, principal.toLowerCase(Locale.ROOT))
                        .last("limit 1"))
                : userMapper.selectOne(new LambdaQueryWrapper<UserEntity>()
                        .eq(UserEntity::getUsername, principal)
                        .last("limit 1"));
        if (user == null || user.getPasswordHash() == null
                || !passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new IllegalArgumentException("invalid_username_or_password");
        }
        return toLoginResponse(user, tokenManager.issuePair(user.getId(), request.deviceInfo(), ip));
    }

    public LoginResponse refresh(RefreshRequest request, String ip) {
        TokenManager.TokenPair pair = tokenManager.rotate(request.refreshToken(), request.deviceInfo(), ip);
        UserEntity user = userMapper.selectById(pair.access().token().getUserId());
        if (user == null) {
            throw new ChatException(ErrorCode.USER_NOT_FOUND);
        }
        return toLoginResponse(user, pair);
    }

    public void logout(String accessToken, String refreshToken) {
        tokenManager.blacklist(accessToken, "logout");
        if (refreshToken != null && !refreshToken.isBlank()) {
            tokenManager.blacklist(refreshToken, "logout");
        }
    }

    public void logoutAll(long userId) {
        tokenManager.revokeAll(userId, "logout_all");
    }

    public VerifyResponse verify(String accessToken) {
        AuthTokenEntity token = tokenManager.verify(accessToken, TokenType.ACCESS);
        return new VerifyResponse(token.getUserId(), token.getExpiresAt());
    }

    private LoginResponse toLoginResponse(UserEntity user, TokenManager.TokenPair pair) {
        return LoginResponse.bearer(UserResponse.of(user),
                pair.access().rawToken(), tokenManager.ttlSeconds(TokenType.ACCESS),
                pair.refresh().rawToken(), tokenManager.ttlSeconds(TokenType.REFRESH));
    }

    private boolean exists(SFunction<UserEntity, ?> column, String value) {
        Long n = userMapper.selectCount(new LambdaQueryWrapper<UserEntity>().eq(column, value));
        return n != null && n > 0;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
