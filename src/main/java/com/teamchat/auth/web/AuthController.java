package com.teamchat.auth.web;

import com.teamchat.auth.dto.LoginRequest;
import com.teamchat.auth.dto.LoginResponse;
import com.teamchat.auth.dto.LogoutRequest;
import com.teamchat.auth.dto.RefreshRequest;
import com.teamchat.auth.dto.RegisterRequest;
import com.teamchat.auth.dto.UserResponse;
import com.teamchat.auth.dto.VerifyRequest;
import com.teamchat.auth.dto.VerifyResponse;
import com.teamchat.auth.service.AuthService;
import com.teamchat.common.api.Result;
import com.teamchat.common.ratelimit.RateLimit;
import com.teamchat.common.ratelimit.RateLimitKey;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 鉴权接口。
 *
 * <ul>
 *   <li>accessToken：15 分钟，用于 HTTP 与 WS 握手</li>
 *   <li>refreshToken：30 天，只能用一次，换发新的一对</li>
 * </ul>
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    @RateLimit(name = "auth_register", windowSeconds = 60, max = 5, key = RateLimitKey.IP)
    public Result<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        return Result.ok(authService.register(request));
    }

    @PostMapping("/login")
    @RateLimit(name = "auth_login", windowSeconds = 60, max = 5, key = RateLimitKey.IP_USERNAME)
    public Result<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest http) {
        return Result.ok(authService.login(request, http.getRemoteAddr()));
    }

    /**
     * 旧 refreshToken 用过即失效；重放会得到 token_revoked。
     */
    @PostMapping("/refresh")
    public Result<LoginResponse> refresh(@Valid @RequestBody RefreshRequest request, HttpServletRequest http) {
        return Result.ok(authService.refresh(request, http.getRemoteAddr()));
    }

    @PostMapping("/logout")
    public Result<Void> logout(@RequestBody(required = false) LogoutRequest request) {
        authService.logout(AuthContext.getAccessToken(), request == null ? null : request.refreshToken());
        return Result.okVoid();
    }

    /**
     * 所有设备下线：递增 token 版本号。
     */
    @PostMapping("/logout-all")
    public Result<Void> logoutAll() {
        authService.logoutAll(AuthContext.requireUserId());
        return Result.okVoid();
    }

    @PostMapping("/verify")
    public Result<VerifyResponse> verify(@Valid @RequestBody VerifyRequest request) {
        return Result.ok(authService.verify(request.accessToken()));
    }
}
