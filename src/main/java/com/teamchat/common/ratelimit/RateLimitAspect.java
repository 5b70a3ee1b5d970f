package com.teamchat.common.ratelimit;

import com.teamchat.auth.dto.LoginRequest;
import com.teamchat.auth.dto.RegisterRequest;
import com.teamchat.auth.web.AuthContext;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.List;
import java.util.Locale;

@Slf4j
@Aspect
@Order(Ordered.HIGHEST_PRECEDENCE)
@Component
@EnableConfigurationProperties(RateLimitProperties.class)
@RequiredArgsConstructor
public class RateLimitAspect {

    private final RateLimitProperties props;
    private final StringRedisTemplate redis;

    private final DefaultRedisScript<Long> script = buildScript();

    @Around("@annotation(com.teamchat.common.ratelimit.RateLimit)")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        if (!props.enabledEffective()) {
            return pjp.proceed();
        }
        if (!(pjp.getSignature() instanceof MethodSignature sig)) {
            return pjp.proceed();
        }
        RateLimit rateLimit = sig.getMethod().getAnnotation(RateLimit.class);
        HttpServletRequest req = currentRequest();
        if (rateLimit == null || req == null) {
            return pjp.proceed();
        }

        String key = buildKey(req, pjp.getArgs(), rateLimit);
        if (key == null) {
            return pjp.proceed();
        }

        long window = Math.max(1, rateLimit.windowSeconds());
        Long retryAfter;
        try {
            retryAfter = redis.execute(script, List.of(key), String.valueOf(window), String.valueOf(Math.max(1, rateLimit.max())));
        } catch (Exception e) {
            if (props.failOpenEffective()) {
                log.debug("ratelimit redis failed, fail-open: name={}, err={}", rateLimit.name(), e.toString());
                return pjp.proceed();
            }
            throw new RateLimitExceededException("too_many_requests", window);
        }
        if (retryAfter != null && retryAfter > 0) {
            log.info("ratelimit hit: name={}, key={}, retryAfter={}", rateLimit.name(), key, retryAfter);
            throw new RateLimitExceededException("too_many_requests", retryAfter);
        }
        return pjp.proceed();
    }

    String buildKey(HttpServletRequest req, Object[] args, RateLimit rateLimit) {
        String value = switch (rateLimit.key()) {
            case IP -> resolveIp(req);
            case USER -> AuthContext.getUserId() == null ? null : String.valueOf(AuthContext.getUserId());
            case IP_USERNAME -> {
                String ip = resolveIp(req);
                String username = extractUsername(args);
                yield ip == null || username == null ? null : ip + ":" + username.trim().toLowerCase(Locale.ROOT);
            }
        };
        if (value == null || value.isBlank()) {
            return null;
        }
        return props.keyPrefixEffective() + rateLimit.name() + ":" + rateLimit.key().name() + ":" + value;
    }

    String extractUsername(Object[] args) {
        if (args == null) {
            return null;
        }
        for (Object arg : args) {
            if (arg instanceof LoginRequest r) {
                return r.username();
            }
            if (arg instanceof RegisterRequest r) {
                return r.username();
            }
        }
        return null;
    }

    String resolveIp(HttpServletRequest req) {
        if (props.trustForwardedHeadersEffective()) {
            String xff = req.getHeader("X-Forwarded-For");
            if (xff != null && !xff.isBlank()) {
                String first = xff.split(",")[0].trim();
                if (!first.isBlank()) {
                    return first;
                }
            }
            String xri = req.getHeader("X-Real-IP");
            if (xri != null && !xri.isBlank()) {
                return xri.trim();
            }
        }
        return req.getRemoteAddr();
    }

    private static HttpServletRequest currentRequest() {
        RequestAttributes attrs = RequestContextHolder.getRequestAttributes();
        if (attrs instanceof ServletRequestAttributes sra) {
            return sra.getRequest();
        }
        return null;
    }

    private static DefaultRedisScript<Long> buildScript() {
        DefaultRedisScript<Long> s = new DefaultRedisScript<>();
        s.setResultType(Long.class);
        s.setScriptText("""
                local c = redis.call('INCR', KEYS[1])
                if c == 1 then
                  redis.call('EXPIRE', KEYS[1], ARGV[1])
                end
                if c > tonumber(ARGV[2]) then
                  local ttl = redis.call('TTL', KEYS[1])
                  if ttl < 0 then ttl = tonumber(ARGV[1]) end
                  return ttl
                end
                return 0
                """);
        return s;
    }
}
