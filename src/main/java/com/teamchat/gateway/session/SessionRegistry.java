package com.teamchat.gateway.session;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本机连接表。握手鉴权通过后 bind，断开时 unbind。
 *
 * <p>userId/connId/过期时间挂在 channel attr 上，后续 handler 直接从 channel 取，不信任客户端帧里的身份。</p>
 */
@Slf4j
@Component
public class SessionRegistry {

    public static final AttributeKey<Long> ATTR_USER_ID = AttributeKey.valueOf("chat:uid");
    public static final AttributeKey<String> ATTR_CONN_ID = AttributeKey.valueOf("chat:conn");
    public static final AttributeKey<Long> ATTR_ACCESS_EXP_MS = AttributeKey.valueOf("chat:aexp");

    private final ConcurrentHashMap<String, Channel> channels = new ConcurrentHashMap<>();

    /**
     * @return 本次连接的 connId
     */
    public String bind(Channel ch, long userId, Long accessExpMs) {
        String connId = UUID.randomUUID().toString();
        ch.attr(ATTR_USER_ID).set(userId);
        ch.attr(ATTR_CONN_ID).set(connId);
        ch.attr(ATTR_ACCESS_EXP_MS).set(accessExpMs);
        channels.put(connId, ch);
        return connId;
    }

    /**
     * 断开后清掉 connId 与过期时间；userId 保留，便于之后的日志。
     */
    public void unbind(Channel ch) {
        String connId = ch.attr(ATTR_CONN_ID).getAndSet(null);
        ch.attr(ATTR_ACCESS_EXP_MS).set(null);
        if (connId != null) {
            channels.remove(connId, ch);
        }
    }

    public boolean isAuthed(Channel ch) {
        return ch.attr(ATTR_USER_ID).get() != null;
    }

    public Long userId(Channel ch) {
        return ch.attr(ATTR_USER_ID).get();
    }

    public String connId(Channel ch) {
        return ch.attr(ATTR_CONN_ID).get();
    }

    /**
     * access token 是否已过期。握手时没拿到过期时间的连接视为不过期。
     */
    public boolean isExpired(Channel ch, long nowMs) {
        Long exp = ch.attr(ATTR_ACCESS_EXP_MS).get();
        return exp != null && nowMs >= exp;
    }

    public int size() {
        return channels.size();
    }

    /** 网关停止时逐个关闭。 */
    public void closeAll() {
        List<Channel> all = new ArrayList<>(channels.values());
        for (Channel ch : all) {
            try {
                ch.close();
            } catch (Exception e) {
                log.debug("close channel failed: {}", e.toString());
            }
        }
        channels.clear();
    }
}
