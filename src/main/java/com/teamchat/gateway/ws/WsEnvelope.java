package com.teamchat.gateway.ws;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * WS 文本帧统一信封，客户端与服务端双向使用。
 *
 * <p>入站 type：join / leave / ping / command；出站 type：reply / push / pong / error。</p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WsEnvelope {

    public static final String JOIN = "join";
    public static final String LEAVE = "leave";
    public static final String PING = "ping";
    public static final String COMMAND = "command";

    public static final String REPLY = "reply";
    public static final String PUSH = "push";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    public String type;

    /** 客户端关联 id，reply 原样带回。 */
    public String ref;

    /** "channel:&lt;id&gt;" 或 "conversation:&lt;id&gt;"。 */
    public String topic;

    /**
     * command：命令名（new_message/typing/...）；push：事件名；reply：ok / error。
     */
    public String event;

    public JsonNode payload;

    /** error / reply(error) 的原因码，snake_case。 */
    public String reason;

    public Long ts;
}
