package com.teamchat.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.auth.service.TokenManager;
import com.teamchat.config.ChatDbExecutorProperties;
import com.teamchat.gateway.config.GatewayProperties;
import com.teamchat.gateway.session.SessionRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
@Component
@EnableConfigurationProperties(GatewayProperties.class)
public class NettyWsServer implements SmartLifecycle {

    private final GatewayProperties props;
    private final ObjectMapper objectMapper;
    private final TokenManager tokenManager;
    private final SessionRegistry sessionRegistry;
    private final WsSessionProtocol protocol;
    private final WsWriter wsWriter;
    private final Executor dbExecutor;
    private final ChatDbExecutorProperties dbExecutorProps;
    private final Clock clock;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NettyWsServer(GatewayProperties props,
                         ObjectMapper objectMapper,
                         TokenManager tokenManager,
                         SessionRegistry sessionRegistry,
                         WsSessionProtocol protocol,
                         WsWriter wsWriter,
                         @Qualifier("chatDbExecutor") Executor dbExecutor,
                         ChatDbExecutorProperties dbExecutorProps,
                         Clock clock) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.tokenManager = tokenManager;
        this.sessionRegistry = sessionRegistry;
        this.protocol = protocol;
        this.wsWriter = wsWriter;
        this.dbExecutor = dbExecutor;
        this.dbExecutorProps = dbExecutorProps;
        this.clock = clock;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        String host = props.hostEffective();
        int port = props.portEffective();
        String path = props.pathEffective();
        log.info("Starting Netty WS gateway on {}:{}{} (instance={})", host, port, path, props.instanceIdEffective());

        boss = new NioEventLoopGroup(1);
        worker = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();

                        // 1) 握手阶段是 HTTP
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(65536));

                        // 2) 读空闲：客户端按约定定期发 ping，超时未收到任何帧即断开
                        p.addLast(new IdleStateHandler(props.readerIdleSecondsEffective(), 0, 0));

                        // 3) Upgrade 请求上校验 access token，失败回 401，不建立连接
                        p.addLast(new WsHandshakeAuthHandler(path, tokenManager, sessionRegistry,
                                dbExecutor, dbExecutorProps.timeoutMsEffective(), clock.getZone()));

                        // 4) WebSocket 协议层（握手、控制帧）
                        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(path)
                                .checkStartsWith(true)
                                .maxFramePayloadLength(props.maxFrameBytesEffective())
                                .build();
                        p.addLast(new WebSocketServerProtocolHandler(wsConfig));

                        // 5) 业务 JSON 帧
                        p.addLast(new WsFrameHandler(objectMapper, sessionRegistry, protocol, wsWriter, clock));
                    }
                });

        try {
            serverChannel = b.bind(host, port).syncUninterruptibly().channel();
            log.info("Netty WS gateway started, listening on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("Failed to start Netty WS gateway on {}:{}{}", host, port, path, e);
            stop();
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping Netty WS gateway, open sessions={}", sessionRegistry.size());
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        sessionRegistry.closeAll();
        if (worker != null) {
            worker.shutdownGracefully();
        }
        if (boss != null) {
            boss.shutdownGracefully();
        }
        log.info("Netty WS gateway stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 比 PresenceTracker 晚启动、早停止
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }
}
