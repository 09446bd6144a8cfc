package com.chessbackend.chessservice.platform.ws;

import com.chessbackend.chessservice.platform.config.ChessProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocket + STOMP 配置类
 * ----------------------------------------
 * 客户端通过 /ws 端点连接，订阅 /topic/chess.state 接收对局状态广播。
 * 走子/重开仍走 HTTP 接口，WS 只负责服务端推送。
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    private final ChessProperties properties;

    public WebSocketStompConfig(ChessProperties properties) {
        this.properties = properties;
    }

    /**
     * 配置 TaskScheduler 用于 WebSocket 心跳。
     * 注意：使用不同的 bean 名称避免与 Spring 自动配置冲突。
     */
    @Bean(name = "wsHeartbeatTaskScheduler")
    public TaskScheduler wsHeartbeatTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ws-heartbeat-");
        scheduler.setDaemon(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * 注册 WebSocket STOMP 端点
     * ----------------------------------------
     * 前端连接地址：
     *   ws://localhost:8080/ws
     *   或 SockJS 备用: http://localhost:8080/ws-sockjs
     */
    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        String[] origins = properties.getCors().getAllowedOrigins().toArray(new String[0]);
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(origins);
        registry.addEndpoint("/ws-sockjs")
                .setAllowedOriginPatterns(origins)
                .withSockJS();
    }

    /**
     * 配置消息代理（Broker）
     * ----------------------------------------
     *   - enableSimpleBroker(): 内存消息代理，只用于广播
     *   - setHeartbeatValue(): [客户端发送间隔, 服务端发送间隔]（毫秒）
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic")
                .setHeartbeatValue(new long[]{5000, 5000})
                .setTaskScheduler(wsHeartbeatTaskScheduler());
        registry.setApplicationDestinationPrefixes("/app");
    }
}
