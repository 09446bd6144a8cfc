package com.chessbackend.chessservice.platform.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * chess-service 自身的配置（前缀 chess）。
 *
 * 支持通过 application.yml 或环境变量覆盖，例如：
 *   CHESS_CORS_ALLOWED_ORIGINS=http://localhost:3000,http://127.0.0.1:3000
 */
@Component
@ConfigurationProperties(prefix = "chess")
public class ChessProperties {

    private final Cors cors = new Cors();

    private final Ws ws = new Ws();

    public Cors getCors() {
        return cors;
    }

    public Ws getWs() {
        return ws;
    }

    /** 跨域配置（前端开发服务器默认跑在 3000 端口） */
    public static class Cors {
        /**
         * 允许的来源，例如 http://localhost:3000
         */
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }

    /** STOMP 广播配置 */
    public static class Ws {
        /**
         * 对局状态广播的目的地
         */
        private String topic = "/topic/chess.state";

        /**
         * 单步走子事件的目的地
         */
        private String moveTopic = "/topic/chess.moves";

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public String getMoveTopic() {
            return moveTopic;
        }

        public void setMoveTopic(String moveTopic) {
            this.moveTopic = moveTopic;
        }
    }
}
