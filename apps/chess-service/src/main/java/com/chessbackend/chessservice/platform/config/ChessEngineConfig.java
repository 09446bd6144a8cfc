package com.chessbackend.chessservice.platform.config;

import com.chessbackend.chessservice.domain.engine.ChessEngine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 对局引擎的装配：整个进程只有这一盘共享对局。
 * 引擎本身是普通对象，测试里直接 new 即可，不依赖 Spring。
 */
@Configuration
public class ChessEngineConfig {

    @Bean
    public ChessEngine chessEngine() {
        return new ChessEngine();
    }
}
