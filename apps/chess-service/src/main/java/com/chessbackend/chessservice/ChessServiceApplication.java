package com.chessbackend.chessservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * chess-service 启动入口。
 * 进程内只维护一盘共享对局（内存），重启进程即丢失。
 */
@SpringBootApplication
public class ChessServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChessServiceApplication.class, args);
    }
}
