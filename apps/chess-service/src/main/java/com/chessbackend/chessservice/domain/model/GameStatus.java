package com.chessbackend.chessservice.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 对局状态。
 * 当前规则集不判将死/逼和，因此只有 IN_PROGRESS；保留枚举便于以后加终局状态。
 */
public enum GameStatus {
    IN_PROGRESS("in_progress");

    private final String code;

    GameStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }
}
