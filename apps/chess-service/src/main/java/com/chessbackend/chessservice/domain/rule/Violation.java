package com.chessbackend.chessservice.domain.rule;

import java.util.Objects;

/**
 * 一次校验失败：错误种类 + 细分原因（仅 ILLEGAL_PIECE_MOVE 有）+ 给玩家看的提示。
 */
public record Violation(MoveError error, IllegalMoveReason reason, String message) {

    public Violation {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(message, "message");
    }

    public static Violation of(MoveError error, String message) {
        return new Violation(error, null, message);
    }

    public static Violation illegal(IllegalMoveReason reason, String message) {
        return new Violation(MoveError.ILLEGAL_PIECE_MOVE, Objects.requireNonNull(reason, "reason"), message);
    }
}
