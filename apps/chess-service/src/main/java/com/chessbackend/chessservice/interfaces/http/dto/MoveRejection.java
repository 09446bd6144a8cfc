package com.chessbackend.chessservice.interfaces.http.dto;

import com.chessbackend.chessservice.domain.rule.Violation;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 走子被拒绝时放在 ApiResponse.data 里的明细，前端可按 error 区分提示。
 * reason 只在 error=ILLEGAL_PIECE_MOVE 时出现。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MoveRejection(String error, String reason) {

    public static MoveRejection from(Violation v) {
        return new MoveRejection(v.error().name(), v.reason() == null ? null : v.reason().name());
    }
}
