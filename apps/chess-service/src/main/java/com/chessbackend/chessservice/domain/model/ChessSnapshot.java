package com.chessbackend.chessservice.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * 对局的只读快照（给前端渲染/广播用）。
 * board 只包含有子的格子，不返回完整 64 格。
 */
public record ChessSnapshot(
        List<BoardItem> board,
        @JsonProperty("current_turn") PieceColor currentTurn,
        @JsonProperty("game_status") GameStatus gameStatus
) {
    public ChessSnapshot {
        board = List.copyOf(board);
    }
}
