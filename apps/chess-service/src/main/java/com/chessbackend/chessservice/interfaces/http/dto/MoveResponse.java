package com.chessbackend.chessservice.interfaces.http.dto;

import com.chessbackend.chessservice.domain.model.ChessSnapshot;
import com.chessbackend.chessservice.domain.model.MoveRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

/** 走子成功：最新对局快照 + 刚走的这一步 */
public record MoveResponse(ChessSnapshot state, @JsonProperty("last_move") MoveRecord lastMove) {
}
