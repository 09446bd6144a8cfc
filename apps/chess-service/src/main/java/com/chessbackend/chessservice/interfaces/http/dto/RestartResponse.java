package com.chessbackend.chessservice.interfaces.http.dto;

import com.chessbackend.chessservice.domain.model.ChessSnapshot;
import com.chessbackend.chessservice.domain.model.MoveRecord;

import java.util.List;

/** 重开后的快照与（已清空的）历史 */
public record RestartResponse(ChessSnapshot state, List<MoveRecord> history) {
}
