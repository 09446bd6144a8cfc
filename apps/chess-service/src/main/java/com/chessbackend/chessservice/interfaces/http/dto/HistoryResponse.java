package com.chessbackend.chessservice.interfaces.http.dto;

import com.chessbackend.chessservice.domain.model.MoveRecord;

import java.util.List;

/** 走子历史（按时间顺序） */
public record HistoryResponse(List<MoveRecord> history) {
}
