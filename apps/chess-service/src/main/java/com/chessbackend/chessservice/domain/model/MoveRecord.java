package com.chessbackend.chessservice.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * 一条走子记录，追加进历史后不再修改。
 *
 * @param moveNumber 回合序号（从 1 开始，黑方走完后才加 1）
 * @param color      走子方
 * @param from       起点（小写代数记法）
 * @param to         终点（小写代数记法）
 * @param capture    是否吃子
 * @param piece      走动的棋子（升变前的样子）
 * @param promotion  升变编码；未升变为 null，序列化时省略
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"moveNumber", "color", "from", "to", "capture", "piece", "promotion"})
public record MoveRecord(
        int moveNumber,
        PieceColor color,
        String from,
        String to,
        boolean capture,
        Piece piece,
        Promotion promotion
) {
    public boolean promoted() {
        return promotion != null;
    }
}
