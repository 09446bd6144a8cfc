package com.chessbackend.chessservice.domain.rule;

/**
 * 走子被拒绝的原因（封闭集合）。
 * 一次请求同时违反多条时，只报告按校验顺序最先命中的那一条。
 */
public enum MoveError {
    /** 对局不在进行中 */
    GAME_NOT_IN_PROGRESS,
    /** 起点终点相同 */
    SAME_SQUARE,
    /** 坐标格式不合法 */
    INVALID_SQUARE,
    /** 起点没有棋子 */
    EMPTY_SOURCE,
    /** 不是该方回合 */
    WRONG_TURN,
    /** 终点是己方棋子 */
    FRIENDLY_CAPTURE,
    /** 不符合棋子走法，具体见 {@link IllegalMoveReason} */
    ILLEGAL_PIECE_MOVE,
    /** 升变编码不是 q/r/b/n */
    INVALID_PROMOTION,
    /** 未到底线却指定了升变 */
    PROMOTION_NOT_ALLOWED
}
