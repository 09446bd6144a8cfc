package com.chessbackend.chessservice.domain.rule;

/** {@link MoveError#ILLEGAL_PIECE_MOVE} 的细分原因 */
public enum IllegalMoveReason {
    /** 不符合该棋子的走法形状（马/象/车/后/王） */
    ILLEGAL_PATTERN,
    /** 车/象/后的路径上有棋子 */
    PATH_BLOCKED,
    ILLEGAL_PAWN_MOVE,
    ILLEGAL_PAWN_CAPTURE,
    /** 兵前进的格子被占 */
    PAWN_BLOCKED
}
