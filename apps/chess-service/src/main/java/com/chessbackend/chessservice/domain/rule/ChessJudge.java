package com.chessbackend.chessservice.domain.rule;

import com.chessbackend.chessservice.domain.constants.GameMessages;
import com.chessbackend.chessservice.domain.model.Board;
import com.chessbackend.chessservice.domain.model.Piece;
import com.chessbackend.chessservice.domain.model.PieceColor;
import com.chessbackend.chessservice.domain.model.Square;

import java.util.Optional;

/**
 * 核心规则判断
 * 国际象棋按棋子种类的走法判定（简化规则：不含王车易位、吃过路兵、将军检测）。
 * 只包含纯判断逻辑，不修改棋盘。
 */
public class ChessJudge {

    private ChessJudge() {
    }

    /**
     * 校验一枚棋子从 from 走到 to 是否符合它的走法。
     * 调用前上层已保证：起点有子、轮到该方、终点不是己方棋子。
     *
     * @param capture            终点是否有对方棋子
     * @param promotionRequested 请求中是否显式带了升变编码
     * @return 不合法时返回具体原因
     */
    public static Optional<Violation> validate(Board b, Piece piece, Square from, Square to,
                                               boolean capture, boolean promotionRequested) {
        int dr = to.row() - from.row();
        int dc = to.col() - from.col();

        switch (piece.type()) {
            case PAWN:
                return validatePawn(b, piece.color(), from, to, dr, dc, capture, promotionRequested);
            case KNIGHT:
                return isKnightPattern(dr, dc) ? Optional.empty() : illegalPattern(piece);
            case BISHOP:
                return isDiagonal(dr, dc) ? requireClearPath(b, from, to) : illegalPattern(piece);
            case ROOK:
                return isStraight(dr, dc) ? requireClearPath(b, from, to) : illegalPattern(piece);
            case QUEEN:
                return isDiagonal(dr, dc) || isStraight(dr, dc)
                        ? requireClearPath(b, from, to) : illegalPattern(piece);
            case KING:
                return Math.max(Math.abs(dr), Math.abs(dc)) == 1 ? Optional.empty() : illegalPattern(piece);
            default:
                throw new IllegalArgumentException("unknown piece type: " + piece.type());
        }
    }

    /** 马：日字（1,2）或（2,1） */
    public static boolean isKnightPattern(int dr, int dc) {
        int ar = Math.abs(dr), ac = Math.abs(dc);
        return (ar == 1 && ac == 2) || (ar == 2 && ac == 1);
    }

    /** 斜线：|dr| == |dc| 且不为 0 */
    public static boolean isDiagonal(int dr, int dc) {
        return dr != 0 && Math.abs(dr) == Math.abs(dc);
    }

    /** 直线：dr、dc 恰有一个为 0 */
    public static boolean isStraight(int dr, int dc) {
        return (dr == 0) != (dc == 0);
    }

    /**
     * from 与 to 之间（不含两端）沿直线/斜线的每一格是否都为空。
     * 调用方需保证两点在同一直线或斜线上。
     */
    public static boolean isPathClear(Board b, Square from, Square to) {
        int stepR = Integer.signum(to.row() - from.row());
        int stepC = Integer.signum(to.col() - from.col());
        int r = from.row() + stepR;
        int c = from.col() + stepC;
        while (r != to.row() || c != to.col()) {
            if (!b.isEmpty(r, c)) return false;
            r += stepR;
            c += stepC;
        }
        return true;
    }

    // ----------- private helpers -----------

    /**
     * 兵：
     * - 显式升变但终点不在底线，先于走法判断报错；
     * - 吃子只能斜前方一格；
     * - 不吃子只能直走：一格，或从初始行走两格（中间格与终点都要空）。
     * 不支持吃过路兵。
     */
    private static Optional<Violation> validatePawn(Board b, PieceColor color, Square from, Square to,
                                                    int dr, int dc, boolean capture, boolean promotionRequested) {
        int direction = color.pawnDirection();

        if (promotionRequested && !Board.isLastRank(to.row())) {
            return Optional.of(Violation.of(MoveError.PROMOTION_NOT_ALLOWED, GameMessages.PROMOTION_NOT_ALLOWED));
        }

        if (capture) {
            if (dr != direction || Math.abs(dc) != 1) {
                return illegal(IllegalMoveReason.ILLEGAL_PAWN_CAPTURE, GameMessages.ILLEGAL_PAWN_CAPTURE);
            }
            return Optional.empty();
        }

        if (dc != 0) {
            return illegal(IllegalMoveReason.ILLEGAL_PAWN_MOVE, GameMessages.ILLEGAL_PAWN_MOVE);
        }

        // 前进一格（终点为空已由 capture=false 保证）
        if (dr == direction) {
            return b.isEmpty(to) ? Optional.empty()
                    : illegal(IllegalMoveReason.PAWN_BLOCKED, GameMessages.PAWN_BLOCKED);
        }

        // 初始行前进两格，中间格与终点都必须为空
        if (from.row() == color.pawnStartRow() && dr == 2 * direction) {
            if (!b.isEmpty(from.row() + direction, from.col()) || !b.isEmpty(to)) {
                return illegal(IllegalMoveReason.PAWN_BLOCKED, GameMessages.PAWN_BLOCKED);
            }
            return Optional.empty();
        }

        return illegal(IllegalMoveReason.ILLEGAL_PAWN_MOVE, GameMessages.ILLEGAL_PAWN_MOVE);
    }

    private static Optional<Violation> requireClearPath(Board b, Square from, Square to) {
        return isPathClear(b, from, to) ? Optional.empty()
                : illegal(IllegalMoveReason.PATH_BLOCKED, GameMessages.PATH_BLOCKED);
    }

    private static Optional<Violation> illegalPattern(Piece piece) {
        return illegal(IllegalMoveReason.ILLEGAL_PATTERN, GameMessages.formatIllegalPattern(piece.displayName()));
    }

    private static Optional<Violation> illegal(IllegalMoveReason reason, String message) {
        return Optional.of(Violation.illegal(reason, message));
    }
}
