package com.chessbackend.chessservice.domain.engine;

import com.chessbackend.chessservice.domain.constants.GameMessages;
import com.chessbackend.chessservice.domain.model.Board;
import com.chessbackend.chessservice.domain.model.ChessSnapshot;
import com.chessbackend.chessservice.domain.model.ChessState;
import com.chessbackend.chessservice.domain.model.GameStatus;
import com.chessbackend.chessservice.domain.model.MoveRecord;
import com.chessbackend.chessservice.domain.model.Piece;
import com.chessbackend.chessservice.domain.model.Promotion;
import com.chessbackend.chessservice.domain.model.Square;
import com.chessbackend.chessservice.domain.rule.ChessJudge;
import com.chessbackend.chessservice.domain.rule.MoveError;
import com.chessbackend.chessservice.domain.rule.MoveResult;
import com.chessbackend.chessservice.domain.rule.Violation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 走子引擎：持有一盘对局状态，负责按固定顺序校验并应用走子。
 * <p>
 * 校验顺序（先命中者报告）：
 * 对局状态 → 起点终点相同 → 坐标格式 → 起点有子 → 轮到该方 → 不吃己方
 * → 棋子走法（兵的升变限制在其中最先判断）→ 升变编码。
 * 所有校验都在写棋盘之前完成，被拒绝的请求不会改动任何状态。
 * <p>
 * 非线程安全：并发访问须由外层（{@code ChessServiceImpl}）整体加锁。
 */
public class ChessEngine {

    private final ChessState state;

    /** 标准开局的新对局 */
    public ChessEngine() {
        this(new ChessState());
    }

    /** 基于给定状态（如摆好的残局）运行 */
    public ChessEngine(ChessState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    /**
     * 校验并应用一步棋。
     *
     * @param from      起点，代数记法
     * @param to        终点，代数记法
     * @param promotion 升变编码 q/r/b/n，可为 null（兵到底线时默认升变为后）
     * @return 成功时携带新追加的走子记录；失败时携带原因，状态不变
     */
    public MoveResult applyMove(String from, String to, String promotion) {
        if (state.status() != GameStatus.IN_PROGRESS) {
            return MoveResult.rejected(MoveError.GAME_NOT_IN_PROGRESS, GameMessages.GAME_NOT_IN_PROGRESS);
        }
        if (from != null && from.equalsIgnoreCase(to)) {
            return MoveResult.rejected(MoveError.SAME_SQUARE, GameMessages.SAME_SQUARE);
        }

        Optional<Square> fromSq = Square.tryParse(from);
        if (fromSq.isEmpty()) {
            return MoveResult.rejected(MoveError.INVALID_SQUARE, GameMessages.formatInvalidSquare(from));
        }
        Optional<Square> toSq = Square.tryParse(to);
        if (toSq.isEmpty()) {
            return MoveResult.rejected(MoveError.INVALID_SQUARE, GameMessages.formatInvalidSquare(to));
        }
        Square fr = fromSq.get();
        Square dst = toSq.get();

        Board board = state.board();
        Piece piece = board.get(fr);
        if (piece == null) {
            return MoveResult.rejected(MoveError.EMPTY_SOURCE, GameMessages.formatEmptySource(fr.toAlgebraic()));
        }
        if (piece.color() != state.currentTurn()) {
            return MoveResult.rejected(MoveError.WRONG_TURN,
                    GameMessages.formatWrongTurn(state.currentTurn().displayName()));
        }

        Piece target = board.get(dst);
        if (target != null && target.color() == piece.color()) {
            return MoveResult.rejected(MoveError.FRIENDLY_CAPTURE, GameMessages.FRIENDLY_CAPTURE);
        }
        boolean capture = target != null;

        String promotionCode = normalizePromotion(promotion);
        Optional<Violation> violation =
                ChessJudge.validate(board, piece, fr, dst, capture, promotionCode != null);
        if (violation.isPresent()) {
            return MoveResult.rejected(violation.get());
        }

        // 兵到底线：升变（未指定时默认后）
        Piece placed = piece;
        Promotion applied = null;
        if (piece.isPawn() && Board.isLastRank(dst.row())) {
            Optional<Promotion> p = promotionCode == null
                    ? Optional.of(Promotion.DEFAULT)
                    : Promotion.fromCode(promotionCode);
            if (p.isEmpty()) {
                return MoveResult.rejected(MoveError.INVALID_PROMOTION, GameMessages.INVALID_PROMOTION);
            }
            applied = p.get();
            placed = Piece.of(applied.pieceType(), piece.color());
        }

        MoveRecord record = new MoveRecord(
                state.nextMoveNumber(),
                piece.color(),
                fr.toAlgebraic(),
                dst.toAlgebraic(),
                capture,
                piece,
                applied
        );
        state.apply(fr, dst, placed, record);
        return MoveResult.ok(record);
    }

    /** 只读快照（稀疏棋盘 + 轮到谁 + 对局状态） */
    public ChessSnapshot snapshot() {
        return state.snapshot();
    }

    /** 按时间顺序的走子历史（只读） */
    public List<MoveRecord> history() {
        return List.copyOf(state.history());
    }

    /** 重开：任何时候都可调用，总是成功 */
    public void restart() {
        state.reset();
    }

    /** 底层状态（供服务层读取/测试摆局） */
    public ChessState state() {
        return state;
    }

    /** 空串视为未指定升变 */
    private static String normalizePromotion(String promotion) {
        if (promotion == null || promotion.isBlank()) return null;
        return promotion;
    }
}
