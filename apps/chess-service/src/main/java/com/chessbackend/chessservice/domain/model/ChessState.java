package com.chessbackend.chessservice.domain.model;

import com.chessbackend.chessservice.engine.core.GameState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 对局状态。
 * 作用：整盘对局的“单一事实来源”（棋盘、轮到谁、对局状态、走子历史）。
 * 设计说明
 * -ChessState 不做规则校验，只做状态变更（apply），规则单独放在 rule 包。
 * -history 只追加，除 reset() 外不删除、不修改。
 * -copy() 走深拷贝逻辑，便于比对“校验失败前后状态一致”。
 */
public class ChessState implements GameState {

    private final Board board = new Board();

    /** 当前轮到谁 */
    private PieceColor currentTurn = PieceColor.WHITE;

    private GameStatus status = GameStatus.IN_PROGRESS;

    /** 按时间顺序的走子记录 */
    private final List<MoveRecord> history = new ArrayList<>();

    /** 新建即为标准开局 */
    public ChessState() {
        reset();
    }

    // --------- 读方法（暴露给外部） ----------
    public Board board() { return board; }
    public PieceColor currentTurn() { return currentTurn; }
    public GameStatus status() { return status; }
    public List<MoveRecord> history() { return Collections.unmodifiableList(history); }

    /** 已走的半回合数 */
    public int halfMoves() { return history.size(); }

    /** 下一步棋的回合序号：floor(半回合数 / 2) + 1 */
    public int nextMoveNumber() { return history.size() / 2 + 1; }

    // --------- 状态变更（由上层引擎调用） ----------

    /** 手动指定轮到谁（用于摆残局/测试） */
    public void setCurrentTurn(PieceColor currentTurn) {
        this.currentTurn = currentTurn;
    }

    /**
     * 应用一次已校验通过的走子（不做合法性判断，由规则层确保合法）。
     * @param placed 落到终点的棋子（升变时为新棋子）
     */
    public void apply(Square from, Square to, Piece placed, MoveRecord record) {
        board.remove(from);
        board.put(to, placed);
        history.add(record);
        // 切换执子方
        currentTurn = currentTurn.opposite();
    }

    /** 重开：标准开局、白先、清空历史 */
    public void reset() {
        board.setupStandard();
        currentTurn = PieceColor.WHITE;
        status = GameStatus.IN_PROGRESS;
        history.clear();
    }

    /** 只读快照 */
    public ChessSnapshot snapshot() {
        return new ChessSnapshot(board.occupied(), currentTurn, status);
    }

    /** 深拷贝：复制棋盘与对局元信息 */
    @Override
    public ChessState copy() {
        ChessState s = new ChessState();
        Board b = s.board;
        b.clear();
        for (int r = 0; r < Board.SIZE; r++) {
            for (int c = 0; c < Board.SIZE; c++) {
                Piece p = board.get(r, c);
                if (p != null) b.put(Square.of(r, c), p);
            }
        }
        s.currentTurn = this.currentTurn;
        s.status = this.status;
        s.history.addAll(this.history); // MoveRecord 是不可变 record，引用即可
        return s;
    }
}
