package com.chessbackend.chessservice.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 国际象棋棋盘：8x8 网格，每格至多一枚棋子，空格为 null。
 * 只负责存取，不做走子合法性校验（由规则层判定）。
 */
public class Board {
    /** 棋盘尺寸（8x8） */
    public static final int SIZE = 8;

    /** 底线棋子顺序：车、马、象、后、王、象、马、车 */
    private static final PieceType[] BACK_RANK = {
            PieceType.ROOK, PieceType.KNIGHT, PieceType.BISHOP, PieceType.QUEEN,
            PieceType.KING, PieceType.BISHOP, PieceType.KNIGHT, PieceType.ROOK
    };

    private final Piece[][] grid = new Piece[SIZE][SIZE];

    /** 是否在棋盘内 */
    public static boolean inBounds(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    /** 是否为某一方的底线（兵到达即升变） */
    public static boolean isLastRank(int row) {
        return row == 0 || row == SIZE - 1;
    }

    /** 读取该格的棋子；空格返回 null */
    public Piece get(Square sq) { return grid[sq.row()][sq.col()]; }

    public Piece get(int row, int col) { return grid[row][col]; }

    public boolean isEmpty(Square sq) { return get(sq) == null; }

    public boolean isEmpty(int row, int col) { return grid[row][col] == null; }

    /** 在该格放置棋子（覆盖原有棋子） */
    public void put(Square sq, Piece piece) { grid[sq.row()][sq.col()] = piece; }

    /** 清空该格，返回原来的棋子 */
    public Piece remove(Square sq) {
        Piece p = grid[sq.row()][sq.col()];
        grid[sq.row()][sq.col()] = null;
        return p;
    }

    /** 清空整个棋盘 */
    public void clear() {
        for (int r = 0; r < SIZE; r++) {
            for (int c = 0; c < SIZE; c++) grid[r][c] = null;
        }
    }

    /** 摆成标准开局：黑方在 row 0/1，白方在 row 6/7 */
    public void setupStandard() {
        clear();
        for (int c = 0; c < SIZE; c++) {
            grid[0][c] = Piece.black(BACK_RANK[c]);
            grid[1][c] = Piece.black(PieceType.PAWN);
            grid[6][c] = Piece.white(PieceType.PAWN);
            grid[7][c] = Piece.white(BACK_RANK[c]);
        }
    }

    /** 棋盘上的棋子总数 */
    public int pieceCount() {
        int n = 0;
        for (int r = 0; r < SIZE; r++)
            for (int c = 0; c < SIZE; c++)
                if (grid[r][c] != null) n++;
        return n;
    }

    /**
     * 稀疏视图：只列出有子的格子，按 a8..h8, a7..h7, ..., a1..h1 的顺序。
     */
    public List<BoardItem> occupied() {
        List<BoardItem> items = new ArrayList<>();
        for (int r = 0; r < SIZE; r++) {
            for (int c = 0; c < SIZE; c++) {
                Piece p = grid[r][c];
                if (p != null) items.add(new BoardItem(Square.of(r, c).toAlgebraic(), p));
            }
        }
        return items;
    }
}
