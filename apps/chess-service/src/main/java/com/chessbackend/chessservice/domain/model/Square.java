package com.chessbackend.chessservice.domain.model;

import java.util.Optional;

/**
 * 棋盘上的一个格子（行/列下标）。
 * 坐标约定：row 0 = 第 8 横线（黑方底线），row 7 = 第 1 横线（白方底线）；
 * col 0 = a 列，col 7 = h 列。
 * 对外统一使用代数记法（如 "e2"），输入不区分大小写，输出一律小写。
 */
public record Square(int row, int col) {

    public Square {
        if (!Board.inBounds(row, col)) {
            throw new IndexOutOfBoundsException("square index out of bounds: (" + row + "," + col + ")");
        }
    }

    public static Square of(int row, int col) {
        return new Square(row, col);
    }

    /**
     * 代数记法 -> 下标，格式不合法时返回 empty。
     * 要求恰好两个字符：列字母 a-h（忽略大小写）+ 横线数字 1-8。
     */
    public static Optional<Square> tryParse(String text) {
        if (text == null || text.length() != 2) return Optional.empty();
        char file = Character.toLowerCase(text.charAt(0));
        char rank = text.charAt(1);
        if (file < 'a' || file > 'h') return Optional.empty();
        if (rank < '1' || rank > '8') return Optional.empty();
        return Optional.of(new Square(8 - (rank - '0'), file - 'a'));
    }

    /**
     * 代数记法 -> 下标。
     * @throws IllegalArgumentException 格式不合法
     */
    public static Square parse(String text) {
        return tryParse(text)
                .orElseThrow(() -> new IllegalArgumentException("square must be in algebraic form like 'e2': " + text));
    }

    /** 下标 -> 代数记法（小写），如 (6,4) -> "e2" */
    public String toAlgebraic() {
        return "" + (char) ('a' + col) + (8 - row);
    }

    @Override
    public String toString() {
        return toAlgebraic();
    }
}
