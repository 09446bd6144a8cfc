package com.chessbackend.chessservice.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;

/**
 * 一枚棋子：种类 + 颜色。
 * 不可变值对象，走子时按值搬运；兵升变后换成一个新的 Piece。
 */
public record Piece(PieceType type, PieceColor color) {

    public Piece {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(color, "color");
    }

    public static Piece of(PieceType type, PieceColor color) {
        return new Piece(type, color);
    }

    public static Piece white(PieceType type) { return new Piece(type, PieceColor.WHITE); }

    public static Piece black(PieceType type) { return new Piece(type, PieceColor.BLACK); }

    @JsonIgnore
    public boolean isPawn() { return type == PieceType.PAWN; }

    /** 例如 “白方后” */
    @JsonIgnore
    public String displayName() {
        return color.displayName() + type.displayName();
    }
}
