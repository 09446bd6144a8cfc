package com.chessbackend.chessservice.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** 棋子种类（国际象棋六种） */
public enum PieceType {
    PAWN("pawn", "兵"),
    ROOK("rook", "车"),
    KNIGHT("knight", "马"),
    BISHOP("bishop", "象"),
    QUEEN("queen", "后"),
    KING("king", "王");

    private final String code;
    private final String displayName;

    PieceType(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String code() { return code; }

    public String displayName() { return displayName; }
}
