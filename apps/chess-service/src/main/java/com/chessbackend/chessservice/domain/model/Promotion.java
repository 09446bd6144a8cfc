package com.chessbackend.chessservice.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * 兵升变的目标：q / r / b / n（输入不区分大小写）。
 * 未指定时默认升变为后。
 */
public enum Promotion {
    QUEEN("q", PieceType.QUEEN),
    ROOK("r", PieceType.ROOK),
    BISHOP("b", PieceType.BISHOP),
    KNIGHT("n", PieceType.KNIGHT);

    public static final Promotion DEFAULT = QUEEN;

    private final String code;
    private final PieceType pieceType;

    Promotion(String code, PieceType pieceType) {
        this.code = code;
        this.pieceType = pieceType;
    }

    @JsonValue
    public String code() { return code; }

    public PieceType pieceType() { return pieceType; }

    /**
     * 按编码解析，编码必须恰好是 q/r/b/n 之一（忽略大小写）。
     * @return 无法识别时返回 empty
     */
    public static Optional<Promotion> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (Promotion p : values()) {
            if (p.code.equals(c)) return Optional.of(p);
        }
        return Optional.empty();
    }
}
