package com.chessbackend.chessservice.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 执子方：白方先行。
 * 约定：白兵朝 row 0（第 8 横线）方向前进，黑兵朝 row 7（第 1 横线）方向前进。
 */
public enum PieceColor {
    WHITE("white", "白方", -1, 6),
    BLACK("black", "黑方", 1, 1);

    private final String code;
    private final String displayName;
    /** 兵的前进方向（行号增量） */
    private final int pawnDirection;
    /** 兵的初始行（可走两格的起点） */
    private final int pawnStartRow;

    PieceColor(String code, String displayName, int pawnDirection, int pawnStartRow) {
        this.code = code;
        this.displayName = displayName;
        this.pawnDirection = pawnDirection;
        this.pawnStartRow = pawnStartRow;
    }

    /** 序列化给前端的小写编码：white / black */
    @JsonValue
    public String code() { return code; }

    public String displayName() { return displayName; }

    public int pawnDirection() { return pawnDirection; }

    public int pawnStartRow() { return pawnStartRow; }

    /** 对方 */
    public PieceColor opposite() {
        return this == WHITE ? BLACK : WHITE;
    }
}
