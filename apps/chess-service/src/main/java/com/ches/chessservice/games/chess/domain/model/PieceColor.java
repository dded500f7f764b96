package com.ches.chessservice.games.chess.domain.model;

/**
 * 执子方。
 * LIGHT 开局占第 0、1 行并朝 rank 增大的方向前进；DARK 占第 6、7 行并朝 rank 减小的方向前进。
 */
public enum PieceColor {
    /** 浅色方（编码 '0'） */
    LIGHT('0', 1),
    /** 深色方（编码 '1'） */
    DARK('1', -1);

    private final char code;
    private final int forward;

    PieceColor(char code, int forward) {
        this.code = code;
        this.forward = forward;
    }

    /** 棋盘编码中的颜色位 */
    public char code() {
        return code;
    }

    /** 兵“前进”时 rank 的增量：LIGHT=+1，DARK=-1 */
    public int forward() {
        return forward;
    }

    public PieceColor opposite() {
        return this == LIGHT ? DARK : LIGHT;
    }

    /** 按编码位还原颜色；无法识别时返回 null，由调用方决定如何报错 */
    public static PieceColor ofCode(char c) {
        for (PieceColor color : values()) {
            if (color.code == c) return color;
        }
        return null;
    }
}
