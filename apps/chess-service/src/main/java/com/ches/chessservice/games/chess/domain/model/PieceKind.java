package com.ches.chessservice.games.chess.domain.model;

/**
 * 棋子种类，每种带一个小写编码字母（p/n/b/r/q/k）。
 */
public enum PieceKind {
    PAWN('p'),
    KNIGHT('n'),
    BISHOP('b'),
    ROOK('r'),
    QUEEN('q'),
    KING('k');

    private final char letter;

    PieceKind(char letter) {
        this.letter = letter;
    }

    public char letter() {
        return letter;
    }

    /**
     * 按编码字母还原种类（只认小写）。
     * @return 对应种类；字母不在 p/n/b/r/q/k 之内时返回 null
     */
    public static PieceKind ofLetter(char c) {
        for (PieceKind kind : values()) {
            if (kind.letter == c) return kind;
        }
        return null;
    }
}
