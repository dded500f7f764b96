package com.ches.chessservice.games.chess.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 棋盘上的一枚棋子。
 * - notMoved：开局为 true，第一次被 MoveApplier 挪动后永久为 false（易位时的车也算）；
 * - enPassantTarget：仅在兵完成首步两格前进后为 true，下一步任意一方走子时清除。
 *
 * 两个标志只允许 MoveApplier 与解码器修改，规则层只读。
 */
@Data
@AllArgsConstructor
public class Piece {
    private final PieceKind kind;
    private final PieceColor color;
    private Coordinate position;
    private boolean notMoved;
    private boolean enPassantTarget;

    /** 新建一枚未动过、非过路兵目标的棋子 */
    public Piece(PieceKind kind, PieceColor color, Coordinate position) {
        this(kind, color, position, true, false);
    }

    /** 深拷贝（Coordinate 是不可变 record，引用即可） */
    public Piece copy() {
        return new Piece(kind, color, position, notMoved, enPassantTarget);
    }

    public boolean isEnemyOf(Piece other) {
        return other != null && other.color != color;
    }

    public boolean is(PieceKind k, PieceColor c) {
        return kind == k && color == c;
    }
}
