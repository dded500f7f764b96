package com.ches.chessservice.games.chess.domain.rule;

import com.ches.chessservice.games.chess.domain.model.Coordinate;
import com.ches.chessservice.games.chess.domain.model.PieceColor;
import com.ches.chessservice.games.chess.domain.model.PieceKind;

/**
 * 一步已执行走法的记录（供日志、快照 lastMove 使用）。
 * @param captured 被吃掉的棋子种类；未吃子为 null
 */
public record AppliedMove(Coordinate from,
                          Coordinate to,
                          PieceKind kind,
                          PieceColor color,
                          PieceKind captured,
                          boolean castled,
                          boolean enPassant) {

    /** 紧凑形式，如 "e2e4" */
    public String notation() {
        return from.toNotation() + to.toNotation();
    }
}
