package com.ches.chessservice.games.chess.domain.rule;

import com.ches.chessservice.games.chess.domain.model.Board;
import com.ches.chessservice.games.chess.domain.model.Coordinate;
import com.ches.chessservice.games.chess.domain.model.Piece;
import com.ches.chessservice.games.chess.domain.model.PieceColor;

import java.util.Optional;

/**
 * 将军判定。
 * 纯函数：只读棋盘，不做任何修改，可对任意棋盘（包括推演用的快照）反复调用。
 */
public final class CheckDetector {

    private CheckDetector() {}

    /**
     * 该方的王当前是否被对方任意一枚棋子攻击。
     * 棋盘上没有该方的王时按“未被将军”处理。
     */
    public static boolean isInCheck(Board board, PieceColor color) {
        Optional<Piece> king = board.findKing(color);
        if (king.isEmpty()) return false;
        Coordinate target = king.get().getPosition();
        for (Piece p : board.pieces()) {
            if (p.getColor() != color && attacks(board, p, target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 棋子 attacker 是否攻击 target 格（只看攻击形状与遮挡，不关心 target 上是谁）。
     */
    public static boolean attacks(Board board, Piece attacker, Coordinate target) {
        Coordinate from = attacker.getPosition();
        int df = target.file() - from.file();
        int dr = target.rank() - from.rank();
        int adf = Math.abs(df);
        int adr = Math.abs(dr);
        switch (attacker.getKind()) {
            case PAWN:
                // 兵只攻击斜前方一格
                return adf == 1 && dr == attacker.getColor().forward();
            case KNIGHT:
                return (adf == 1 && adr == 2) || (adf == 2 && adr == 1);
            case BISHOP:
                return diagonal(adf, adr) && board.isPathClear(from, target);
            case ROOK:
                return straight(df, dr) && board.isPathClear(from, target);
            case QUEEN:
                return (diagonal(adf, adr) || straight(df, dr)) && board.isPathClear(from, target);
            case KING:
                return adf <= 1 && adr <= 1 && (adf + adr) > 0;
            default:
                return false;
        }
    }

    // ----------- private helpers -----------

    static boolean diagonal(int adf, int adr) {
        return adf == adr && adf > 0;
    }

    static boolean straight(int df, int dr) {
        return (df == 0) != (dr == 0);
    }
}
