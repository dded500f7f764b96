package com.ches.chessservice.games.chess.domain.rule;

import com.ches.chessservice.games.chess.domain.model.Board;
import com.ches.chessservice.games.chess.domain.model.Coordinate;
import com.ches.chessservice.games.chess.domain.model.Piece;
import com.ches.chessservice.games.chess.domain.model.PieceKind;

import java.util.Optional;

/**
 * 执行一步已通过 {@link MoveValidator} 校验的走法（唯一会修改棋盘与棋子标志的地方）。
 * <p>
 * 执行顺序：
 * <ol>
 *   <li>目标格有敌方棋子则吃掉；</li>
 *   <li>兵斜进到空格：吃掉目标格身后的敌方兵（过路兵）；</li>
 *   <li>清除全盘所有棋子的过路兵标记；</li>
 *   <li>兵前进两格：给它打上过路兵标记；</li>
 *   <li>王横移两格（易位）：把同侧角上的车挪到王经过的那一格，并标记车已动；</li>
 *   <li>把走子挪到目标格，更新坐标并标记已动。</li>
 * </ol>
 * 本类不做合法性判断；需要对外“原子可见”时，调用方应在快照上执行再整体替换棋盘。
 */
public final class MoveApplier {

    private MoveApplier() {}

    /**
     * @param board       要修改的棋盘
     * @param piece       走子，必须是 board 上位于其 position 的那枚棋子
     * @param destination 目标格
     * @return 本步记录
     * @throws IllegalStateException 走子不在棋盘上，或易位时角上没有车
     */
    public static AppliedMove apply(Board board, Piece piece, Coordinate destination) {
        Coordinate from = piece.getPosition();
        if (board.get(from) != piece) {
            throw new IllegalStateException("PIECE_NOT_ON_BOARD: " + from);
        }
        int df = destination.file() - from.file();
        int dr = destination.rank() - from.rank();

        // (a)(b) 吃子 / 过路兵
        PieceKind captured = null;
        boolean enPassant = false;
        Piece target = board.get(destination);
        if (target != null && target.isEnemyOf(piece)) {
            board.remove(destination);
            captured = target.getKind();
        } else if (target == null) {
            Optional<Piece> victim = MoveValidator.enPassantVictim(board, piece, destination);
            if (victim.isPresent()) {
                board.remove(victim.get().getPosition());
                captured = PieceKind.PAWN;
                enPassant = true;
            }
        }

        // (c) 过路兵标记只保留一手
        for (Piece p : board.pieces()) {
            p.setEnPassantTarget(false);
        }

        // (d)
        if (piece.getKind() == PieceKind.PAWN && Math.abs(dr) == 2) {
            piece.setEnPassantTarget(true);
        }

        // (e) 易位：车落在王经过的那一格
        boolean castled = false;
        if (piece.getKind() == PieceKind.KING && dr == 0 && Math.abs(df) == 2) {
            int step = Integer.signum(df);
            Coordinate corner = Coordinate.of(step > 0 ? Board.SIZE - 1 : 0, from.rank());
            Piece rook = board.get(corner);
            if (rook == null || rook.getKind() != PieceKind.ROOK) {
                throw new IllegalStateException("CASTLING_ROOK_MISSING: " + corner);
            }
            board.relocate(rook, destination.offset(-step, 0));
            rook.setNotMoved(false);
            castled = true;
        }

        // (f)
        board.relocate(piece, destination);
        piece.setNotMoved(false);

        return new AppliedMove(from, destination, piece.getKind(), piece.getColor(), captured, castled, enPassant);
    }
}
