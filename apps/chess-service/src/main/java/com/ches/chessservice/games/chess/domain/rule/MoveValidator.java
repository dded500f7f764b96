package com.ches.chessservice.games.chess.domain.rule;

import com.ches.chessservice.games.chess.domain.model.Board;
import com.ches.chessservice.games.chess.domain.model.Coordinate;
import com.ches.chessservice.games.chess.domain.model.Piece;
import com.ches.chessservice.games.chess.domain.model.PieceColor;
import com.ches.chessservice.games.chess.domain.model.PieceKind;

import java.util.Optional;

/**
 * 走法合法性校验（核心规则）。
 * 只包含纯判断逻辑：不修改传入的棋盘，推演一律在 {@link Board#snapshot()} 上进行。
 * <p>
 * 校验顺序（遇到第一条失败即返回）：
 * <ol>
 *   <li>目标格在 [0,7] 范围内；</li>
 *   <li>目标格不是起点；</li>
 *   <li>目标格没有己方棋子；</li>
 *   <li>推演：走完之后己方王不被将军（先于走法形状判断）；</li>
 *   <li>按棋子种类判断走法形状，滑行棋子要求中间格全空。</li>
 * </ol>
 */
public final class MoveValidator {

    private MoveValidator() {}

    /** 布尔版本，等价于 {@code check(...).legal()} */
    public static boolean isMoveLegal(Board board, Piece piece, Coordinate destination) {
        return check(board, piece, destination).legal();
    }

    public static LegalityResult check(Board board, Piece piece, Coordinate destination) {
        Coordinate from = piece.getPosition();
        Piece onBoard = board.get(from);
        if (onBoard == null || onBoard.getKind() != piece.getKind() || onBoard.getColor() != piece.getColor()) {
            return LegalityResult.illegal(IllegalReason.PIECE_NOT_ON_BOARD);
        }
        if (!destination.onBoard()) {
            return LegalityResult.illegal(IllegalReason.OUT_OF_BOUNDS);
        }
        if (destination.equals(from)) {
            return LegalityResult.illegal(IllegalReason.NO_MOVEMENT);
        }
        Piece target = board.get(destination);
        if (target != null && target.getColor() == piece.getColor()) {
            return LegalityResult.illegal(IllegalReason.SELF_CAPTURE);
        }
        if (exposesKing(board, onBoard, destination)) {
            return LegalityResult.illegal(IllegalReason.LEAVES_KING_IN_CHECK);
        }
        return switch (piece.getKind()) {
            case PAWN -> pawn(board, onBoard, destination);
            case KNIGHT -> knight(from, destination);
            case BISHOP, ROOK, QUEEN -> slider(board, onBoard, destination);
            case KING -> king(board, onBoard, destination);
        };
    }

    /**
     * 过路兵：兵斜进一格到空格时，被吃的敌方兵（位于目标格“身后”一格且带过路兵标记）。
     * 不满足过路兵条件时返回 empty。
     */
    public static Optional<Piece> enPassantVictim(Board board, Piece pawn, Coordinate destination) {
        if (pawn.getKind() != PieceKind.PAWN || !destination.onBoard() || !board.isEmpty(destination)) {
            return Optional.empty();
        }
        int dir = pawn.getColor().forward();
        Coordinate from = pawn.getPosition();
        if (Math.abs(destination.file() - from.file()) != 1 || destination.rank() - from.rank() != dir) {
            return Optional.empty();
        }
        Piece behind = board.get(destination.offset(0, -dir));
        if (behind != null && behind.getKind() == PieceKind.PAWN
                && behind.isEnemyOf(pawn) && behind.isEnPassantTarget()) {
            return Optional.of(behind);
        }
        return Optional.empty();
    }

    /**
     * 推演：在快照上把棋子从原位拿起放到 destination（目标格原有棋子视为被吃），再看己方王是否被将。
     * 过路兵吃掉的兵也从快照上拿走，同一横线上被两枚兵挡住的牵制因此能被识别。
     */
    static boolean exposesKing(Board board, Piece piece, Coordinate destination) {
        Board what = board.snapshot();
        Piece moving = what.get(piece.getPosition());
        enPassantVictim(what, moving, destination).ifPresent(v -> what.remove(v.getPosition()));
        what.remove(destination);
        what.relocate(moving, destination);
        return CheckDetector.isInCheck(what, piece.getColor());
    }

    // ----------- 按棋子种类 -----------

    private static LegalityResult pawn(Board board, Piece pawn, Coordinate to) {
        Coordinate from = pawn.getPosition();
        int dir = pawn.getColor().forward();
        int df = to.file() - from.file();
        int dr = to.rank() - from.rank();

        if (df == 0 && dr == dir) {
            return board.isEmpty(to) ? LegalityResult.legalMove() : LegalityResult.illegal(IllegalReason.PATH_BLOCKED);
        }
        if (df == 0 && dr == 2 * dir) {
            if (!pawn.isNotMoved()) return LegalityResult.illegal(IllegalReason.ILLEGAL_PATTERN);
            boolean clear = board.isEmpty(from.offset(0, dir)) && board.isEmpty(to);
            return clear ? LegalityResult.legalMove() : LegalityResult.illegal(IllegalReason.PATH_BLOCKED);
        }
        if (Math.abs(df) == 1 && dr == dir) {
            Piece target = board.get(to);
            if (target != null && target.isEnemyOf(pawn)) return LegalityResult.legalMove();
            if (enPassantVictim(board, pawn, to).isPresent()) return LegalityResult.legalMove();
        }
        return LegalityResult.illegal(IllegalReason.ILLEGAL_PATTERN);
    }

    private static LegalityResult knight(Coordinate from, Coordinate to) {
        int adf = Math.abs(to.file() - from.file());
        int adr = Math.abs(to.rank() - from.rank());
        boolean ok = (adf == 1 && adr == 2) || (adf == 2 && adr == 1);
        return ok ? LegalityResult.legalMove() : LegalityResult.illegal(IllegalReason.ILLEGAL_PATTERN);
    }

    /** 象/车/后：先判形状，再判中间格 */
    private static LegalityResult slider(Board board, Piece piece, Coordinate to) {
        Coordinate from = piece.getPosition();
        int df = to.file() - from.file();
        int dr = to.rank() - from.rank();
        boolean diag = CheckDetector.diagonal(Math.abs(df), Math.abs(dr));
        boolean line = CheckDetector.straight(df, dr);
        boolean shape = switch (piece.getKind()) {
            case BISHOP -> diag;
            case ROOK -> line;
            default -> diag || line;
        };
        if (!shape) return LegalityResult.illegal(IllegalReason.ILLEGAL_PATTERN);
        return board.isPathClear(from, to) ? LegalityResult.legalMove() : LegalityResult.illegal(IllegalReason.PATH_BLOCKED);
    }

    private static LegalityResult king(Board board, Piece king, Coordinate to) {
        Coordinate from = king.getPosition();
        int df = to.file() - from.file();
        int dr = to.rank() - from.rank();
        if (Math.abs(df) <= 1 && Math.abs(dr) <= 1) {
            return LegalityResult.legalMove();
        }
        if (dr == 0 && Math.abs(df) == 2) {
            return canCastle(board, king, to) ? LegalityResult.legalMove() : LegalityResult.illegal(IllegalReason.CASTLING_NOT_ALLOWED);
        }
        return LegalityResult.illegal(IllegalReason.ILLEGAL_PATTERN);
    }

    /**
     * 王车易位：王未动过；同侧角上是同色未动过的车（长易位 file 0，短易位 file 7）；
     * 王车之间全空；王经过的格子不受攻击（目标格已由推演规则覆盖）。
     * 王当前是否被将不在条件之内。
     */
    private static boolean canCastle(Board board, Piece king, Coordinate to) {
        if (!king.isNotMoved()) return false;
        Coordinate from = king.getPosition();
        int step = Integer.signum(to.file() - from.file());
        PieceColor color = king.getColor();

        Coordinate corner = Coordinate.of(step > 0 ? Board.SIZE - 1 : 0, from.rank());
        Piece rook = board.get(corner);
        if (rook == null || !rook.is(PieceKind.ROOK, color) || !rook.isNotMoved()) return false;
        if (!board.isPathClear(from, corner)) return false;

        Coordinate passThrough = from.offset(step, 0);
        return !exposesKing(board, king, passThrough);
    }
}
