package com.ches.chessservice.games.chess.domain.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 国际象棋棋盘：8x8 格子，按 [file][rank] 存放，每格至多一枚棋子（null 表示空格）。
 * 约定：rank 0 是 LIGHT 的底线，rank 7 是 DARK 的底线。
 *
 * 棋盘本身不记录轮到谁走，轮次由会话层（ChessState）负责。
 * 本类只做存取，不做走法合法性校验，规则放在 rule 包。
 */
public class Board {
    /** 棋盘边长 */
    public static final int SIZE = Coordinate.SIZE;

    /** 底线棋子顺序：车、马、象、后、王、象、马、车 */
    private static final PieceKind[] BACK_RANK = {
            PieceKind.ROOK, PieceKind.KNIGHT, PieceKind.BISHOP, PieceKind.QUEEN,
            PieceKind.KING, PieceKind.BISHOP, PieceKind.KNIGHT, PieceKind.ROOK
    };

    private final Piece[][] grid = new Piece[SIZE][SIZE];

    private Board() {
    }

    /** 空棋盘 */
    public static Board empty() {
        return new Board();
    }

    /** 标准开局：32 枚棋子，兵在第 1/6 行，其余在第 0/7 行 */
    public static Board standardSetup() {
        Board b = new Board();
        for (int file = 0; file < SIZE; file++) {
            b.place(new Piece(BACK_RANK[file], PieceColor.LIGHT, Coordinate.of(file, 0)));
            b.place(new Piece(PieceKind.PAWN, PieceColor.LIGHT, Coordinate.of(file, 1)));
            b.place(new Piece(PieceKind.PAWN, PieceColor.DARK, Coordinate.of(file, 6)));
            b.place(new Piece(BACK_RANK[file], PieceColor.DARK, Coordinate.of(file, 7)));
        }
        return b;
    }

    /**
     * 深拷贝棋盘（供走法推演使用）。
     * 副本里每枚棋子都是新对象，对副本的任何修改都不会影响原棋盘。
     */
    public Board snapshot() {
        Board b = new Board();
        for (int f = 0; f < SIZE; f++) {
            for (int r = 0; r < SIZE; r++) {
                Piece p = grid[f][r];
                if (p != null) b.grid[f][r] = p.copy();
            }
        }
        return b;
    }

    /** 是否在棋盘内 */
    public static boolean inBounds(int file, int rank) {
        return file >= 0 && file < SIZE && rank >= 0 && rank < SIZE;
    }

    /** 读取该格的棋子（不修改棋盘）；越界或空格返回 empty */
    public Optional<Piece> occupantAt(Coordinate c) {
        return Optional.ofNullable(get(c));
    }

    /** 读取该格的棋子，越界或空格返回 null（规则层内部使用） */
    public Piece get(Coordinate c) {
        return get(c.file(), c.rank());
    }

    public Piece get(int file, int rank) {
        return inBounds(file, rank) ? grid[file][rank] : null;
    }

    /** 该格是否为空（越界视为非空，避免推演走出棋盘） */
    public boolean isEmpty(Coordinate c) {
        return c.onBoard() && grid[c.file()][c.rank()] == null;
    }

    /**
     * 把棋子放到它自身记录的位置上。
     * @throws IllegalStateException 目标格越界或已有棋子
     */
    public void place(Piece piece) {
        Coordinate c = piece.getPosition();
        if (!c.onBoard()) {
            throw new IllegalStateException("OFF_BOARD: " + c);
        }
        if (grid[c.file()][c.rank()] != null) {
            throw new IllegalStateException("SQUARE_OCCUPIED: " + c);
        }
        grid[c.file()][c.rank()] = piece;
    }

    /** 移除并返回该格的棋子；空格返回 null */
    public Piece remove(Coordinate c) {
        if (!c.onBoard()) return null;
        Piece p = grid[c.file()][c.rank()];
        grid[c.file()][c.rank()] = null;
        return p;
    }

    /**
     * 把棋子从当前格转移到 to（所有权转移，不复制），并更新其坐标。
     * 不处理吃子：调用方需保证 to 已经腾空。
     */
    public void relocate(Piece piece, Coordinate to) {
        Coordinate from = piece.getPosition();
        if (grid[from.file()][from.rank()] != piece) {
            throw new IllegalStateException("PIECE_NOT_ON_BOARD: " + from);
        }
        grid[from.file()][from.rank()] = null;
        piece.setPosition(to);
        place(piece);
    }

    /** 按 file 外层、rank 内层的顺序列出所有棋子 */
    public List<Piece> pieces() {
        List<Piece> out = new ArrayList<>();
        for (int f = 0; f < SIZE; f++) {
            for (int r = 0; r < SIZE; r++) {
                if (grid[f][r] != null) out.add(grid[f][r]);
            }
        }
        return out;
    }

    /** 查找该方的王；找不到返回 empty */
    public Optional<Piece> findKing(PieceColor color) {
        for (Piece p : pieces()) {
            if (p.is(PieceKind.KING, color)) return Optional.of(p);
        }
        return Optional.empty();
    }

    /**
     * from 与 to 之间（不含两端）的格子是否全空。
     * 仅对同行、同列或同斜线的两点有意义；遇到第一个棋子立即返回 false。
     */
    public boolean isPathClear(Coordinate from, Coordinate to) {
        int df = Integer.signum(to.file() - from.file());
        int dr = Integer.signum(to.rank() - from.rank());
        int f = from.file() + df;
        int r = from.rank() + dr;
        while (f != to.file() || r != to.rank()) {
            if (!inBounds(f, r) || grid[f][r] != null) return false;
            f += df;
            r += dr;
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        return Arrays.deepEquals(grid, other.grid);
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(grid);
    }

    /** 文本棋盘（rank 7 在上），大写为 LIGHT，小写为 DARK，'.' 为空格；用于日志排查 */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(SIZE * (SIZE + 1));
        for (int r = SIZE - 1; r >= 0; r--) {
            for (int f = 0; f < SIZE; f++) {
                Piece p = grid[f][r];
                if (p == null) {
                    sb.append('.');
                } else {
                    char c = p.getKind().letter();
                    sb.append(p.getColor() == PieceColor.LIGHT ? Character.toUpperCase(c) : c);
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
