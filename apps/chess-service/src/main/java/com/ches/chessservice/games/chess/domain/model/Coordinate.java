package com.ches.chessservice.games.chess.domain.model;

/**
 * 棋盘坐标 (file, rank)。
 * 合法棋盘范围是 [0,7]x[0,7]，但本类型允许越界值存在，
 * 以便规则层对“目标格越界”给出明确的否定结果而不是抛异常。
 *
 * 记谱形式："a1".."h8"，file 对应 'a'+file，rank 对应 rank+1。
 */
public record Coordinate(int file, int rank) {

    public static final int SIZE = 8;

    public static Coordinate of(int file, int rank) {
        return new Coordinate(file, rank);
    }

    /**
     * 解析两字符记谱坐标，如 "e2"。
     * @throws IllegalArgumentException 格式不对或越界
     */
    public static Coordinate parse(String notation) {
        if (notation == null || notation.length() != 2) {
            throw new IllegalArgumentException("BAD_COORDINATE: " + notation);
        }
        int file = notation.charAt(0) - 'a';
        int rank = notation.charAt(1) - '1';
        Coordinate c = new Coordinate(file, rank);
        if (!c.onBoard()) {
            throw new IllegalArgumentException("BAD_COORDINATE: " + notation);
        }
        return c;
    }

    /** 是否落在 8x8 棋盘内 */
    public boolean onBoard() {
        return file >= 0 && file < SIZE && rank >= 0 && rank < SIZE;
    }

    public Coordinate offset(int df, int dr) {
        return new Coordinate(file + df, rank + dr);
    }

    /** 转成记谱形式；越界坐标没有记谱形式 */
    public String toNotation() {
        if (!onBoard()) {
            throw new IllegalStateException("OFF_BOARD: " + file + "," + rank);
        }
        return "" + (char) ('a' + file) + (char) ('1' + rank);
    }

    @Override
    public String toString() {
        return onBoard() ? toNotation() : "(" + file + "," + rank + ")";
    }
}
