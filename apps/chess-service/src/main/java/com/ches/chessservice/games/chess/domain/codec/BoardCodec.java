package com.ches.chessservice.games.chess.domain.codec;

import com.ches.chessservice.games.chess.domain.model.Board;
import com.ches.chessservice.games.chess.domain.model.Coordinate;
import com.ches.chessservice.games.chess.domain.model.Piece;
import com.ches.chessservice.games.chess.domain.model.PieceColor;
import com.ches.chessservice.games.chess.domain.model.PieceKind;

/**
 * 棋盘紧凑字符串编解码（用于 WS 广播与 Redis 快照）。
 * <p>
 * 每枚棋子一条 6 字符记录，记录之间没有分隔符：
 * <pre>
 *   [0] 种类  p n b r q k（恒为小写）
 *   [1] 颜色  '0'=LIGHT  '1'=DARK
 *   [2] file  'a'..'h'
 *   [3] rank  '1'..'8'
 *   [4] 过路兵目标  '0'/'1'
 *   [5] 未动过      '0'/'1'
 * </pre>
 * 例：标准开局的 a1 车编码为 {@code r0a101}。
 * 编码按 file 外层、rank 内层遍历，只输出有子的格；解码不依赖顺序，坐标以记录为准。
 */
public final class BoardCodec {

    /** 单条记录长度 */
    public static final int RECORD_LENGTH = 6;

    private BoardCodec() {}

    public static String encode(Board board) {
        StringBuilder sb = new StringBuilder(32 * RECORD_LENGTH);
        for (int f = 0; f < Board.SIZE; f++) {
            for (int r = 0; r < Board.SIZE; r++) {
                Piece p = board.get(f, r);
                if (p == null) continue;
                sb.append(p.getKind().letter())
                  .append(p.getColor().code())
                  .append(p.getPosition().toNotation())
                  .append(p.isEnPassantTarget() ? '1' : '0')
                  .append(p.isNotMoved() ? '1' : '0');
            }
        }
        return sb.toString();
    }

    /**
     * 解码为一张新棋盘。空串得到空棋盘。
     * @throws BoardDecodeException 长度或任一字段非法，或两条记录落在同一格
     */
    public static Board decode(String encoded) {
        if (encoded == null) {
            throw new BoardDecodeException(-1, "BOARD_NULL");
        }
        if (encoded.length() % RECORD_LENGTH != 0) {
            throw new BoardDecodeException(-1,
                    "BAD_LENGTH: " + encoded.length() + " is not a multiple of " + RECORD_LENGTH);
        }
        Board board = Board.empty();
        int count = encoded.length() / RECORD_LENGTH;
        for (int i = 0; i < count; i++) {
            String rec = encoded.substring(i * RECORD_LENGTH, (i + 1) * RECORD_LENGTH);
            Piece piece = decodeRecord(i, rec);
            if (!board.isEmpty(piece.getPosition())) {
                throw new BoardDecodeException(i, "DUPLICATE_SQUARE: " + piece.getPosition() + " in record " + i);
            }
            board.place(piece);
        }
        return board;
    }

    /** 与 {@link #decode(String)} 相同，但以结果值代替异常 */
    public static DecodeResult tryDecode(String encoded) {
        try {
            return DecodeResult.success(decode(encoded));
        } catch (BoardDecodeException e) {
            return DecodeResult.failure(e.getMessage());
        }
    }

    // ----------- private helpers -----------

    private static Piece decodeRecord(int index, String rec) {
        PieceKind kind = PieceKind.ofLetter(rec.charAt(0));
        if (kind == null) {
            throw fieldError(index, "kind", rec.charAt(0));
        }
        PieceColor color = PieceColor.ofCode(rec.charAt(1));
        if (color == null) {
            throw fieldError(index, "color", rec.charAt(1));
        }
        int file = rec.charAt(2) - 'a';
        if (file < 0 || file >= Board.SIZE) {
            throw fieldError(index, "file", rec.charAt(2));
        }
        int rank = rec.charAt(3) - '1';
        if (rank < 0 || rank >= Board.SIZE) {
            throw fieldError(index, "rank", rec.charAt(3));
        }
        boolean enPassant = flag(index, "enPassant", rec.charAt(4));
        boolean notMoved = flag(index, "notMoved", rec.charAt(5));
        return new Piece(kind, color, Coordinate.of(file, rank), notMoved, enPassant);
    }

    private static boolean flag(int index, String field, char c) {
        if (c == '0') return false;
        if (c == '1') return true;
        throw fieldError(index, field, c);
    }

    private static BoardDecodeException fieldError(int index, String field, char c) {
        return new BoardDecodeException(index, "BAD_" + field.toUpperCase() + ": '" + c + "' in record " + index);
    }
}
