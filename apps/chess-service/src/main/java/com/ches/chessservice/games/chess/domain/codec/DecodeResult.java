package com.ches.chessservice.games.chess.domain.codec;

import com.ches.chessservice.games.chess.domain.model.Board;

/**
 * 解码结果：成功时 board 非空，失败时 error 说明原因。
 */
public record DecodeResult(Board board, String error) {

    public static DecodeResult success(Board board) {
        return new DecodeResult(board, null);
    }

    public static DecodeResult failure(String error) {
        return new DecodeResult(null, error);
    }

    public boolean ok() {
        return board != null;
    }
}
