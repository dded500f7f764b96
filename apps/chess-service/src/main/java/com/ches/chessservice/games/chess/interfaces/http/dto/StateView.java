package com.ches.chessservice.games.chess.interfaces.http.dto;

import com.ches.chessservice.games.chess.domain.model.ChessState;

/**
 * 房间状态的只读视图（HTTP 输出）。
 * @param board    棋盘紧凑编码
 * @param lastMove 上一步，如 "e2e4"；没有则为 null
 */
public record StateView(String roomId, String board, int step, String sideToMove, String lastMove) {

    public static StateView of(ChessState s) {
        return new StateView(s.roomId(), s.encoded(), s.step(), s.sideToMove().name(),
                s.lastMove() == null ? null : s.lastMove().notation());
    }
}
