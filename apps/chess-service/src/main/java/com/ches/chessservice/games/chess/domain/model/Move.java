package com.ches.chessservice.games.chess.domain.model;

/**
 * 一步走子请求：把 from 上的棋子走到 to。
 * 只描述意图，不代表已通过校验。
 */
public record Move(Coordinate from, Coordinate to) {

    /** 由两个记谱坐标构造，如 ("e2","e4") */
    public static Move of(String from, String to) {
        return new Move(Coordinate.parse(from), Coordinate.parse(to));
    }

    @Override
    public String toString() {
        return from + "" + to;
    }
}
