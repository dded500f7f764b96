package com.ches.chessservice.games.chess.domain.rule;

/** 走法被判为不合法的原因 */
public enum IllegalReason {
    /** 棋子不在给定棋盘上（与该格实际棋子不一致） */
    PIECE_NOT_ON_BOARD,
    /** 目标格超出 [0,7] */
    OUT_OF_BOUNDS,
    /** 目标格就是起点 */
    NO_MOVEMENT,
    /** 目标格有己方棋子 */
    SELF_CAPTURE,
    /** 走完后己方王被将 */
    LEAVES_KING_IN_CHECK,
    /** 不符合该棋子的走法 */
    ILLEGAL_PATTERN,
    /** 路径被挡（滑行棋子中间有子，或兵前方有子） */
    PATH_BLOCKED,
    /** 王车易位条件不满足 */
    CASTLING_NOT_ALLOWED,
    /** 未轮到该方（仅在会话开启轮次校验时出现） */
    NOT_YOUR_TURN
}
