package com.ches.chessservice.games.chess.infrastructure.redis;

/**
 * 统一集中管理 Redis Key 的前缀与拼接，避免字符串散落。
 */
public final class RedisKeys {

    private static final String PFX = "chess:";

    private RedisKeys() {}

    // ---- 房间权威棋盘 ----
    public static String boardState(String roomId) {
        return PFX + "room:" + roomId + ":state";
    }
}
