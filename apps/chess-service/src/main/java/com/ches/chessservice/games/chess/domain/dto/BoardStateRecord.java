package com.ches.chessservice.games.chess.domain.dto;

import lombok.Data;

/**
 * BoardStateRecord
 * -------------------------------------------------------
 * 房间权威棋盘的持久化快照（存 Redis）。
 * - board 为 BoardCodec 的紧凑编码（每子 6 字符）；
 * - 服务重启或房间被换出内存后据此恢复。
 * -------------------------------------------------------
 */
@Data
public class BoardStateRecord {
    /** 房间ID（冗余保存） */
    private String roomId;
    /** 棋盘紧凑编码 */
    private String board;
    /** 轮到哪方："LIGHT"/"DARK" */
    private String sideToMove;
    /** 上一步，形如 "e2e4"；reset/set 之后为 null */
    private String lastMove;
    /** 步号/版本号 */
    private Integer step;
    /** 最后写入时间（epoch millis） */
    private long updatedAt;
}
