package com.ches.chessservice.games.chess.interfaces.ws.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 * 前端 -> 后端：/app/chess.move、/app/chess.reset、/app/chess.sync
 * 后端 -> 前端：/topic/room.{roomId}，统一为 BroadcastEvent
 */
public class ChessMessages {

    /** 广播事件类型：整盘同步 */
    public static final String SET = "SET";
    /** 广播事件类型：走子被拒绝 */
    public static final String REJECTED = "REJECTED";
    /** 广播事件类型：请求本身有误（坐标写错、房间不存在等） */
    public static final String ERROR = "ERROR";

    /**
     * 走子命令（客户端 → 服务端）
     * 字段：
     *   - roomId：房间编号；
     *   - from/to：记谱坐标，如 "e2" / "e4"。
     */
    @Data
    public static class MoveCmd {
        private String roomId;
        private String from;
        private String to;
    }

    /**
     * 简单命令（客户端 → 服务端），用于 reset / sync 等无额外参数的操作。
     */
    @Data
    public static class SimpleCmd {
        private String roomId;
    }

    /**
     * 广播事件（服务端 → 客户端）
     * 字段：
     *   - type：SET / REJECTED / ERROR；
     *   - payload：SET 时为棋盘编码串，REJECTED 时为 RejectedPayload，ERROR 时为错误信息。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BroadcastEvent {
        private String roomId;
        private String type;
        private Object payload;
    }

    /**
     * 拒绝通知载荷：附带当前权威棋盘，发起方据此回滚本地临时走法。
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RejectedPayload {
        private String from;
        private String to;
        private String reason;
        private String state;
    }
}
