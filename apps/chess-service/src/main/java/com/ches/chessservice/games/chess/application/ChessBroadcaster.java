package com.ches.chessservice.games.chess.application;

import com.ches.chessservice.games.chess.domain.model.Coordinate;
import com.ches.chessservice.games.chess.domain.rule.IllegalReason;
import com.ches.chessservice.games.chess.interfaces.ws.dto.ChessMessages.BroadcastEvent;
import com.ches.chessservice.games.chess.interfaces.ws.dto.ChessMessages.RejectedPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import static com.ches.chessservice.games.chess.interfaces.ws.dto.ChessMessages.ERROR;
import static com.ches.chessservice.games.chess.interfaces.ws.dto.ChessMessages.REJECTED;
import static com.ches.chessservice.games.chess.interfaces.ws.dto.ChessMessages.SET;

/**
 * ChessBroadcaster
 * -------------------------------------------------
 * 房间广播（应用编排层）：把会话层的结果转成 /topic/room.{roomId} 上的事件。
 *
 * SET 与 REJECTED 由 ChessService 在房间锁内调用，
 * 因此同一房间的广播顺序与棋盘提交顺序一致；
 * ERROR 只针对请求本身（坐标写错等），由控制器直接调用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChessBroadcaster {

    // WebSocket 消息模板（推送到房间）
    private final SimpMessagingTemplate messaging;

    /** 非法走子是否广播 REJECTED（关闭后静默丢弃） */
    @Value("${chess.session.notify-rejections:true}")
    private boolean notifyRejections = true;

    /** 整盘同步事件 */
    public void boardSet(String roomId, String encoded) {
        messaging.convertAndSend(topic(roomId), new BroadcastEvent(roomId, SET, encoded));
    }

    /** 走子被拒绝：附带当前权威棋盘，发起方据此回滚 */
    public void moveRejected(String roomId, Coordinate from, Coordinate to, IllegalReason reason, String state) {
        if (!notifyRejections) return;
        RejectedPayload payload = new RejectedPayload(from.toNotation(), to.toNotation(), reason.name(), state);
        messaging.convertAndSend(topic(roomId), new BroadcastEvent(roomId, REJECTED, payload));
    }

    /** 请求错误；没有房间号时无处可发，只记日志 */
    public void error(String roomId, String msg) {
        if (roomId == null || roomId.isBlank()) {
            log.warn("无房间号的请求出错，无法广播: {}", msg);
            return;
        }
        messaging.convertAndSend(topic(roomId), new BroadcastEvent(roomId, ERROR, msg));
    }

    /** 拼接广播路径（示例：/topic/room.1234） */
    private String topic(String roomId) {
        return "/topic/room." + roomId;
    }
}
