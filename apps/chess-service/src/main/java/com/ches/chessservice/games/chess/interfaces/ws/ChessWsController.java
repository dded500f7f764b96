package com.ches.chessservice.games.chess.interfaces.ws;

import com.ches.chessservice.games.chess.application.ChessBroadcaster;
import com.ches.chessservice.games.chess.domain.model.Move;
import com.ches.chessservice.games.chess.interfaces.ws.dto.ChessMessages.MoveCmd;
import com.ches.chessservice.games.chess.interfaces.ws.dto.ChessMessages.SimpleCmd;
import com.ches.chessservice.games.chess.service.ChessService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.stereotype.Controller;

/**
 * Chess WebSocket 控制器
 * ----------------------------------------
 * 负责接收前端通过 STOMP 发送的指令（/app/chess.*），交给 ChessService 做权威校验与执行。
 * SET / REJECTED 由 ChessService 在房间锁内通过 ChessBroadcaster 发出，
 * 本类只负责把请求本身的错误（坐标写错、房间已关闭等）以 ERROR 事件告知房间。
 *
 * 客户端本地走的那一步在收到下一次 SET 之前都只是临时的。
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class ChessWsController {

    private final ChessService chessService;
    private final ChessBroadcaster broadcaster;

    /**
     * 处理客户端的走子指令。
     * 路径：/app/chess.move
     *   - 合法：执行后广播 SET；
     *   - 不合法：棋盘不变，按配置广播 REJECTED；
     *   - 起点无子：静默忽略。
     */
    @MessageMapping("/chess.move")
    public void move(MoveCmd cmd) {
        final String roomId = cmd.getRoomId();
        try {
            Move move = Move.of(cmd.getFrom(), cmd.getTo());
            chessService.move(roomId, move.from(), move.to());
        } catch (IllegalArgumentException | IllegalStateException e) {
            broadcaster.error(roomId, e.getMessage());
        } catch (Exception e) {
            log.error("处理走子失败: roomId={}, from={}, to={}", roomId, cmd.getFrom(), cmd.getTo(), e);
            broadcaster.error(roomId, "走子处理失败，请稍后再试");
        }
    }

    /**
     * 重置棋盘为标准开局。
     * 路径：/app/chess.reset
     */
    @MessageMapping("/chess.reset")
    public void reset(SimpleCmd cmd) {
        final String roomId = cmd.getRoomId();
        try {
            chessService.reset(roomId);
        } catch (IllegalArgumentException | IllegalStateException e) {
            broadcaster.error(roomId, e.getMessage());
        }
    }

    /**
     * 重新广播当前棋盘（新连接 / 断线重连后拉取全量状态）。
     * 路径：/app/chess.sync
     */
    @MessageMapping("/chess.sync")
    public void sync(SimpleCmd cmd) {
        final String roomId = cmd.getRoomId();
        try {
            chessService.sync(roomId);
        } catch (IllegalArgumentException | IllegalStateException e) {
            broadcaster.error(roomId, e.getMessage());
        }
    }
}
