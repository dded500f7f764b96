package com.ches.chessservice.games.chess.service;

import com.ches.chessservice.games.chess.domain.model.ChessState;
import com.ches.chessservice.games.chess.domain.model.Coordinate;
import com.ches.chessservice.games.chess.domain.rule.AppliedMove;
import com.ches.chessservice.games.chess.domain.rule.IllegalReason;
import com.ches.chessservice.games.chess.domain.rule.LegalityResult;

/**
 * 房间权威棋盘的会话服务。
 * 同一房间的所有操作串行执行，按到达顺序逐条跑完：校验 → 执行 → 持久化 → 广播。
 * 广播在房间锁内完成，订阅者收到的 SET 顺序与棋盘提交顺序一致。
 * 已关闭房间的旧引用不再接受变更：move 忽略，reset/set 抛 IllegalStateException("ROOM_CLOSED")。
 */
public interface ChessService {

    /** 新开房间，棋盘为标准开局；返回 roomId */
    String newRoom();

    /** 只读获取房间状态（深拷贝，调用方改不到内部状态） */
    ChessState getState(String roomId);

    /** 向房间重发当前权威棋盘（新连接 / 断线重连同步）；返回广播的编码 */
    String sync(String roomId);

    /**
     * 走子请求：起点无子则忽略；不合法则拒绝且棋盘不变（按配置广播 REJECTED）；
     * 合法则执行、持久化并广播 SET。
     */
    MoveResult move(String roomId, Coordinate from, Coordinate to);

    /** 只做合法性探测，不修改棋盘；起点无子视为 PIECE_NOT_ON_BOARD */
    LegalityResult check(String roomId, Coordinate from, Coordinate to);

    /** 重置为标准开局并广播 SET（幂等：连续两次得到相同编码） */
    ChessState reset(String roomId);

    /**
     * 用编码整盘替换房间棋盘并广播 SET（管理用）。
     * @throws com.ches.chessservice.games.chess.domain.codec.BoardDecodeException 编码非法，房间保持原状
     */
    ChessState set(String roomId, String encoded);

    /** 关闭房间：等当前操作跑完后标记关闭、删除快照并移出内存 */
    void closeRoom(String roomId);

    /**
     * 走子结果。
     * @param outcome 执行 / 拒绝 / 忽略
     * @param reason  拒绝原因，仅 REJECTED 时非空
     * @param applied 本步记录，仅 APPLIED 时非空
     * @param state   处理完后的权威棋盘编码
     */
    record MoveResult(Outcome outcome, IllegalReason reason, AppliedMove applied, String state) {

        public enum Outcome { APPLIED, REJECTED, IGNORED }

        public static MoveResult applied(AppliedMove move, String state) {
            return new MoveResult(Outcome.APPLIED, null, move, state);
        }

        public static MoveResult rejected(IllegalReason reason, String state) {
            return new MoveResult(Outcome.REJECTED, reason, null, state);
        }

        public static MoveResult ignored(String state) {
            return new MoveResult(Outcome.IGNORED, null, null, state);
        }
    }
}
