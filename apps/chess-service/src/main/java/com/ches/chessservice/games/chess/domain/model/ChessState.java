package com.ches.chessservice.games.chess.domain.model;

import com.ches.chessservice.engine.core.GameState;
import com.ches.chessservice.games.chess.domain.codec.BoardCodec;
import com.ches.chessservice.games.chess.domain.rule.AppliedMove;

/**
 * 一个房间的权威对局状态（单一事实来源）。
 * - 持有当前棋盘 board（整体替换，不原地修改，保证读者看不到半步状态）
 * - sideToMove：按走子方交替的轮次记录（是否强制由会话配置决定）
 * - step：已执行步数，reset/set 后归零
 * - lastMove：上一步记录，便于日志与快照
 * - closed：房间已关闭；关闭后本对象不再接受任何变更
 *
 * 同一房间的读写由会话层串行化（synchronized 在本对象上）。
 */
public class ChessState implements GameState {

    private final String roomId;
    private volatile Board board;
    private volatile PieceColor sideToMove = PieceColor.LIGHT;
    private volatile int step;
    private volatile AppliedMove lastMove;
    private volatile boolean closed;

    public ChessState(String roomId, Board board) {
        this.roomId = roomId;
        this.board = board;
    }

    // --------- 读方法 ----------
    public String roomId() { return roomId; }
    public Board board() { return board; }
    public PieceColor sideToMove() { return sideToMove; }
    public int step() { return step; }
    public AppliedMove lastMove() { return lastMove; }
    public boolean closed() { return closed; }

    /** 当前棋盘的紧凑编码 */
    public String encoded() {
        return BoardCodec.encode(board);
    }

    // --------- 状态变更（由会话层在房间锁内调用） ----------

    /** 提交一步：用已执行完走法的新棋盘整体替换旧棋盘，轮次交给对方 */
    public void commit(Board next, AppliedMove move) {
        this.board = next;
        this.lastMove = move;
        this.sideToMove = move.color().opposite();
        this.step++;
    }

    /** 整盘替换（reset / set），步数与上一步清零，LIGHT 先走 */
    public void replace(Board next) {
        this.board = next;
        this.lastMove = null;
        this.sideToMove = PieceColor.LIGHT;
        this.step = 0;
    }

    /** 从持久化记录恢复时使用 */
    public void restore(Board b, PieceColor side, int steps) {
        this.board = b;
        this.sideToMove = side;
        this.step = steps;
        this.lastMove = null;
    }

    /** 标记房间已关闭（不可恢复） */
    public void close() {
        this.closed = true;
    }

    /** 深拷贝：复制棋盘与元信息 */
    @Override
    public ChessState copy() {
        ChessState s = new ChessState(roomId, board.snapshot());
        s.sideToMove = this.sideToMove;
        s.step = this.step;
        s.lastMove = this.lastMove; // AppliedMove 是不可变 record，引用即可
        return s;
    }
}
