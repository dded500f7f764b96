package com.ches.chessservice.games.chess.domain.sync;

import com.ches.chessservice.games.chess.domain.codec.BoardCodec;
import com.ches.chessservice.games.chess.domain.codec.DecodeResult;
import com.ches.chessservice.games.chess.domain.model.Board;
import com.ches.chessservice.games.chess.domain.model.Coordinate;
import com.ches.chessservice.games.chess.domain.model.Move;
import com.ches.chessservice.games.chess.domain.model.Piece;
import com.ches.chessservice.games.chess.domain.rule.MoveApplier;
import com.ches.chessservice.games.chess.domain.rule.MoveValidator;

import java.util.Optional;

/**
 * 客户端侧的棋盘副本（供 Java 客户端 / 机器人 / 测试使用）。
 * ----------------------------------------
 * 状态：
 *   - IDLE：没有待确认的走法；
 *   - AWAITING_AUTHORITATIVE：已在本地先行走了一步并发出 move 请求，等待服务器下一次 set。
 *
 * 本地先行的走法只是临时的：收到 set 后整盘替换，收到拒绝则退回上次确认的棋盘。
 */
public class ChessClientMirror {

    public enum Phase { IDLE, AWAITING_AUTHORITATIVE }

    /** 最近一次由服务器确认的棋盘 */
    private Board confirmed = Board.empty();
    /** 本地展示用棋盘（可能含一步临时走法） */
    private Board local = confirmed.snapshot();
    private Phase phase = Phase.IDLE;

    public Phase phase() {
        return phase;
    }

    /** 当前展示用棋盘；UI 只读 */
    public Board board() {
        return local;
    }

    /**
     * 本地先行校验并临时执行一步。
     * @return 需要发送给服务器的 move 请求；起点无子、走法不合法或仍在等待上一步确认时返回 empty，本地状态不变
     */
    public Optional<Move> proposeMove(Coordinate from, Coordinate to) {
        if (phase == Phase.AWAITING_AUTHORITATIVE) return Optional.empty();
        Optional<Piece> piece = local.occupantAt(from);
        if (piece.isEmpty() || !MoveValidator.isMoveLegal(local, piece.get(), to)) {
            return Optional.empty();
        }
        Board provisional = local.snapshot();
        MoveApplier.apply(provisional, provisional.get(from), to);
        local = provisional;
        phase = Phase.AWAITING_AUTHORITATIVE;
        return Optional.of(new Move(from, to));
    }

    /**
     * 处理服务器推送的 set：解码后整盘替换，丢弃本地临时走法。
     * 解码失败时保留原棋盘与状态，并把错误返回给调用方。
     */
    public DecodeResult onSet(String encoded) {
        DecodeResult r = BoardCodec.tryDecode(encoded);
        if (r.ok()) {
            confirmed = r.board();
            local = confirmed.snapshot();
            phase = Phase.IDLE;
        }
        return r;
    }

    /** 服务器拒绝了本地先行的走法：退回上次确认的棋盘 */
    public void onRejected() {
        local = confirmed.snapshot();
        phase = Phase.IDLE;
    }
}
