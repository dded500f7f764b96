package com.ches.chessservice.games.chess.service.impl;

import com.ches.chessservice.games.chess.application.ChessBroadcaster;
import com.ches.chessservice.games.chess.domain.codec.BoardCodec;
import com.ches.chessservice.games.chess.domain.codec.DecodeResult;
import com.ches.chessservice.games.chess.domain.dto.BoardStateRecord;
import com.ches.chessservice.games.chess.domain.model.Board;
import com.ches.chessservice.games.chess.domain.model.ChessState;
import com.ches.chessservice.games.chess.domain.model.Coordinate;
import com.ches.chessservice.games.chess.domain.model.Piece;
import com.ches.chessservice.games.chess.domain.model.PieceColor;
import com.ches.chessservice.games.chess.domain.repository.BoardStateRepository;
import com.ches.chessservice.games.chess.domain.rule.AppliedMove;
import com.ches.chessservice.games.chess.domain.rule.IllegalReason;
import com.ches.chessservice.games.chess.domain.rule.LegalityResult;
import com.ches.chessservice.games.chess.domain.rule.MoveApplier;
import com.ches.chessservice.games.chess.domain.rule.MoveValidator;
import com.ches.chessservice.games.chess.service.ChessService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.EnumUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChessServiceImpl implements ChessService {

    // ====== 内存房间表（房间锁 = ChessState 对象本身） ======
    private final Map<String, ChessState> rooms = new ConcurrentHashMap<>();

    private final BoardStateRepository boardRepo;
    /** 房间广播；只在房间锁内调用 */
    private final ChessBroadcaster broadcaster;

    /** 快照在 Redis 中的保留时长（小时） */
    @Value("${chess.state.ttl-hours:48}")
    private long ttlHours = 48;

    /** 是否强制轮流走子（默认不强制） */
    @Value("${chess.turn.enforce:false}")
    private boolean enforceTurn;

    /** 访问未知房间时是否自动以标准开局建房 */
    @Value("${chess.room.auto-create:true}")
    private boolean autoCreate = true;

    @Override
    public String newRoom() {
        String roomId = UUID.randomUUID().toString();
        ChessState s = new ChessState(roomId, Board.standardSetup());
        rooms.put(roomId, s);
        persist(s);
        log.info("新建房间: roomId={}", roomId);
        return roomId;
    }

    @Override
    public ChessState getState(String roomId) {
        ChessState s = room(roomId);
        synchronized (s) {
            return s.copy();
        }
    }

    @Override
    public String sync(String roomId) {
        ChessState s = room(roomId);
        synchronized (s) {
            ensureOpen(s);
            String encoded = s.encoded();
            broadcaster.boardSet(roomId, encoded);
            return encoded;
        }
    }

    @Override
    public MoveResult move(String roomId, Coordinate from, Coordinate to) {
        ChessState s = room(roomId);
        synchronized (s) {
            if (s.closed()) {
                log.debug("房间已关闭，忽略走子: roomId={}, move={}{}", roomId, from, to);
                return MoveResult.ignored(s.encoded());
            }
            Board current = s.board();
            Optional<Piece> occupant = current.occupantAt(from);
            if (occupant.isEmpty()) {
                log.debug("起点无子，忽略: roomId={}, from={}", roomId, from);
                return MoveResult.ignored(s.encoded());
            }
            Piece piece = occupant.get();
            if (enforceTurn && piece.getColor() != s.sideToMove()) {
                log.info("未轮到该方: roomId={}, move={}{}, sideToMove={}", roomId, from, to, s.sideToMove());
                return reject(s, from, to, IllegalReason.NOT_YOUR_TURN);
            }

            // 权威校验（不信任客户端的本地判断）
            LegalityResult legality = MoveValidator.check(current, piece, to);
            if (!legality.legal()) {
                log.info("非法走子已拒绝: roomId={}, move={}{}, reason={}", roomId, from, to, legality.reason());
                return reject(s, from, to, legality.reason());
            }

            // 在快照上执行，再整体替换，外部看不到半步状态
            Board next = current.snapshot();
            AppliedMove applied = MoveApplier.apply(next, next.get(from), to);
            s.commit(next, applied);
            persist(s);
            String encoded = s.encoded();
            broadcaster.boardSet(roomId, encoded);
            log.debug("走子完成: roomId={}, step={}, move={}, captured={}, castled={}, enPassant={}",
                    roomId, s.step(), applied.notation(), applied.captured(), applied.castled(), applied.enPassant());
            return MoveResult.applied(applied, encoded);
        }
    }

    @Override
    public LegalityResult check(String roomId, Coordinate from, Coordinate to) {
        ChessState s = room(roomId);
        synchronized (s) {
            Optional<Piece> occupant = s.board().occupantAt(from);
            if (occupant.isEmpty()) {
                return LegalityResult.illegal(IllegalReason.PIECE_NOT_ON_BOARD);
            }
            return MoveValidator.check(s.board(), occupant.get(), to);
        }
    }

    @Override
    public ChessState reset(String roomId) {
        ChessState s = room(roomId);
        synchronized (s) {
            ensureOpen(s);
            s.replace(Board.standardSetup());
            persist(s);
            broadcaster.boardSet(roomId, s.encoded());
            log.info("棋盘已重置: roomId={}", roomId);
            return s.copy();
        }
    }

    @Override
    public ChessState set(String roomId, String encoded) {
        // 先解码再加锁：编码非法时直接抛出，房间不受影响
        Board decoded = BoardCodec.decode(encoded);
        ChessState s = room(roomId);
        synchronized (s) {
            ensureOpen(s);
            s.replace(decoded);
            persist(s);
            broadcaster.boardSet(roomId, s.encoded());
            log.info("棋盘已整盘替换: roomId={}, pieces={}", roomId, decoded.pieces().size());
            log.debug("替换后的棋盘: roomId={}\n{}", roomId, decoded);
            return s.copy();
        }
    }

    @Override
    public void closeRoom(String roomId) {
        ChessState s = rooms.get(roomId);
        if (s == null) {
            deleteSnapshot(roomId);
            log.info("房间不在内存中，仅删除快照: roomId={}", roomId);
            return;
        }
        // 等正在执行的操作（含其持久化）跑完，再删快照，避免被写回
        synchronized (s) {
            s.close();
            deleteSnapshot(roomId);
            rooms.remove(roomId, s);
        }
        log.info("房间已关闭: roomId={}", roomId);
    }

    // ----------- private helpers -----------

    private MoveResult reject(ChessState s, Coordinate from, Coordinate to, IllegalReason reason) {
        String encoded = s.encoded();
        broadcaster.moveRejected(s.roomId(), from, to, reason, encoded);
        return MoveResult.rejected(reason, encoded);
    }

    /** 已关闭房间的旧引用不接受变更 */
    private static void ensureOpen(ChessState s) {
        if (s.closed()) {
            throw new IllegalStateException("ROOM_CLOSED: " + s.roomId());
        }
    }

    private void deleteSnapshot(String roomId) {
        try {
            boardRepo.delete(roomId);
        } catch (RuntimeException e) {
            log.warn("删除棋盘快照失败: roomId={}", roomId, e);
        }
    }

    /**
     * 获取房间（内存优先，未命中则从 Redis 恢复；都没有时按配置自动建房或报错）
     */
    private ChessState room(String roomId) {
        if (roomId == null || roomId.isBlank()) {
            throw new IllegalArgumentException("ROOM_ID_REQUIRED");
        }
        ChessState cached = rooms.get(roomId);
        if (cached != null) return cached;

        Optional<ChessState> restored = restore(roomId);
        if (restored.isEmpty() && !autoCreate) {
            throw new IllegalArgumentException("ROOM_NOT_FOUND: " + roomId);
        }
        return rooms.computeIfAbsent(roomId, id -> restored.orElseGet(() -> {
            log.info("房间不存在，按标准开局自动创建: roomId={}", id);
            return new ChessState(id, Board.standardSetup());
        }));
    }

    private Optional<ChessState> restore(String roomId) {
        Optional<BoardStateRecord> rec;
        try {
            rec = boardRepo.get(roomId);
        } catch (RuntimeException e) {
            log.warn("读取棋盘快照失败，按无快照处理: roomId={}", roomId, e);
            return Optional.empty();
        }
        if (rec.isEmpty()) return Optional.empty();

        DecodeResult decoded = BoardCodec.tryDecode(rec.get().getBoard());
        if (!decoded.ok()) {
            log.warn("棋盘快照无法解码，丢弃: roomId={}, error={}", roomId, decoded.error());
            return Optional.empty();
        }
        PieceColor side = EnumUtils.getEnum(PieceColor.class, rec.get().getSideToMove(), PieceColor.LIGHT);
        int step = rec.get().getStep() == null ? 0 : rec.get().getStep();
        ChessState s = new ChessState(roomId, decoded.board());
        s.restore(decoded.board(), side, step);
        log.info("房间已从快照恢复: roomId={}, step={}", roomId, step);
        return Optional.of(s);
    }

    /**
     * 写入 Redis 快照。失败只记日志，内存中的棋盘仍是权威状态。
     */
    private void persist(ChessState s) {
        BoardStateRecord rec = new BoardStateRecord();
        rec.setRoomId(s.roomId());
        rec.setBoard(s.encoded());
        rec.setSideToMove(s.sideToMove().name());
        rec.setLastMove(s.lastMove() == null ? null : s.lastMove().notation());
        rec.setStep(s.step());
        rec.setUpdatedAt(System.currentTimeMillis());
        try {
            boardRepo.save(s.roomId(), rec, Duration.ofHours(ttlHours));
        } catch (RuntimeException e) {
            log.warn("保存棋盘快照失败: roomId={}, step={}", s.roomId(), s.step(), e);
        }
    }
}
