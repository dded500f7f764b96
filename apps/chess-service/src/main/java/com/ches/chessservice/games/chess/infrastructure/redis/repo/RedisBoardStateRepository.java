package com.ches.chessservice.games.chess.infrastructure.redis.repo;

import com.ches.chessservice.games.chess.domain.dto.BoardStateRecord;
import com.ches.chessservice.games.chess.domain.repository.BoardStateRepository;
import com.ches.chessservice.games.chess.infrastructure.redis.RedisKeys;
import com.ches.chessservice.infrastructure.redis.RedisOps;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.util.Optional;

/**
 * 房间权威棋盘的 Redis 仓储实现（JSON 存储，带 TTL）。
 */
@Repository
@RequiredArgsConstructor
public class RedisBoardStateRepository implements BoardStateRepository {

    private final RedisOps ops;

    @Override
    public void save(String roomId, BoardStateRecord state, Duration ttl) {
        ops.setEx(RedisKeys.boardState(roomId), state, ttl);
    }

    @Override
    public Optional<BoardStateRecord> get(String roomId) {
        return Optional.ofNullable(ops.get(RedisKeys.boardState(roomId), BoardStateRecord.class));
    }

    @Override
    public void delete(String roomId) {
        ops.del(RedisKeys.boardState(roomId));
    }
}
