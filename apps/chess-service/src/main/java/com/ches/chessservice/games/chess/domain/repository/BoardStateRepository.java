package com.ches.chessservice.games.chess.domain.repository;

import com.ches.chessservice.games.chess.domain.dto.BoardStateRecord;

import java.time.Duration;
import java.util.Optional;

/**
 * BoardStateRepository
 * ----------------------------------------
 * 房间权威棋盘仓储接口
 * - 保存、查询与删除房间的棋盘快照；
 * - 当前实现基于 Redis。
 * ----------------------------------------
 */
public interface BoardStateRepository {

    /**
     * 保存棋盘快照（覆盖写）
     * @param roomId 房间ID
     * @param state  快照
     * @param ttl    过期时间
     */
    void save(String roomId, BoardStateRecord state, Duration ttl);

    /**
     * 获取棋盘快照
     * @return 不存在则 empty
     */
    Optional<BoardStateRecord> get(String roomId);

    void delete(String roomId);
}
