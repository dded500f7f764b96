package com.ches.chessservice.games.chess.infrastructure.redis.repo;

import com.ches.chessservice.games.chess.domain.dto.BoardStateRecord;
import com.ches.chessservice.infrastructure.redis.RedisOps;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisBoardStateRepositoryTest {

    private static final String KEY = "chess:room:r1:state";

    @Mock
    private RedisTemplate<String, Object> redis;
    @Mock
    private ValueOperations<String, Object> values;

    private RedisBoardStateRepository repo;

    @BeforeEach
    void setUp() {
        repo = new RedisBoardStateRepository(new RedisOps(redis));
    }

    @Test
    void saveWritesUnderRoomKeyWithTtl() {
        when(redis.opsForValue()).thenReturn(values);
        BoardStateRecord rec = new BoardStateRecord();
        rec.setBoard("k0e101");

        repo.save("r1", rec, Duration.ofHours(48));

        verify(values).set(KEY, rec, Duration.ofHours(48));
    }

    @Test
    void getReturnsStoredRecord() {
        when(redis.opsForValue()).thenReturn(values);
        BoardStateRecord rec = new BoardStateRecord();
        rec.setBoard("k0e101");
        when(values.get(KEY)).thenReturn(rec);

        assertThat(repo.get("r1")).containsSame(rec);
    }

    @Test
    void getIgnoresMissingOrForeignValues() {
        when(redis.opsForValue()).thenReturn(values);
        when(values.get(KEY)).thenReturn(null, "legacy-string");

        assertThat(repo.get("r1")).isEmpty();
        assertThat(repo.get("r1")).isEmpty();
    }

    @Test
    void deleteRemovesRoomKey() {
        repo.delete("r1");
        verify(redis).delete(List.of(KEY));
    }
}
