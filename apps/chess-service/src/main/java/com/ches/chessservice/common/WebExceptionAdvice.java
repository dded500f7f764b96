package com.ches.chessservice.common;

import com.ches.chessservice.games.chess.domain.codec.BoardDecodeException;
import com.ches.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * 国际象棋 HTTP 接口的异常映射。
 * - 棋盘编码无法解码：400，data 带出错记录下标，便于管理端定位是第几枚棋子写错；
 * - 坐标非法、房间号缺失、房间不存在：400；
 * - 房间已关闭等状态冲突：409。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 整盘替换时编码非法；房间保持原状。
     * @return HTTP 400，data = {recordIndex}（整体长度错误时为 -1）
     */
    @ExceptionHandler(BoardDecodeException.class)
    public ResponseEntity<ApiResponse<Map<String, Integer>>> badBoard(BoardDecodeException e) {
        log.info("棋盘编码无法解码: recordIndex={}, {}", e.getRecordIndex(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiResponse<>(400, e.getMessage(), Map.of("recordIndex", e.getRecordIndex())));
    }

    /**
     * 坐标写错（BAD_COORDINATE）、房间号缺失或房间不存在（ROOM_NOT_FOUND）。
     * @return HTTP 400
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 房间已关闭（ROOM_CLOSED）等状态冲突。
     * @return HTTP 409
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        log.warn("状态冲突: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
