package com.ches.chessservice.games.chess.interfaces.http;

import com.ches.chessservice.games.chess.domain.model.ChessState;
import com.ches.chessservice.games.chess.domain.model.Coordinate;
import com.ches.chessservice.games.chess.domain.rule.LegalityResult;
import com.ches.chessservice.games.chess.interfaces.http.dto.StateView;
import com.ches.chessservice.games.chess.service.ChessService;
import com.ches.web.common.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 国际象棋 http 接口控制器（建房、查询、合法性探测、管理用整盘替换）
 */
@Slf4j
@RestController
@RequestMapping("/api/chess")
@RequiredArgsConstructor
public class ChessRestController {

    private final ChessService svc;

    /** 新建房间，棋盘为标准开局 */
    @PostMapping("/new")
    public ResponseEntity<ApiResponse<String>> newRoom() {
        return ResponseEntity.ok(ApiResponse.success(svc.newRoom()));
    }

    /** 房间当前状态（首屏渲染 / 排查用） */
    @GetMapping("/rooms/{roomId}/state")
    public ResponseEntity<ApiResponse<StateView>> state(@PathVariable String roomId) {
        return ResponseEntity.ok(ApiResponse.success(StateView.of(svc.getState(roomId))));
    }

    /**
     * 合法性探测：不修改棋盘。
     * 示例：GET /api/chess/rooms/{roomId}/legal?from=e2&to=e4
     */
    @GetMapping("/rooms/{roomId}/legal")
    public ResponseEntity<ApiResponse<LegalityResult>> legal(@PathVariable String roomId,
                                                             @RequestParam("from") String from,
                                                             @RequestParam("to") String to) {
        LegalityResult r = svc.check(roomId, Coordinate.parse(from), Coordinate.parse(to));
        return ResponseEntity.ok(ApiResponse.success(r));
    }

    /**
     * 用编码整盘替换房间棋盘（ChessService 在房间锁内广播 SET）。
     * 编码非法时返回 400，房间保持原状；房间已关闭返回 409。
     */
    @PutMapping("/rooms/{roomId}/state")
    public ResponseEntity<ApiResponse<StateView>> replace(@PathVariable String roomId,
                                                          @RequestBody(required = false) String encoded) {
        ChessState s = svc.set(roomId, StringUtils.trimToEmpty(encoded));
        log.info("管理接口替换棋盘: roomId={}", roomId);
        return ResponseEntity.ok(ApiResponse.success(StateView.of(s)));
    }

    /** 关闭房间 */
    @DeleteMapping("/rooms/{roomId}")
    public ResponseEntity<ApiResponse<String>> close(@PathVariable String roomId) {
        svc.closeRoom(roomId);
        return ResponseEntity.ok(ApiResponse.success(roomId));
    }
}
