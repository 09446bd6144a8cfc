package com.chessbackend.chessservice.interfaces.http;

import com.chessbackend.chessservice.domain.model.ChessSnapshot;
import com.chessbackend.chessservice.domain.model.MoveRecord;
import com.chessbackend.chessservice.domain.rule.MoveResult;
import com.chessbackend.chessservice.interfaces.http.dto.HistoryResponse;
import com.chessbackend.chessservice.interfaces.http.dto.MoveRejection;
import com.chessbackend.chessservice.interfaces.http.dto.MoveRequest;
import com.chessbackend.chessservice.interfaces.http.dto.MoveResponse;
import com.chessbackend.chessservice.interfaces.http.dto.RestartResponse;
import com.chessbackend.chessservice.platform.config.ChessProperties;
import com.chessbackend.chessservice.platform.transport.Envelope;
import com.chessbackend.chessservice.service.ChessService;
import com.chessbackend.web.common.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 国际象棋 http 接口控制器（单局共享对局）
 * <p>
 * 简化规则：按棋子走法、路径阻挡、兵的一步/两步/斜吃/升变做校验；
 * 不支持王车易位、吃过路兵，也不判将军/将死。
 */
@RestController
@RequestMapping("/api/chess")
public class ChessRestController {

    private static final String GAME = "chess";

    private final ChessService svc;
    private final ChessProperties properties;
    /** 用于在走子/重开后主动广播最新状态 */
    private final SimpMessagingTemplate messagingTemplate;

    public ChessRestController(ChessService svc,
                               ChessProperties properties,
                               SimpMessagingTemplate messagingTemplate) {
        this.svc = svc;
        this.properties = properties;
        this.messagingTemplate = messagingTemplate;
    }

    /**
     * 获取当前对局状态：有子的格子、轮到谁、对局状态
     */
    @GetMapping("/state")
    public ResponseEntity<ApiResponse<ChessSnapshot>> state() {
        return ResponseEntity.ok(ApiResponse.success(svc.getState()));
    }

    /**
     * 为当前执子方走一步棋。
     * ----------------------------------------------------
     * - 成功：返回最新快照与这一步的记录，并广播 STATE / EVENT；
     * - 不合法：HTTP 400，message 为原因，data.error 为错误种类，对局状态不变。
     */
    @PostMapping("/move")
    public ResponseEntity<ApiResponse<?>> move(@Valid @RequestBody MoveRequest request) {
        ChessService.MoveOutcome outcome = svc.move(request.getFrom(), request.getTo(), request.getPromotion());
        MoveResult result = outcome.result();
        if (!result.accepted()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                    .body(ApiResponse.badRequest(result.violation().message(), MoveRejection.from(result.violation())));
        }

        ChessSnapshot snapshot = outcome.state();
        MoveRecord record = result.record();
        long seq = outcome.seq();
        messagingTemplate.convertAndSend(properties.getWs().getMoveTopic(), Envelope.event(GAME, record, seq));
        messagingTemplate.convertAndSend(properties.getWs().getTopic(), Envelope.state(GAME, snapshot, seq));
        return ResponseEntity.ok(ApiResponse.success(new MoveResponse(snapshot, record)));
    }

    /**
     * 按时间顺序的走子历史
     */
    @GetMapping("/history")
    public ResponseEntity<ApiResponse<HistoryResponse>> history() {
        return ResponseEntity.ok(ApiResponse.success(new HistoryResponse(svc.getHistory())));
    }

    /**
     * 重开：回到标准开局、白先、清空历史
     */
    @PostMapping("/restart")
    public ResponseEntity<ApiResponse<RestartResponse>> restart() {
        ChessService.RestartOutcome outcome = svc.restart();
        messagingTemplate.convertAndSend(properties.getWs().getTopic(), Envelope.state(GAME, outcome.state(), outcome.seq()));
        return ResponseEntity.ok(ApiResponse.success(new RestartResponse(outcome.state(), List.of())));
    }
}
