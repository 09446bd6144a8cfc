package com.chessbackend.chessservice.service;

import com.chessbackend.chessservice.domain.model.ChessSnapshot;
import com.chessbackend.chessservice.domain.model.MoveRecord;
import com.chessbackend.chessservice.domain.rule.MoveResult;

import java.util.List;

public interface ChessService {

    /** 只读获取当前对局快照（稀疏棋盘 + 轮到谁 + 对局状态） */
    ChessSnapshot getState();

    /**
     * 走一步棋。
     * 校验、落子、取快照与取序号在同一把锁内完成，不会与其他请求交错。
     * @param promotion 升变编码 q/r/b/n，可为 null
     * @return 走子结果 + 本次调用结束时的快照 + 推送序号（被拒绝时对局状态不变）
     */
    MoveOutcome move(String from, String to, String promotion);

    /** 按时间顺序的走子历史 */
    List<MoveRecord> getHistory();

    /** 重开对局，返回重开后的快照与推送序号；总是成功 */
    RestartOutcome restart();

    /**
     * @param result 引擎结果（成功带记录，失败带原因）
     * @param state  本次调用结束时的快照
     * @param seq    推送序号：每次成功走子或重开加一，重开不清零
     */
    record MoveOutcome(MoveResult result, ChessSnapshot state, long seq) {
        public boolean accepted() {
            return result.accepted();
        }
    }

    record RestartOutcome(ChessSnapshot state, long seq) {}
}
