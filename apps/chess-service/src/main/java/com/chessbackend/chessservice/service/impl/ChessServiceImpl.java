package com.chessbackend.chessservice.service.impl;

import com.chessbackend.chessservice.domain.engine.ChessEngine;
import com.chessbackend.chessservice.domain.model.ChessSnapshot;
import com.chessbackend.chessservice.domain.model.MoveRecord;
import com.chessbackend.chessservice.domain.rule.MoveResult;
import com.chessbackend.chessservice.service.ChessService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单局共享对局服务。
 * 引擎非线程安全，这里用一把锁包住每个操作（包括整个走子过程），
 * 保证校验与落子对其他请求是原子的。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChessServiceImpl implements ChessService {

    private final ChessEngine engine;

    /** 对局锁：所有读写都串行 */
    private final ReentrantLock lock = new ReentrantLock();

    /** 推送序号，只增不减（受 lock 保护） */
    private long seq;

    @Override
    public ChessSnapshot getState() {
        lock.lock();
        try {
            return engine.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public MoveOutcome move(String from, String to, String promotion) {
        lock.lock();
        try {
            MoveResult result = engine.applyMove(from, to, promotion);
            if (result.accepted()) {
                seq++;
                MoveRecord rec = result.record();
                log.info("走子成功: #{} {} {} {}-{} capture={}{} seq={}", rec.moveNumber(), rec.color().code(),
                        rec.piece().type().code(), rec.from(), rec.to(), rec.capture(),
                        rec.promoted() ? " promotion=" + rec.promotion().code() : "", seq);
            } else {
                log.debug("走子被拒绝: from={}, to={}, promotion={}, error={}, reason={}",
                        from, to, promotion, result.error(), result.violation().message());
            }
            return new MoveOutcome(result, engine.snapshot(), seq);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<MoveRecord> getHistory() {
        lock.lock();
        try {
            return engine.history();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RestartOutcome restart() {
        lock.lock();
        try {
            int played = engine.state().halfMoves();
            engine.restart();
            seq++;
            log.info("对局已重开（重开前共 {} 个半回合）seq={}", played, seq);
            return new RestartOutcome(engine.snapshot(), seq);
        } finally {
            lock.unlock();
        }
    }
}
