package com.chessbackend.chessservice.service.impl;

import com.chessbackend.chessservice.domain.engine.ChessEngine;
import com.chessbackend.chessservice.domain.model.BoardItem;
import com.chessbackend.chessservice.domain.model.ChessSnapshot;
import com.chessbackend.chessservice.domain.model.MoveRecord;
import com.chessbackend.chessservice.domain.model.PieceColor;
import com.chessbackend.chessservice.domain.rule.MoveError;
import com.chessbackend.chessservice.service.ChessService.MoveOutcome;
import com.chessbackend.chessservice.service.ChessService.RestartOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChessServiceImplTest {

    private ChessServiceImpl svc;

    @BeforeEach
    void setUp() {
        svc = new ChessServiceImpl(new ChessEngine());
    }

    @Test
    void moveUpdatesStateAndHistory() {
        MoveOutcome r = svc.move("e2", "e4", null);

        assertTrue(r.accepted());
        assertEquals(PieceColor.BLACK, r.state().currentTurn());
        assertEquals(r.state(), svc.getState());
        assertEquals(1, svc.getHistory().size());
        assertEquals(1, r.seq());
    }

    @Test
    void rejectedMoveIsReturnedNotThrown() {
        ChessSnapshot before = svc.getState();

        MoveOutcome r = svc.move("e2", "e5", null);

        assertEquals(MoveError.ILLEGAL_PIECE_MOVE, r.result().error());
        assertEquals(before, r.state());
        assertEquals(0, r.seq());
        assertTrue(svc.getHistory().isEmpty());
    }

    @Test
    void restartReturnsFreshSnapshot() {
        svc.move("e2", "e4", null);
        svc.move("e7", "e5", null);

        RestartOutcome out = svc.restart();
        ChessSnapshot s = out.state();

        assertEquals(32, s.board().size());
        assertEquals(PieceColor.WHITE, s.currentTurn());
        assertTrue(svc.getHistory().isEmpty());
    }

    @Test
    void seqKeepsGrowingAcrossRestart() {
        long first = svc.move("e2", "e4", null).seq();
        long second = svc.move("e7", "e5", null).seq();
        long rejected = svc.move("e4", "e5", null).seq();
        long restart = svc.restart().seq();
        long afterRestart = svc.move("d2", "d4", null).seq();

        assertEquals(1, first);
        assertEquals(2, second);
        assertEquals(second, rejected);
        assertTrue(restart > second);
        assertTrue(afterRestart > restart);
    }

    @Test
    void concurrentIdenticalMovesApplyExactlyOnce() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<MoveOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<MoveOutcome> task = () -> {
                    start.await();
                    return svc.move("e2", "e4", null);
                };
                futures.add(pool.submit(task));
            }
            start.countDown();

            int accepted = 0;
            for (Future<MoveOutcome> f : futures) {
                MoveOutcome r = f.get(5, TimeUnit.SECONDS);
                if (r.accepted()) {
                    accepted++;
                } else {
                    assertEquals(MoveError.EMPTY_SOURCE, r.result().error());
                }
            }
            assertEquals(1, accepted);
            assertEquals(1, svc.getHistory().size());
            assertEquals(PieceColor.BLACK, svc.getState().currentTurn());
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * 黑白两个线程各自来回跳马抢着走：
     * 每个成功结果里的快照必须正好是这一步之后的局面，序号与之对应。
     */
    @Test
    void outcomeSnapshotIsTakenRightAfterItsOwnMove() throws Exception {
        int perSide = 40;
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<List<MoveOutcome>> white = pool.submit(
                    shuttleKnight(start, perSide, new String[]{"g1", "f3"}, new String[]{"f3", "g1"}));
            Future<List<MoveOutcome>> black = pool.submit(
                    shuttleKnight(start, perSide, new String[]{"g8", "f6"}, new String[]{"f6", "g8"}));
            start.countDown();

            List<MoveOutcome> all = new ArrayList<>(white.get(10, TimeUnit.SECONDS));
            all.addAll(black.get(10, TimeUnit.SECONDS));

            Set<Long> seqs = new HashSet<>();
            for (MoveOutcome o : all) {
                MoveRecord rec = o.result().record();
                assertEquals(rec.color().opposite(), o.state().currentTurn());
                assertEquals(rec.color(), pieceAt(o.state(), rec.to()).piece().color());
                assertTrue(seqs.add(o.seq()));
            }
            assertEquals(2 * perSide, seqs.size());
            assertEquals(2L * perSide, seqs.stream().mapToLong(Long::longValue).max().orElse(0));
        } finally {
            pool.shutdownNow();
        }
    }

    private Callable<List<MoveOutcome>> shuttleKnight(CountDownLatch start, int count, String[] out, String[] back) {
        return () -> {
            start.await();
            List<MoveOutcome> accepted = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                String[] m = i % 2 == 0 ? out : back;
                MoveOutcome o = svc.move(m[0], m[1], null);
                while (!o.accepted()) {
                    assertEquals(MoveError.WRONG_TURN, o.result().error());
                    Thread.onSpinWait();
                    o = svc.move(m[0], m[1], null);
                }
                accepted.add(o);
            }
            return accepted;
        };
    }

    private static BoardItem pieceAt(ChessSnapshot s, String square) {
        return s.board().stream()
                .filter(item -> item.position().equals(square))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no piece on " + square));
    }
}
