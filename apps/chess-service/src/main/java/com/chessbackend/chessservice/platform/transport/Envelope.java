package com.chessbackend.chessservice.platform.transport;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 推送消息外壳
 * - 强类型泛型载荷：Envelope<T>
 * - 字段：kind / game / payload / ts / seq
 *
 * 用法示例：
 *   Envelope<ChessSnapshot> msg = Envelope.state("chess", snapshot, outcome.seq());
 *
 * @param kind    消息类别：STATE=完整状态，EVENT=增量事件
 * @param game    游戏标识（chess）
 * @param payload 载荷
 * @param ts      服务器时间戳（ms）
 * @param seq     递增序号（成功走子与重开各加一，重开不清零），同一步的 STATE 与 EVENT 共用一个值，前端按 topic 据此丢弃乱序的旧消息
 */
public record Envelope<T>(Kind kind, String game, T payload, long ts, long seq) implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    public enum Kind { STATE, EVENT }

    public Envelope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(game, "game");
    }

    public static <T> Envelope<T> of(Kind kind, String game, T payload, long seq) {
        return new Envelope<>(kind, game, payload, Instant.now().toEpochMilli(), seq);
    }

    /** 完整状态广播 */
    public static <T> Envelope<T> state(String game, T payload, long seq) {
        return of(Kind.STATE, game, payload, seq);
    }

    /** 增量事件（如一步棋） */
    public static <T> Envelope<T> event(String game, T payload, long seq) {
        return of(Kind.EVENT, game, payload, seq);
    }
}
