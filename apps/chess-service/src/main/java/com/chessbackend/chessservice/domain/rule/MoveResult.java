package com.chessbackend.chessservice.domain.rule;

import com.chessbackend.chessservice.domain.model.MoveRecord;

import java.util.Objects;

/**
 * 一次走子请求的结果：要么成功（带走子记录），要么被拒绝（带 {@link Violation}）。
 * 拒绝以返回值表达，不抛异常，调用方必须显式处理失败分支。
 */
public final class MoveResult {

    private final MoveRecord record;
    private final Violation violation;

    private MoveResult(MoveRecord record, Violation violation) {
        this.record = record;
        this.violation = violation;
    }

    public static MoveResult ok(MoveRecord record) {
        return new MoveResult(Objects.requireNonNull(record, "record"), null);
    }

    public static MoveResult rejected(Violation violation) {
        return new MoveResult(null, Objects.requireNonNull(violation, "violation"));
    }

    public static MoveResult rejected(MoveError error, String message) {
        return rejected(Violation.of(error, message));
    }

    public boolean accepted() { return violation == null; }

    /** 成功时的走子记录；被拒绝时为 null */
    public MoveRecord record() { return record; }

    /** 被拒绝时的原因；成功时为 null */
    public Violation violation() { return violation; }

    /** 被拒绝时的错误种类；成功时为 null */
    public MoveError error() {
        return violation == null ? null : violation.error();
    }

    @Override
    public String toString() {
        return accepted()
                ? "MoveResult{ok " + record.from() + "-" + record.to() + "}"
                : "MoveResult{rejected " + violation.error() + ": " + violation.message() + "}";
    }
}
