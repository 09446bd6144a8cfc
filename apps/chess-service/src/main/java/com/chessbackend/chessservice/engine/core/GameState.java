package com.chessbackend.chessservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：便于比对（校验失败前后状态是否一致）、保存/恢复等。
 * - 具体游戏（如 ChessState）实现此接口。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝快照。
     */
    GameState copy();
}
