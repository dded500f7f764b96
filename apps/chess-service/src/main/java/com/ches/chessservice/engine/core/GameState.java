package com.ches.chessservice.engine.core;

/**
 * 游戏状态快照接口。
 * - 必须可 copy：便于推演、保存/恢复、对外只读输出等。
 * - 具体游戏（如 ChessState）实现此接口。
 */
public interface GameState {

    /**
     * 返回当前状态的深拷贝快照（与原状态不共享任何可变对象）。
     */
    GameState copy();
}
