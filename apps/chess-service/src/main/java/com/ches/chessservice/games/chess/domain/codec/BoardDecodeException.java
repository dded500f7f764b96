package com.ches.chessservice.games.chess.domain.codec;

/**
 * 棋盘编码串无法解码（长度不是 6 的倍数、某个字段超出取值范围、同一格出现两枚棋子）。
 * 继承 IllegalArgumentException，Web 层统一映射为 400。
 */
public class BoardDecodeException extends IllegalArgumentException {

    /** 出错记录的下标（从 0 开始）；整体长度错误时为 -1 */
    private final int recordIndex;

    public BoardDecodeException(int recordIndex, String message) {
        super(message);
        this.recordIndex = recordIndex;
    }

    public int getRecordIndex() {
        return recordIndex;
    }
}
