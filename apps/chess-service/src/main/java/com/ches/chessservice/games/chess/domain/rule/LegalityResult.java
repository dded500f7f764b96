package com.ches.chessservice.games.chess.domain.rule;

/**
 * 走法校验结果。不合法是正常返回值，不是异常。
 * @param legal  是否合法
 * @param reason 不合法的原因；合法时为 null
 */
public record LegalityResult(boolean legal, IllegalReason reason) {

    private static final LegalityResult LEGAL = new LegalityResult(true, null);

    public static LegalityResult legalMove() {
        return LEGAL;
    }

    public static LegalityResult illegal(IllegalReason reason) {
        return new LegalityResult(false, reason);
    }
}
