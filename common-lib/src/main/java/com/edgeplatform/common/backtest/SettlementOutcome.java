package com.edgeplatform.common.backtest;

/**
 * WIN/LOSS/PUSH are settled. PENDING means no final score yet; UNKNOWN means the pick could
 * not be interpreted against the game.
 */
public enum SettlementOutcome {
    WIN, LOSS, PUSH, PENDING, UNKNOWN;

    public boolean isSettled() {
        return this == WIN || this == LOSS || this == PUSH;
    }
}
