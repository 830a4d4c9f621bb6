package com.agentcouncil.common.model;

/** Winner of the bull/bear research debate. */
public enum DebateSide {
    BULL,
    BEAR,
    TIE;

    public TradeAction impliedAction() {
        return switch (this) {
            case BULL -> TradeAction.BUY;
            case BEAR -> TradeAction.SELL;
            case TIE  -> TradeAction.HOLD;
        };
    }
}
