package com.agentcouncil.common.model;

/**
 * The enumerated trading actions a decision (or an analyst signal) can carry.
 *
 * <ul>
 *   <li>BUY : enter or add to a long position</li>
 *   <li>SELL: exit or enter short</li>
 *   <li>HOLD: no new position</li>
 * </ul>
 */
public enum TradeAction {

    BUY,
    SELL,
    HOLD;

    /** Lenient parse: anything that is not BUY or SELL maps to HOLD. */
    public static TradeAction fromSignal(String signal) {
        if ("BUY".equalsIgnoreCase(signal))  return BUY;
        if ("SELL".equalsIgnoreCase(signal)) return SELL;
        return HOLD;
    }

    public boolean isDirectional() {
        return this != HOLD;
    }

    /** True when this signal, as evidence, argues against {@code action}. */
    public boolean contradicts(TradeAction action) {
        return (this == BUY && action == SELL) || (this == SELL && action == BUY);
    }
}
