package com.chicu.signalbot.trade;

import java.time.Instant;

/**
 * Точка кривой капитала: состояние после закрытия очередной сделки.
 */
public record EquityPoint(Instant closedAt, Long tradeId, String symbol, double realizedR, double runningR, double equity) {
}
