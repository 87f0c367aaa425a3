package com.chicu.signalbot.trade;

import com.chicu.signalbot.common.enums.CloseReason;

/**
 * Решение о выходе: причина и цена исполнения.
 * Для stop/take — уровень, для ttl/manual — текущая цена.
 */
public record ExitDecision(CloseReason reason, double price) {
}
