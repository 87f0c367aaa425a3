package com.chicu.signalbot.signal;

import com.chicu.signalbot.common.enums.StrategyTag;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.common.time.Timeframe;
import lombok.Builder;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Кандидат в сделку. Значение, не сущность: после создания не меняется
 * и не сохраняется в БД (в ордере остаётся только signalId).
 */
@Builder(toBuilder = true)
public record Signal(
        String id,
        String symbol,
        Timeframe timeframe,
        TradeSide side,
        double entry,
        double stop,
        double take,
        int confidence,
        Set<StrategyTag> tags,
        String reason,
        Instant createdAt,
        double riskReward
) {

    public Signal {
        if (symbol == null || timeframe == null || side == null || createdAt == null) {
            throw new IllegalArgumentException("Signal: symbol, timeframe, side and createdAt are required");
        }
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("Signal: confidence out of [0,100]: " + confidence);
        }
        tags = (tags == null || tags.isEmpty())
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(tags));
    }

    /** Ключ дедупликации: (symbol, timeframe, side). */
    public SignalKey key() {
        return new SignalKey(symbol, timeframe, side);
    }

    public boolean hasTag(StrategyTag tag) {
        return tags.contains(tag);
    }

    /** Есть ли хоть один тег из списка. Пустой список пропускает всё. */
    public boolean hasAnyTag(Collection<StrategyTag> allowed) {
        if (allowed == null || allowed.isEmpty()) {
            return true;
        }
        for (StrategyTag t : allowed) {
            if (tags.contains(t)) {
                return true;
            }
        }
        return false;
    }

    public record SignalKey(String symbol, Timeframe timeframe, TradeSide side) {
    }
}
