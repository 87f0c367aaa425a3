package com.chicu.signalbot.signal;

import com.chicu.signalbot.common.enums.StrategyTag;
import lombok.Builder;

import java.util.List;

/**
 * Фильтры выдачи сканера.
 *
 * @param minConfidence       минимальная уверенность (включительно)
 * @param tagFilter           пусто — любые теги, иначе нужен хотя бы один из списка
 * @param maxSignalsPerSymbol 0 — без ограничения
 * @param ordering            порядок внутри символа перед обрезкой
 */
@Builder(toBuilder = true)
public record SignalFilter(int minConfidence, List<StrategyTag> tagFilter, int maxSignalsPerSymbol,
                           SignalOrdering ordering) {

    public SignalFilter {
        tagFilter = tagFilter == null ? List.of() : List.copyOf(tagFilter);
        ordering = ordering == null ? SignalOrdering.CONFIDENCE : ordering;
        if (minConfidence < 0 || minConfidence > 100) {
            throw new IllegalArgumentException("minConfidence must be in [0,100]");
        }
        if (maxSignalsPerSymbol < 0) {
            throw new IllegalArgumentException("maxSignalsPerSymbol must be >= 0");
        }
    }

    public static SignalFilter permissive() {
        return new SignalFilter(0, List.of(), 0, SignalOrdering.CONFIDENCE);
    }
}
