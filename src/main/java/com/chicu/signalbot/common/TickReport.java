package com.chicu.signalbot.common;

import java.time.Instant;
import java.util.List;

/**
 * Итог одного тика монитора.
 *
 * @param examined    сколько записей просмотрено
 * @param transitions сколько переходов статуса применено
 * @param failures    сколько записей пропущено из-за ошибок (повтор на следующем тике)
 */
public record TickReport(String kind, Instant at, int examined, int transitions, int failures, List<String> errors) {

    public TickReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static TickReport empty(String kind, Instant at) {
        return new TickReport(kind, at, 0, 0, 0, List.of());
    }

    public String summary() {
        return kind + ": " + examined + " examined, " + transitions + " transitions, " + failures + " failed";
    }
}
