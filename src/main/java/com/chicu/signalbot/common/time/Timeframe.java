package com.chicu.signalbot.common.time;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Таймфрейм сканирования сигналов.
 * Хранит код Binance и время жизни лимитного ордера по умолчанию.
 * Парсинг через словарь алиасов, без switch по строкам.
 */
public enum Timeframe {

    M5(300, "5m", Duration.ofMinutes(30)),
    M15(900, "15m", Duration.ofHours(2)),
    H1(3600, "1h", Duration.ofHours(6)),
    H4(14400, "4h", Duration.ofHours(24)),
    D1(86400, "1d", Duration.ofHours(24));

    /** TTL ордера, если таймфрейм не распознан. */
    public static final Duration DEFAULT_ORDER_TTL = Duration.ofHours(6);

    private final int stepSeconds;
    private final String code;
    private final Duration defaultOrderTtl;

    Timeframe(int stepSeconds, String code, Duration defaultOrderTtl) {
        this.stepSeconds = stepSeconds;
        this.code = code;
        this.defaultOrderTtl = defaultOrderTtl;
    }

    /** Кол-во секунд в одном баре. */
    public int getStepSeconds() {
        return stepSeconds;
    }

    /** Код, совместимый с Binance (5m, 15m, 1h ...). */
    @JsonValue
    public String getCode() {
        return code;
    }

    public Duration getDefaultOrderTtl() {
        return defaultOrderTtl;
    }

    @Override
    public String toString() {
        return code;
    }

    // ---------- Разбор строк ----------

    private static final Map<String, Timeframe> LOOKUP;

    static {
        Map<String, Timeframe> m = new HashMap<>();
        putAll(m, M5, "5m", "05m", "5min", "5 minutes");
        putAll(m, M15, "15m", "15min", "15 minutes");
        putAll(m, H1, "1h", "01h", "1hr", "1 hour", "60m");
        putAll(m, H4, "4h", "04h", "4hr", "4 hours");
        putAll(m, D1, "1d", "01d", "1day", "1 day");
        LOOKUP = Collections.unmodifiableMap(m);
    }

    private static String norm(String s) {
        return s == null ? null : s.trim().toLowerCase(Locale.ROOT).replace(" ", "");
    }

    private static void putAll(Map<String, Timeframe> m, Timeframe tf, String... keys) {
        for (String k : keys) {
            m.put(norm(k), tf);
        }
        m.put(norm(tf.name()), tf);
    }

    /** Мягкий разбор: пусто, если строка не распознана. */
    public static Optional<Timeframe> find(String s) {
        if (s == null || s.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(LOOKUP.get(norm(s)));
    }

    /**
     * Строгий разбор. Неизвестный таймфрейм — ошибка конфигурации.
     */
    @JsonCreator
    public static Timeframe from(String s) {
        return find(s).orElseThrow(() ->
                new IllegalArgumentException("Unknown timeframe: " + s));
    }
}
