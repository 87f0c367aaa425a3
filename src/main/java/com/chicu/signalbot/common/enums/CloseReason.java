package com.chicu.signalbot.common.enums;

import java.util.Locale;

public enum CloseReason {
    STOP,
    TAKE,
    TTL,
    MANUAL;

    /** Код для хранения/ответа API: stop / take / ttl / manual. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
