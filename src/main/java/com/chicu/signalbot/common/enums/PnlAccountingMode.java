package com.chicu.signalbot.common.enums;

/**
 * Как считать PnL закрытой сделки.
 *
 * R_MULTIPLE — realizedR × риск на сделку (по умолчанию),
 * PERCENT    — процент движения × номинал позиции.
 */
public enum PnlAccountingMode {
    R_MULTIPLE,
    PERCENT
}
