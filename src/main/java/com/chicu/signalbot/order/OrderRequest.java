package com.chicu.signalbot.order;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.common.time.Timeframe;
import lombok.Builder;

/**
 * Параметры нового ордера.
 *
 * @param size размер в единицах актива; null — из риска на сделку
 */
@Builder
public record OrderRequest(
        String signalId,
        String symbol,
        Timeframe timeframe,
        TradeSide side,
        double entry,
        double stop,
        double take,
        Double size,
        ExecutionMode mode
) {
}
