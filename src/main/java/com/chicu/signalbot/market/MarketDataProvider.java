package com.chicu.signalbot.market;

import com.chicu.signalbot.common.time.Timeframe;
import com.chicu.signalbot.market.model.Candle;

import java.util.List;

/**
 * Источник свечей и текущих цен.
 *
 * Ошибки всегда пробрасываются как {@link MarketDataException},
 * без тихих дефолтов вроде цены 0.
 */
public interface MarketDataProvider {

    /**
     * Свечи по возрастанию времени, без дубликатов.
     */
    List<Candle> getKlines(String symbol, Timeframe timeframe, int limit) throws MarketDataException;

    /**
     * Последняя цена, строго больше нуля.
     */
    double getCurrentPrice(String symbol) throws MarketDataException;
}
