package com.chicu.signalbot.market.impl;

import com.chicu.signalbot.common.time.Timeframe;
import com.chicu.signalbot.config.SignalBotProperties;
import com.chicu.signalbot.market.MarketDataException;
import com.chicu.signalbot.market.MarketDataProvider;
import com.chicu.signalbot.market.model.Candle;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Публичный REST Binance: /api/v3/klines и /api/v3/ticker/price.
 * Ответы кешируются на короткое время, чтобы сканер и мониторы
 * не дёргали биржу за одним и тем же символом несколько раз за тик.
 */
@Slf4j
@Component
public class BinanceMarketDataProvider implements MarketDataProvider {

    private final RestTemplate rest;
    private final String baseUrl;
    private final long cacheTtlMs;

    private final Map<String, CachedKlines> klinesCache = new ConcurrentHashMap<>();
    private final Map<String, CachedPrice> priceCache = new ConcurrentHashMap<>();

    public BinanceMarketDataProvider(@Qualifier("marketRestTemplate") RestTemplate rest,
                                     SignalBotProperties properties) {
        this.rest = rest;
        this.baseUrl = properties.getMarket().getBaseUrl();
        this.cacheTtlMs = properties.getMarket().getCacheTtl().toMillis();
    }

    // =====================================================================
    // KLINES
    // =====================================================================

    @Override
    public List<Candle> getKlines(String symbol, Timeframe timeframe, int limit) throws MarketDataException {
        String sym = normalize(symbol);
        String key = sym + "|" + timeframe.getCode() + "|" + limit;

        CachedKlines cached = klinesCache.get(key);
        if (cached != null && !cached.isExpired(cacheTtlMs)) {
            return cached.candles();
        }

        String url = baseUrl + "/api/v3/klines?symbol=" + sym +
                "&interval=" + timeframe.getCode() + "&limit=" + limit;

        String body = fetch(url, sym);
        List<Candle> candles;
        try {
            candles = parseKlines(new JSONArray(body));
        } catch (JSONException e) {
            throw new MarketDataException("Bad klines payload for " + sym + ": " + e.getMessage(), e);
        }

        klinesCache.put(key, new CachedKlines(candles, System.currentTimeMillis()));
        log.debug("📥 [MARKET] klines {} {} -> {} bars", sym, timeframe.getCode(), candles.size());
        return candles;
    }

    /**
     * Разбор массива свечей Binance. Дубликаты по времени отбрасываются,
     * результат отсортирован по возрастанию.
     */
    static List<Candle> parseKlines(JSONArray arr) {
        Map<Long, Candle> byTime = new TreeMap<>();
        for (int i = 0; i < arr.length(); i++) {
            JSONArray c = arr.getJSONArray(i);
            Candle candle = new Candle(
                    c.getLong(0),
                    c.getDouble(1),
                    c.getDouble(2),
                    c.getDouble(3),
                    c.getDouble(4),
                    c.getDouble(5)
            );
            byTime.putIfAbsent(candle.time(), candle);
        }
        List<Candle> out = new ArrayList<>(byTime.values());
        out.sort(Comparator.comparingLong(Candle::time));
        return List.copyOf(out);
    }

    // =====================================================================
    // PRICE
    // =====================================================================

    @Override
    public double getCurrentPrice(String symbol) throws MarketDataException {
        String sym = normalize(symbol);

        CachedPrice cached = priceCache.get(sym);
        if (cached != null && !cached.isExpired(cacheTtlMs)) {
            return cached.price();
        }

        String body = fetch(baseUrl + "/api/v3/ticker/price?symbol=" + sym, sym);
        double price;
        try {
            price = new JSONObject(body).getDouble("price");
        } catch (JSONException e) {
            throw new MarketDataException("Bad price payload for " + sym + ": " + e.getMessage(), e);
        }

        if (!(price > 0) || !Double.isFinite(price)) {
            throw new MarketDataException("Non-positive price for " + sym + ": " + price);
        }

        priceCache.put(sym, new CachedPrice(price, System.currentTimeMillis()));
        return price;
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    private String fetch(String url, String symbol) throws MarketDataException {
        try {
            String body = rest.getForObject(url, String.class);
            if (body == null || body.isBlank()) {
                throw new MarketDataException("Empty response for " + symbol);
            }
            return body;
        } catch (RestClientException e) {
            log.warn("⚠️ [MARKET] Binance request failed {}: {}", symbol, e.getMessage());
            throw new MarketDataException("Binance request failed for " + symbol + ": " + e.getMessage(), e);
        }
    }

    private static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }

    private record CachedKlines(List<Candle> candles, long fetchedAt) {
        boolean isExpired(long ttlMs) {
            return System.currentTimeMillis() - fetchedAt > ttlMs;
        }
    }

    private record CachedPrice(double price, long fetchedAt) {
        boolean isExpired(long ttlMs) {
            return System.currentTimeMillis() - fetchedAt > ttlMs;
        }
    }
}
