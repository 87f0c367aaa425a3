package com.chicu.signalbot.config;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.MarketBias;
import com.chicu.signalbot.common.enums.PnlAccountingMode;
import com.chicu.signalbot.common.enums.StrategyTag;
import com.chicu.signalbot.common.time.Timeframe;
import com.chicu.signalbot.signal.SignalOrdering;
import com.chicu.signalbot.strategy.StrategyConfig;
import com.chicu.signalbot.strategy.StrategyWeights;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Настройки движка сигналов (префикс {@code signalbot}).
 * Проверяются один раз при создании движка, см. {@link #validate()}.
 */
@Data
@ConfigurationProperties(prefix = "signalbot")
public class SignalBotProperties {

    private Engine engine = new Engine();
    private Scan scan = new Scan();
    private Strategy strategy = new Strategy();
    private Orders orders = new Orders();
    private Trades trades = new Trades();
    private Risk risk = new Risk();
    private Promotion promotion = new Promotion();
    private Market market = new Market();

    @Data
    public static class Engine {
        /** Запускать таймеры сразу после старта приложения. */
        private boolean autoStart = false;
        private Duration scanInterval = Duration.ofMinutes(5);
        private Duration orderMonitorInterval = Duration.ofMinutes(1);
        private Duration tradeMonitorInterval = Duration.ofMinutes(1);
        /** Сколько ждать завершения текущих тиков при остановке. */
        private Duration stopTimeout = Duration.ofSeconds(30);
        /** Потоки для параллельной загрузки данных по символам. */
        private int fetchThreads = 8;
    }

    @Data
    public static class Scan {
        private List<String> symbols = new ArrayList<>(List.of(
                "BTCUSDT", "ETHUSDT", "BNBUSDT", "SOLUSDT", "XRPUSDT", "ADAUSDT"));
        private List<String> timeframes = new ArrayList<>(List.of("5m", "15m", "1h"));
        private int klinesLimit = 200;
        private int minConfidence = 40;
        /** 0 — без ограничения. */
        private int maxSignalsPerSymbol = 3;
        private SignalOrdering ordering = SignalOrdering.CONFIDENCE;
        /** Пусто — пропускать любые теги. */
        private List<StrategyTag> tagFilter = new ArrayList<>();
        /** Максимум ожидания одной пары (загрузка + анализ). */
        private Duration fetchTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Strategy {
        /** balanced / highProb / highR */
        private String preset = "balanced";
        private Boolean fibEnabled;
        private Boolean fvgEnabled;
        private Boolean srEnabled;
        private Boolean trendEnabled;
        private Boolean rsiEnabled;
        private MarketBias marketBias;
        /** Переопределение весов пресета, null — оставить как в пресете. */
        private StrategyWeights weights;
    }

    @Data
    public static class Orders {
        /** Переопределение TTL по коду таймфрейма, например {@code 5m: 45m}. */
        private Map<String, Duration> ttl = new LinkedHashMap<>();
    }

    @Data
    public static class Trades {
        private Duration ttl = Duration.ofHours(24);
        private PnlAccountingMode accountingMode = PnlAccountingMode.R_MULTIPLE;
    }

    @Data
    public static class Risk {
        /** Риск на сделку в валюте котировки (1R). */
        private double riskPerTrade = 100;
        private double initialCapital = 5000;
    }

    @Data
    public static class Promotion {
        private ExecutionMode mode = ExecutionMode.SUPERVISED;
    }

    @Data
    public static class Market {
        private String baseUrl = "https://api.binance.com";
        private Duration cacheTtl = Duration.ofSeconds(30);
        /** Таймаут TCP-подключения, обрезается до scan.fetch-timeout. */
        private Duration connectTimeout = Duration.ofSeconds(3);
    }

    // =====================================================
    // DERIVED
    // =====================================================

    /**
     * Конфигурация детектора из пресета с точечными переопределениями.
     */
    public StrategyConfig toStrategyConfig() {
        StrategyConfig.StrategyConfigBuilder b = StrategyConfig.preset(strategy.getPreset()).toBuilder();
        if (strategy.getFibEnabled() != null) b.fibEnabled(strategy.getFibEnabled());
        if (strategy.getFvgEnabled() != null) b.fvgEnabled(strategy.getFvgEnabled());
        if (strategy.getSrEnabled() != null) b.srEnabled(strategy.getSrEnabled());
        if (strategy.getTrendEnabled() != null) b.trendEnabled(strategy.getTrendEnabled());
        if (strategy.getRsiEnabled() != null) b.rsiEnabled(strategy.getRsiEnabled());
        if (strategy.getMarketBias() != null) b.marketBias(strategy.getMarketBias());
        if (strategy.getWeights() != null) b.weights(strategy.getWeights());
        return b.build().validate();
    }

    public List<Timeframe> scanTimeframes() {
        List<Timeframe> out = new ArrayList<>();
        for (String tf : scan.getTimeframes()) {
            out.add(Timeframe.from(tf));
        }
        return out;
    }

    /** TTL лимитного ордера для таймфрейма (null — дефолт 6 часов). */
    public Duration orderTtl(Timeframe timeframe) {
        if (timeframe == null) {
            return Timeframe.DEFAULT_ORDER_TTL;
        }
        Duration override = orders.getTtl().get(timeframe.getCode());
        return override != null ? override : timeframe.getDefaultOrderTtl();
    }

    // =====================================================
    // VALIDATION
    // =====================================================

    /**
     * Fail-fast проверка. Ошибка конфигурации — IllegalArgumentException.
     */
    public void validate() {
        positive("signalbot.engine.scan-interval", engine.getScanInterval());
        positive("signalbot.engine.order-monitor-interval", engine.getOrderMonitorInterval());
        positive("signalbot.engine.trade-monitor-interval", engine.getTradeMonitorInterval());
        positive("signalbot.engine.stop-timeout", engine.getStopTimeout());
        positive("signalbot.scan.fetch-timeout", scan.getFetchTimeout());
        positive("signalbot.trades.ttl", trades.getTtl());
        positive("signalbot.market.cache-ttl", market.getCacheTtl());
        positive("signalbot.market.connect-timeout", market.getConnectTimeout());

        if (engine.getFetchThreads() < 1) {
            throw new IllegalArgumentException("signalbot.engine.fetch-threads must be >= 1");
        }
        if (scan.getSymbols() == null || scan.getSymbols().isEmpty()) {
            throw new IllegalArgumentException("signalbot.scan.symbols must not be empty");
        }
        scanTimeframes();
        if (scan.getMinConfidence() < 0 || scan.getMinConfidence() > 100) {
            throw new IllegalArgumentException("signalbot.scan.min-confidence must be in [0,100]");
        }
        if (scan.getMaxSignalsPerSymbol() < 0) {
            throw new IllegalArgumentException("signalbot.scan.max-signals-per-symbol must be >= 0");
        }
        for (Map.Entry<String, Duration> e : orders.getTtl().entrySet()) {
            Timeframe.from(e.getKey());
            positive("signalbot.orders.ttl." + e.getKey(), e.getValue());
        }
        if (!(risk.getRiskPerTrade() > 0)) {
            throw new IllegalArgumentException("signalbot.risk.risk-per-trade must be > 0");
        }
        if (trades.getAccountingMode() == null || promotion.getMode() == null) {
            throw new IllegalArgumentException("signalbot.trades.accounting-mode and signalbot.promotion.mode are required");
        }
        toStrategyConfig();
    }

    private static void positive(String name, Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration, got " + d);
        }
    }
}
