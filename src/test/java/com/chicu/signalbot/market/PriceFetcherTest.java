package com.chicu.signalbot.market;

import com.chicu.signalbot.config.SignalBotProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PriceFetcherTest {

    private MarketDataProvider provider;
    private ExecutorService executor;
    private PriceFetcher fetcher;

    @BeforeEach
    void setUp() {
        provider = mock(MarketDataProvider.class);
        executor = Executors.newFixedThreadPool(4);
        SignalBotProperties properties = new SignalBotProperties();
        properties.getScan().setFetchTimeout(Duration.ofMillis(300));
        fetcher = new PriceFetcher(provider, executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void collectsPricesAndFailuresPerSymbol() throws Exception {
        when(provider.getCurrentPrice("BTCUSDT")).thenReturn(65000.0);
        when(provider.getCurrentPrice("ETHUSDT")).thenThrow(new MarketDataException("HTTP 429"));
        when(provider.getCurrentPrice("SOLUSDT")).thenAnswer(inv -> {
            Thread.sleep(5_000);
            return 150.0;
        });

        PriceBatch batch = fetcher.fetch(List.of("BTCUSDT", "ETHUSDT", "SOLUSDT", "BTCUSDT"));

        assertEquals(65000.0, batch.price("BTCUSDT").orElseThrow());
        assertTrue(batch.price("ETHUSDT").isEmpty());
        assertEquals("HTTP 429", batch.failure("ETHUSDT"));
        assertEquals("timeout", batch.failure("SOLUSDT"));
        assertEquals(1, batch.prices().size());
    }
}
