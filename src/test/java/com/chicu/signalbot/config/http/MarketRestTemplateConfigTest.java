package com.chicu.signalbot.config.http;

import com.chicu.signalbot.config.SignalBotProperties;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MarketRestTemplateConfigTest {

    @Test
    void defaults_connectTimeoutSet_readBoundedByFetchTimeout() {
        SignalBotProperties p = new SignalBotProperties();

        ConnectionConfig conn = MarketRestTemplateConfig.connectionConfig(p);
        RequestConfig req = MarketRestTemplateConfig.requestConfig(p);

        assertEquals(3_000, conn.getConnectTimeout().toMilliseconds(), "без таймаута HttpClient ждёт минуты");
        assertEquals(15_000, conn.getSocketTimeout().toMilliseconds());
        assertEquals(15_000, req.getResponseTimeout().toMilliseconds());
        assertEquals(3_000, req.getConnectionRequestTimeout().toMilliseconds());
    }

    @Test
    void shortFetchTimeout_capsConnectTimeout() {
        SignalBotProperties p = new SignalBotProperties();
        p.getScan().setFetchTimeout(Duration.ofMillis(800));

        ConnectionConfig conn = MarketRestTemplateConfig.connectionConfig(p);
        RequestConfig req = MarketRestTemplateConfig.requestConfig(p);

        assertEquals(800, conn.getConnectTimeout().toMilliseconds());
        assertEquals(800, conn.getSocketTimeout().toMilliseconds());
        assertEquals(800, req.getResponseTimeout().toMilliseconds());
    }
}
