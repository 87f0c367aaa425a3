package com.chicu.signalbot.smoke;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class HealthSmokeTest {

    @LocalServerPort
    int port;

    TestRestTemplate rest = new TestRestTemplate();

    @Test
    void actuatorHealthShouldBeUp() {
        String url = "http://localhost:" + port + "/actuator/health";
        ResponseEntity<Map> resp = rest.getForEntity(url, Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertNotNull(resp.getBody());
        assertEquals("UP", resp.getBody().get("status"));
    }

    @Test
    void engineStatusShouldBeAvailable_andStoppedByDefault() {
        ResponseEntity<Map> resp = rest.getForEntity("http://localhost:" + port + "/api/bot/status", Map.class);

        assertEquals(200, resp.getStatusCode().value());
        assertEquals(Boolean.FALSE, resp.getBody().get("running"));
        assertEquals("SUPERVISED", resp.getBody().get("mode"));
    }
}
