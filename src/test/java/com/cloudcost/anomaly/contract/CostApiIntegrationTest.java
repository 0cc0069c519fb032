package com.cloudcost.anomaly.contract;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end checks against the running application in mock mode.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class CostApiIntegrationTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void costs_defaultWindow_isThirtyAscendingDaysEndingToday() {
        DocumentContext json = getJson("/api/v1/costs");

        List<String> dates = json.read("$.data[*].date");
        assertThat(dates).hasSize(30);
        assertThat(dates).isSorted();
        assertThat(LocalDate.parse(dates.get(29))).isEqualTo(LocalDate.now(ZoneOffset.UTC));
        assertThat((String) json.read("$.mode")).isEqualTo("mock");
    }

    @Test
    void costs_oversizedWindow_isClamped() {
        List<String> dates = getJson("/api/v1/costs?days=500").read("$.data[*].date");
        assertThat(dates).hasSize(90);
    }

    @Test
    void anomalies_severityMatchesZScore() {
        DocumentContext json = getJson("/api/v1/anomalies?threshold=1.5&days=60");

        List<Map<String, Object>> findings = json.read("$.data");
        assertThat((Integer) json.read("$.count")).isEqualTo(findings.size());
        assertThat((Double) json.read("$.threshold")).isEqualTo(1.5);
        for (Map<String, Object> finding : findings) {
            double z = ((Number) finding.get("zScore")).doubleValue();
            assertThat(Math.abs(z)).isGreaterThan(1.5);
            assertThat(finding.get("severity")).isEqualTo(Math.abs(z) > 3.0 ? "high" : "medium");
        }
    }

    @Test
    void summary_matchesSeriesTotals() {
        List<Number> totals = getJson("/api/v1/costs?days=10").read("$.data[*].totalCost");
        double expected = totals.stream().mapToDouble(Number::doubleValue).sum();

        DocumentContext summary = getJson("/api/v1/summary?days=10");
        assertThat(((Number) summary.read("$.data.totalCost")).doubleValue())
                .isCloseTo(expected, org.assertj.core.data.Offset.offset(0.01));
        assertThat((Integer) summary.read("$.data.days")).isEqualTo(10);
    }

    @Test
    void events_ingestedEventIsCountedInStatus() {
        long before = ((Number) getJson("/api/v1/status").read("$.eventCount")).longValue();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String body = "{\"ts\":\"2024-02-01T08:00:00Z\",\"service\":\"storage\",\"resourceGroup\":\"rg-it\",\"costUsd\":4.2}";
        ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/events",
                new HttpEntity<>(body, headers), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat((String) JsonPath.parse(response.getBody()).read("$.id"))
                .isEqualTo("evt_2024-02-01T08:00:00Z_storage_rg-it");
        long after = ((Number) getJson("/api/v1/status").read("$.eventCount")).longValue();
        assertThat(after).isEqualTo(before + 1);
    }

    @Test
    void events_invalidBody_returns400() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> response = restTemplate.postForEntity("/api/v1/events",
                new HttpEntity<>("{\"service\":\"storage\"}", headers), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat((Boolean) JsonPath.parse(response.getBody()).read("$.success")).isFalse();
    }

    private DocumentContext getJson(String path) {
        ResponseEntity<String> response = restTemplate.getForEntity(path, String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        return JsonPath.parse(response.getBody());
    }
}
