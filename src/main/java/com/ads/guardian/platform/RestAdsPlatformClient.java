package com.ads.guardian.platform;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class RestAdsPlatformClient implements AdsPlatformClient {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;
    private static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${ads.api.base-url}")
    private String baseUrl;

    @Value("${ads.api.metrics-endpoint:/v1/metrics:search}")
    private String metricsEndpoint;

    @Value("${ads.api.status-endpoint:/v1/entities/{entityId}/status}")
    private String statusEndpoint;

    @Value("${ads.api.token:}")
    private String apiToken;

    @Override
    public Map<String, FetchOutcome> fetchMetrics(Collection<String> entityIds, ReportingWindow window) {
        Map<String, FetchOutcome> outcomes = new HashMap<>();
        if (entityIds.isEmpty()) {
            return outcomes;
        }

        try {
            ObjectNode body = objectMapper.createObjectNode();
            ArrayNode ids = body.putArray("entityIds");
            entityIds.forEach(ids::add);
            body.put("from", window.getFrom().format(TIME_FORMAT));
            body.put("to", window.getTo().format(TIME_FORMAT));

            String url = baseUrl + metricsEndpoint;
            log.debug("Fetching metrics for {} entities from: {}", entityIds.size(), url);

            String response = restTemplate.postForObject(url, new HttpEntity<>(body.toString(), headers(null)), String.class);

            if (response == null || response.isBlank()) {
                log.warn("Empty metrics response from ads platform");
                failAll(outcomes, entityIds, true, "Empty metrics response", null);
                return outcomes;
            }

            parseMetrics(response, outcomes);

        } catch (HttpStatusCodeException e) {
            boolean retryable = isRetryable(e.getStatusCode());
            log.error("Metrics request failed with status {}: {}", e.getStatusCode().value(), e.getMessage());
            failAll(outcomes, entityIds, retryable, "HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.error("Metrics request I/O failure: {}", e.getMessage());
            failAll(outcomes, entityIds, true, "I/O failure", e);
        } catch (RestClientException e) {
            log.error("Error fetching metrics: {}", e.getMessage());
            failAll(outcomes, entityIds, true, e.getMessage(), e);
        } catch (Exception e) {
            log.error("Unexpected error fetching metrics: {}", e.getMessage());
            failAll(outcomes, entityIds, true, e.getMessage(), e);
        }

        for (String id : entityIds) {
            outcomes.computeIfAbsent(id, missing -> FetchOutcome.failure(
                    new TransientFetchException(missing, "No metrics returned for entity")));
        }
        return outcomes;
    }

    @Override
    public StatusUpdateAck setEntityStatus(String entityId, PlatformStatus targetStatus, String idempotencyKey) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl + statusEndpoint)
                .buildAndExpand(entityId)
                .toUriString();

        ObjectNode body = objectMapper.createObjectNode();
        body.put("status", targetStatus.name());

        try {
            String response = restTemplate.postForObject(url,
                    new HttpEntity<>(body.toString(), headers(idempotencyKey)), String.class);

            boolean duplicate = false;
            if (response != null && !response.isBlank()) {
                JsonNode root = objectMapper.readTree(response);
                duplicate = root.path("duplicate").asBoolean(false);
            }

            return StatusUpdateAck.builder()
                    .entityId(entityId)
                    .status(targetStatus)
                    .idempotencyKey(idempotencyKey)
                    .duplicate(duplicate)
                    .acknowledgedAt(LocalDateTime.now(ZoneOffset.UTC))
                    .build();

        } catch (HttpStatusCodeException e) {
            throw new PlatformException("Status update for " + entityId + " failed with HTTP "
                    + e.getStatusCode().value(), isRetryable(e.getStatusCode()), e);
        } catch (ResourceAccessException e) {
            throw new PlatformException("Status update for " + entityId + " timed out: " + e.getMessage(), true, e);
        } catch (RestClientException e) {
            throw new PlatformException("Status update for " + entityId + " failed: " + e.getMessage(), true, e);
        } catch (Exception e) {
            throw new PlatformException("Unexpected response for " + entityId + ": " + e.getMessage(), false, e);
        }
    }

    private void parseMetrics(String response, Map<String, FetchOutcome> outcomes) throws Exception {
        JsonNode root = objectMapper.readTree(response);

        for (JsonNode node : root.path("results")) {
            String entityId = node.path("entityId").asText();
            MetricsSnapshot snapshot = MetricsSnapshot.builder()
                    .entityId(entityId)
                    .spend(decimal(node, "spend"))
                    .conversions(decimal(node, "conversions"))
                    .conversionValue(node.hasNonNull("conversionValue") ? decimal(node, "conversionValue") : null)
                    .clicks(node.path("clicks").asLong(0))
                    .impressions(node.path("impressions").asLong(0))
                    .elapsedDayFraction(node.hasNonNull("elapsedDayFraction")
                            ? node.get("elapsedDayFraction").asDouble() : null)
                    .build();
            outcomes.put(entityId, FetchOutcome.success(snapshot));
        }

        for (JsonNode node : root.path("errors")) {
            String entityId = node.path("entityId").asText();
            String code = node.path("code").asText("UNKNOWN");
            String message = node.path("message").asText(code);
            outcomes.put(entityId, FetchOutcome.failure(errorFor(entityId, code, message)));
        }
    }

    private FetchException errorFor(String entityId, String code, String message) {
        return switch (code) {
            case "NOT_FOUND", "PERMISSION_DENIED", "UNAUTHENTICATED" -> new PermanentFetchException(entityId, code + ": " + message);
            default -> new TransientFetchException(entityId, code + ": " + message);
        };
    }

    private void failAll(Map<String, FetchOutcome> outcomes, Collection<String> entityIds,
                         boolean retryable, String message, Throwable cause) {
        for (String id : entityIds) {
            FetchException error = retryable
                    ? new TransientFetchException(id, message, cause)
                    : new PermanentFetchException(id, message, cause);
            outcomes.put(id, FetchOutcome.failure(error));
        }
    }

    private boolean isRetryable(HttpStatusCode status) {
        return status.value() == 429 || status.is5xxServerError();
    }

    private HttpHeaders headers(String idempotencyKey) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiToken != null && !apiToken.isBlank()) {
            headers.setBearerAuth(apiToken);
        }
        if (idempotencyKey != null) {
            headers.set(IDEMPOTENCY_HEADER, idempotencyKey);
        }
        return headers;
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(value.asText());
    }
}
