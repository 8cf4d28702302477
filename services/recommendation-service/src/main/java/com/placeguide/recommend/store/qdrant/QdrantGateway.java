package com.placeguide.recommend.store.qdrant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.placeguide.recommend.store.StoreRequestException;
import com.placeguide.recommend.store.StoreUnavailableException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

@Component
public class QdrantGateway {
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final QdrantProperties properties;

    public QdrantGateway(
        @Qualifier("qdrantRestTemplate") RestTemplate restTemplate,
        ObjectMapper objectMapper,
        QdrantProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public List<QdrantHit> search(List<Double> vector, int limit, double minRating, Integer timeBudgetMs) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("vector", vector);
        body.put("limit", limit);
        body.put("with_payload", true);
        if (minRating > 0.0) {
            Map<String, Object> condition = new LinkedHashMap<>();
            condition.put("key", "rating");
            condition.put("range", Map.of("gte", minRating));
            body.put("filter", Map.of("must", List.of(condition)));
        }

        JsonNode response = postJson("/collections/" + properties.getCollection() + "/points/search", body, timeBudgetMs);
        List<QdrantHit> hits = new ArrayList<>();
        for (JsonNode point : response.path("result")) {
            JsonNode id = point.path("id");
            if (!id.canConvertToLong()) {
                continue;
            }
            hits.add(new QdrantHit(id.asLong(), point.path("score").asDouble(0.0), point.path("payload")));
        }
        return hits;
    }

    private JsonNode postJson(String path, Object body, Integer timeBudgetMs) {
        String url = buildUrl(path);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.add("api-key", properties.getApiKey());
        }
        try {
            String payload = objectMapper.writeValueAsString(body);
            ResponseEntity<String> response = restTemplateFor(timeBudgetMs).exchange(
                url,
                HttpMethod.POST,
                new HttpEntity<>(payload, headers),
                String.class
            );
            return objectMapper.readTree(response.getBody() == null ? "{}" : response.getBody());
        } catch (ResourceAccessException e) {
            throw new StoreUnavailableException("Qdrant unreachable: " + url, e);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (status == 429 || status == 502 || status == 503 || status == 504) {
                throw new StoreUnavailableException("Qdrant unavailable: " + status, e);
            }
            throw new StoreRequestException("Qdrant error: " + status, e);
        } catch (JsonProcessingException e) {
            throw new StoreRequestException("Failed to parse Qdrant response", e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    private RestTemplate restTemplateFor(Integer timeBudgetMs) {
        if (timeBudgetMs == null) {
            return restTemplate;
        }
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Math.min(timeBudgetMs, properties.getConnectTimeoutMs()));
        factory.setReadTimeout(timeBudgetMs);
        return new RestTemplate(factory);
    }
}
