package com.placeguide.recommend.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
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
public class EmbeddingGateway {
    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(
        @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
        EmbeddingProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public List<Double> embed(String text, Integer timeBudgetMs) {
        return embed(text, timeBudgetMs, null, null);
    }

    public List<Double> embed(String text, Integer timeBudgetMs, String traceId, String requestId) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }
        EmbeddingRequest request = new EmbeddingRequest();
        request.setModel(properties.getModel());
        request.setInput(text);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }
        if (traceId != null && !traceId.isBlank()) {
            headers.add("x-trace-id", traceId);
        }
        if (requestId != null && !requestId.isBlank()) {
            headers.add("x-request-id", requestId);
        }
        HttpEntity<EmbeddingRequest> entity = new HttpEntity<>(request, headers);

        int retries = Math.max(0, properties.getRetryCount());
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                ResponseEntity<EmbeddingResponse> response = restTemplateFor(timeBudgetMs).exchange(
                    buildUrl("/embeddings"),
                    HttpMethod.POST,
                    entity,
                    EmbeddingResponse.class
                );
                return extractVector(response.getBody());
            } catch (ResourceAccessException e) {
                if (attempt >= retries) {
                    String reason = e.getCause() instanceof java.net.SocketTimeoutException
                        ? "embed_timeout"
                        : "embed_unavailable";
                    throw new EmbeddingUnavailableException(reason, e);
                }
            } catch (HttpStatusCodeException e) {
                if (attempt >= retries) {
                    throw new EmbeddingUnavailableException("embed_http_" + e.getStatusCode().value(), e);
                }
            }
        }
        throw new EmbeddingUnavailableException("embed_unavailable");
    }

    private List<Double> extractVector(EmbeddingResponse body) {
        if (body == null || body.getData() == null || body.getData().isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_response");
        }
        List<Double> vector = body.getData().get(0).getEmbedding();
        if (vector == null || vector.isEmpty()) {
            throw new EmbeddingUnavailableException("embed_empty_vector");
        }
        if (properties.getDimension() > 0 && vector.size() != properties.getDimension()) {
            throw new EmbeddingUnavailableException("embed_dimension_mismatch");
        }
        return vector;
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
        factory.setConnectTimeout(timeBudgetMs);
        factory.setReadTimeout(timeBudgetMs);
        return new RestTemplate(factory);
    }

    public static class EmbeddingRequest {
        private String model;
        private String input;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getInput() {
            return input;
        }

        public void setInput(String input) {
            this.input = input;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingResponse {
        private String model;
        private List<EmbeddingData> data;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<EmbeddingData> getData() {
            return data;
        }

        public void setData(List<EmbeddingData> data) {
            this.data = data;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingData {
        private int index;
        private List<Double> embedding;

        public int getIndex() {
            return index;
        }

        public void setIndex(int index) {
            this.index = index;
        }

        public List<Double> getEmbedding() {
            return embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }
    }
}
