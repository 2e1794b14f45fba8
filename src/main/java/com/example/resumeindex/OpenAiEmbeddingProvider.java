package com.example.resumeindex;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls the OpenAI-compatible {@code /v1/embeddings} endpoint. Enabled with {@code embedding.provider=openai}.
 */
@Service
@ConditionalOnProperty(name = "embedding.provider", havingValue = "openai")
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private final RestTemplate restTemplate;
    private final String apiKey;
    private final String baseUrl;

    public OpenAiEmbeddingProvider(@Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
                                   @Value("${openai.api.key:}") String apiKey,
                                   @Value("${openai.api.base-url:https://api.openai.com}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public List<EmbeddingResult> embedBatch(List<String> texts, String model) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("openai.api.key is not set.");
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(apiKey);
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("input", texts);

        ResponseEntity<EmbeddingsResponse> resp;
        try {
            resp = restTemplate.exchange(baseUrl + "/v1/embeddings", HttpMethod.POST,
                    new HttpEntity<>(body, headers), EmbeddingsResponse.class);
        } catch (RestClientException e) {
            log.warn("OpenAI embeddings call failed for {} text(s): {}", texts.size(), e.getMessage());
            throw new UpstreamException("OpenAI embeddings request failed: " + e.getMessage(), e);
        }
        EmbeddingsResponse payload = resp.getBody();
        if (!resp.getStatusCode().is2xxSuccessful() || payload == null || payload.getData() == null) {
            throw new UpstreamException("OpenAI embeddings response had no data (status " + resp.getStatusCode().value() + ").");
        }

        List<EmbeddingResult> out = new ArrayList<>(payload.getData().size());
        for (EmbeddingItem item : payload.getData()) {
            if (item.getEmbedding() == null) {
                throw new UpstreamException("OpenAI embeddings response item " + item.getIndex() + " has no vector.");
            }
            out.add(new EmbeddingResult(item.getIndex(), item.getEmbedding()));
        }
        return out;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EmbeddingsResponse {
        private List<EmbeddingItem> data;

        public List<EmbeddingItem> getData() { return data; }
        public void setData(List<EmbeddingItem> data) { this.data = data; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class EmbeddingItem {
        private int index;
        private float[] embedding;

        public int getIndex() { return index; }
        public void setIndex(int index) { this.index = index; }
        public float[] getEmbedding() { return embedding; }
        public void setEmbedding(float[] embedding) { this.embedding = embedding; }
    }
}
