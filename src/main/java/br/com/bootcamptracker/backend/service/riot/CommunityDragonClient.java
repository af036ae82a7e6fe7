package br.com.bootcamptracker.backend.service.riot;

import br.com.bootcamptracker.backend.config.properties.CommunityDragonProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Downloads do Community Dragon usados no refresh das playrates. Falhas de
 * rede são repetidas (3 tentativas, 2s entre elas).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommunityDragonClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final CommunityDragonProperties properties;

    @Retryable(retryFor = RestClientException.class, maxAttempts = 3, backoff = @Backoff(delay = 2000))
    public JsonNode fetchChampionSummary() {
        return fetchJson(properties.getChampionSummaryUrl());
    }

    /**
     * Script JS das estatísticas (as playrates estão embutidas nele).
     */
    @Retryable(retryFor = RestClientException.class, maxAttempts = 3, backoff = @Backoff(delay = 2000))
    public String fetchChampionStatistics() {
        String body = restTemplate.getForObject(properties.getChampionStatisticsUrl(), String.class);
        if (body == null) {
            throw new IllegalStateException("Script de estatísticas vazio");
        }
        return body;
    }

    @Retryable(retryFor = RestClientException.class, maxAttempts = 3, backoff = @Backoff(delay = 2000))
    public JsonNode fetchContentMetadata() {
        return fetchJson(properties.getContentMetadataUrl());
    }

    private JsonNode fetchJson(String url) {
        log.debug("🌐 [CommunityDragon] GET {}", url);
        String body = restTemplate.getForObject(url, String.class);
        if (body == null) {
            throw new IllegalStateException("Resposta vazia de " + url);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON inválido em " + url + ": " + e.getOriginalMessage(), e);
        }
    }
}
