package br.com.bootcamptracker.backend.service.twitch;

import br.com.bootcamptracker.backend.config.properties.TwitchApiProperties;
import br.com.bootcamptracker.backend.dto.TwitchStreamDTO;
import br.com.bootcamptracker.backend.exception.TwitchApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * Cliente da Twitch Helix com token de aplicação (client credentials).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TwitchAPIService {

    // Renova o token 5 minutos antes de expirar
    private static final long TOKEN_SAFETY_MARGIN_SECONDS = 300;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final TwitchApiProperties twitchApiProperties;

    private String accessToken;
    private long tokenExpiresAt = 0;

    public boolean isConfigured() {
        return twitchApiProperties.isConfigured();
    }

    /**
     * Streams ao vivo dos usuários informados. Usuário offline não aparece na
     * lista.
     */
    public List<TwitchStreamDTO> getStreams(List<String> userIds) {
        if (userIds.isEmpty()) {
            return new ArrayList<>();
        }

        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(twitchApiProperties.getBaseUrl() + "/streams");
        userIds.forEach(id -> uri.queryParam("user_id", id));

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(getAccessToken());
        headers.set("Client-Id", twitchApiProperties.getClientId());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        try {
            ResponseEntity<String> response = restTemplate.exchange(uri.build().toUriString(), HttpMethod.GET,
                    new HttpEntity<>(headers), String.class);
            JsonNode data = objectMapper.readTree(response.getBody()).path("data");

            List<TwitchStreamDTO> streams = new ArrayList<>();
            for (JsonNode node : data) {
                streams.add(objectMapper.treeToValue(node, TwitchStreamDTO.class));
            }
            return streams;
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == 401) {
                invalidateToken();
            }
            throw new TwitchApiException(e.getStatusCode().value(), e.getStatusText());
        } catch (RestClientException | JsonProcessingException e) {
            throw new TwitchApiException("Falha ao consultar streams: " + e.getMessage(), e);
        }
    }

    synchronized String getAccessToken() {
        if (accessToken != null && System.currentTimeMillis() < tokenExpiresAt) {
            return accessToken;
        }
        if (!isConfigured()) {
            throw new IllegalStateException("twitch.api.client-id / client-secret não configurados");
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", twitchApiProperties.getClientId());
        form.add("client_secret", twitchApiProperties.getClientSecret());
        form.add("grant_type", "client_credentials");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);

        try {
            String body = restTemplate.postForObject(twitchApiProperties.getTokenUrl(),
                    new HttpEntity<>(form, headers), String.class);
            JsonNode json = objectMapper.readTree(body);

            accessToken = json.path("access_token").asText(null);
            if (accessToken == null) {
                throw new TwitchApiException(0, "resposta de token sem access_token");
            }
            long expiresIn = json.path("expires_in").asLong(0);
            tokenExpiresAt = System.currentTimeMillis() + (expiresIn - TOKEN_SAFETY_MARGIN_SECONDS) * 1000;
            log.debug("🔑 [Twitch] Token renovado, expira em {}s", expiresIn);
            return accessToken;
        } catch (HttpStatusCodeException e) {
            throw new TwitchApiException(e.getStatusCode().value(), "falha ao obter token: " + e.getStatusText());
        } catch (RestClientException | JsonProcessingException e) {
            throw new TwitchApiException("Falha ao obter token da Twitch: " + e.getMessage(), e);
        }
    }

    private synchronized void invalidateToken() {
        accessToken = null;
        tokenExpiresAt = 0;
    }
}
