package br.com.bootcamptracker.backend.service.riot;

import br.com.bootcamptracker.backend.config.properties.RiotApiProperties;
import br.com.bootcamptracker.backend.dto.AccountDTO;
import br.com.bootcamptracker.backend.dto.ActiveGameDTO;
import br.com.bootcamptracker.backend.dto.LeagueEntryDTO;
import br.com.bootcamptracker.backend.exception.RiotApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
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
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.*;

/**
 * Cliente da Riot API usado pelos workers.
 * <p>
 * Endpoints de plataforma (spectator, league) usam o host da região; account e
 * match usam o host regional. Ausência esperada não é erro: 404 na spectator
 * vira {@code Optional.empty()} e 404 na league vira lista vazia.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiotAPIService {

    private static final String TOKEN_HEADER = "X-Riot-Token";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final RiotApiProperties riotApiProperties;
    private final RiotRateLimiter rateLimiter;

    private static final Map<String, String> REGIONAL_ROUTING = new HashMap<String, String>() {
        {
            put("br1", "americas");
            put("na1", "americas");
            put("la1", "americas");
            put("la2", "americas");
            put("kr", "asia");
            put("jp1", "asia");
            put("eun1", "europe");
            put("euw1", "europe");
            put("tr1", "europe");
            put("ru", "europe");
            put("oc1", "sea");
        }
    };

    public boolean isConfigured() {
        return riotApiProperties.isConfigured();
    }

    /**
     * Partida ao vivo do jogador, se houver.
     */
    public Optional<ActiveGameDTO> getActiveGame(String region, String puuid) {
        String path = "/lol/spectator/v5/active-games/by-summoner/" + puuid;
        try {
            return Optional.ofNullable(get(platformUrl(region), path, new TypeReference<ActiveGameDTO>() {
            }));
        } catch (RiotApiException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Entradas ranqueadas do jogador (uma por fila).
     */
    public List<LeagueEntryDTO> getLeagueEntries(String region, String puuid) {
        String path = "/lol/league/v4/entries/by-puuid/" + puuid;
        try {
            List<LeagueEntryDTO> entries = get(platformUrl(region), path, new TypeReference<List<LeagueEntryDTO>>() {
            });
            return entries != null ? entries : new ArrayList<>();
        } catch (RiotApiException e) {
            if (e.isNotFound()) {
                log.debug("ℹ️ Sem dados ranqueados para puuid {}", abbreviate(puuid));
                return new ArrayList<>();
            }
            throw e;
        }
    }

    /**
     * Registro completo da Match-V5, guardado como veio.
     */
    public JsonNode getMatchById(String region, String matchId) {
        return get(regionalUrl(region), "/lol/match/v5/matches/" + matchId, new TypeReference<JsonNode>() {
        });
    }

    public AccountDTO getAccountByPuuid(String region, String puuid) {
        return get(regionalUrl(region), "/riot/account/v1/accounts/by-puuid/" + puuid,
                new TypeReference<AccountDTO>() {
                });
    }

    // ========================================
    // HTTP
    // ========================================

    private <T> T get(String baseUrl, String path, TypeReference<T> type) {
        if (!isConfigured()) {
            throw new IllegalStateException("riot.api.key não configurada");
        }

        return rateLimiter.execute(path, () -> {
            HttpHeaders headers = new HttpHeaders();
            headers.set(TOKEN_HEADER, riotApiProperties.getKey());
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));

            try {
                ResponseEntity<String> response = restTemplate.exchange(baseUrl + path, HttpMethod.GET,
                        new HttpEntity<>(headers), String.class);
                String body = response.getBody();
                if (body == null || body.isBlank()) {
                    return null;
                }
                return objectMapper.readValue(body, type);
            } catch (HttpStatusCodeException e) {
                int status = e.getStatusCode().value();
                if (status == 403) {
                    log.error("❌ Riot API 403 em {}: chave inválida ou expirada", path);
                } else if (status == 429) {
                    log.warn("⏳ Riot API 429 em {} (Retry-After: {})", path,
                            e.getResponseHeaders() != null ? e.getResponseHeaders().getFirst("Retry-After") : null);
                }
                throw new RiotApiException(status, path, e.getStatusText());
            } catch (ResourceAccessException e) {
                throw new RiotApiException(path, e.getMessage(), e);
            } catch (JsonProcessingException e) {
                throw new RiotApiException(path, "resposta inválida: " + e.getOriginalMessage(), e);
            }
        });
    }

    static String platformUrl(String region) {
        return "https://" + region.toLowerCase() + ".api.riotgames.com";
    }

    static String regionalUrl(String region) {
        String routing = REGIONAL_ROUTING.get(region.toLowerCase());
        if (routing == null) {
            throw new IllegalArgumentException("Região não suportada: " + region);
        }
        return "https://" + routing + ".api.riotgames.com";
    }

    private static String abbreviate(String puuid) {
        return puuid == null || puuid.length() <= 8 ? puuid : puuid.substring(0, 8) + "...";
    }
}
