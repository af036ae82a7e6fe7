package br.com.bootcamptracker.backend.service;

import br.com.bootcamptracker.backend.config.CacheConfig;
import br.com.bootcamptracker.backend.domain.entity.ChampionPlayrate;
import br.com.bootcamptracker.backend.domain.repository.ChampionPlayrateRepository;
import br.com.bootcamptracker.backend.dto.RolePlayrates;
import br.com.bootcamptracker.backend.service.riot.CommunityDragonClient;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Playrates por campeão e rota, vindas do Community Dragon.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChampionPlayrateService {

    // Rótulo da rota no script de estatísticas, na ordem top/jungle/mid/adc/support
    private static final String[] STATISTICS_ROLES = { "TOP", "JUNGLE", "MIDDLE", "BOTTOM", "SUPPORT" };

    private final ChampionPlayrateRepository championPlayrateRepository;
    private final CommunityDragonClient communityDragonClient;

    /**
     * Mapa championId → playrates. Vazio se o refresh ainda não rodou.
     */
    @Cacheable(CacheConfig.CHAMPION_PLAYRATES)
    public Map<Integer, RolePlayrates> getPlayrateMap() {
        Map<Integer, RolePlayrates> map = new HashMap<>();
        for (ChampionPlayrate pr : championPlayrateRepository.findAll()) {
            map.put(pr.getChampionId(), new RolePlayrates(pr.getTopRate(), pr.getJungleRate(), pr.getMidRate(),
                    pr.getAdcRate(), pr.getSupportRate()));
        }
        log.debug("📊 [Playrate] {} campeões carregados do banco", map.size());
        return map;
    }

    /**
     * Baixa as playrates atuais e faz upsert de uma linha por campeão.
     *
     * @return quantidade de campeões gravados
     */
    @Transactional
    @CacheEvict(value = CacheConfig.CHAMPION_PLAYRATES, allEntries = true)
    public int refreshPlayrates() {
        log.info("🎮 [Playrate] Buscando playrates no Community Dragon...");

        JsonNode summary = communityDragonClient.fetchChampionSummary();
        String statistics = communityDragonClient.fetchChampionStatistics();
        String patch = parsePatch(communityDragonClient.fetchContentMetadata());

        Map<Integer, RolePlayrates> parsed = parsePlayrates(summary, statistics);

        Map<Integer, ChampionPlayrate> existing = championPlayrateRepository.findAllById(parsed.keySet()).stream()
                .collect(Collectors.toMap(ChampionPlayrate::getChampionId, Function.identity()));

        List<ChampionPlayrate> toSave = new ArrayList<>(parsed.size());
        parsed.forEach((championId, rates) -> {
            ChampionPlayrate row = existing.getOrDefault(championId,
                    ChampionPlayrate.builder().championId(championId).build());
            row.setTopRate(rates.top());
            row.setJungleRate(rates.jungle());
            row.setMidRate(rates.mid());
            row.setAdcRate(rates.adc());
            row.setSupportRate(rates.support());
            row.setPatch(patch);
            toSave.add(row);
        });
        championPlayrateRepository.saveAll(toSave);

        log.info("✅ [Playrate] {} campeões atualizados (patch {})", toSave.size(), patch);
        return toSave.size();
    }

    /**
     * Extrai as playrates do script de estatísticas. Todo campeão do resumo
     * (exceto id -1) entra com 0 nas rotas sem dado.
     */
    static Map<Integer, RolePlayrates> parsePlayrates(JsonNode championSummary, String statisticsScript) {
        Map<Integer, double[]> rates = new TreeMap<>();
        for (JsonNode champ : championSummary) {
            int id = champ.path("id").asInt(-1);
            if (id == -1) {
                continue;
            }
            rates.put(id, new double[STATISTICS_ROLES.length]);
        }

        for (int role = 0; role < STATISTICS_ROLES.length; role++) {
            String label = STATISTICS_ROLES[role];
            Matcher matcher = Pattern.compile(Pattern.quote(label) + "\":(.*?})").matcher(statisticsScript);
            if (!matcher.find()) {
                log.warn("⚠️ [Playrate] Rota {} não encontrada no script de estatísticas", label);
                continue;
            }

            String roleData = matcher.group(1).replaceAll("\\s", "");
            if (roleData.length() < 2) {
                continue;
            }
            String body = roleData.substring(1, roleData.length() - 1);
            for (String pair : body.split(",")) {
                String[] parts = pair.split(":");
                if (parts.length != 2) {
                    continue;
                }
                try {
                    int championId = Integer.parseInt(parts[0].replace("\"", ""));
                    double rate = Double.parseDouble(parts[1]);
                    double[] champRates = rates.get(championId);
                    if (champRates != null) {
                        champRates[role] = Math.round(rate * 100 * 100000) / 100000.0;
                    }
                } catch (NumberFormatException e) {
                    log.debug("Par ignorado em {}: {}", label, pair);
                }
            }
        }

        Map<Integer, RolePlayrates> result = new LinkedHashMap<>();
        rates.forEach((id, r) -> result.put(id, new RolePlayrates(r[0], r[1], r[2], r[3], r[4])));
        return result;
    }

    /**
     * "14.20.123.4567" → "14.20"
     */
    static String parsePatch(JsonNode contentMetadata) {
        String version = contentMetadata.path("version").asText("");
        String[] parts = version.split("\\.");
        if (parts.length < 2) {
            return version;
        }
        return parts[0] + "." + parts[1];
    }
}
