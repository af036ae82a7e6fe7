package br.com.bootcamptracker.backend.config.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "community-dragon")
public class CommunityDragonProperties {

    private String championSummaryUrl = "https://raw.communitydragon.org/latest/plugins/rcp-be-lol-game-data/global/default/v1/champion-summary.json";
    private String championStatisticsUrl = "https://raw.communitydragon.org/latest/plugins/rcp-fe-lol-champion-statistics/global/default/rcp-fe-lol-champion-statistics.js";
    private String contentMetadataUrl = "https://raw.communitydragon.org/latest/content-metadata.json";
}
