package br.com.bootcamptracker.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Stream ao vivo devolvida pelo Helix /streams.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TwitchStreamDTO {
    private String id;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("user_login")
    private String userLogin;

    private String type;
    private String title;

    @JsonProperty("viewer_count")
    private Integer viewerCount;

    @JsonProperty("started_at")
    private String startedAt;
}
