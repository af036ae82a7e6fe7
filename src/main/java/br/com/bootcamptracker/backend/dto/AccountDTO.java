package br.com.bootcamptracker.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountDTO {
    private String puuid;
    private String gameName;
    private String tagLine;

    public String getRiotId() {
        return gameName + "#" + tagLine;
    }
}
