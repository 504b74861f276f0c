package com.mouse.odds.model.oddsapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;
import java.util.Optional;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OddsApiBookmaker {
    private String key;
    private String title;
    @JsonProperty("last_update")
    private String lastUpdate;
    private List<OddsApiMarket> markets;

    public Optional<OddsApiMarket> market(String marketKey) {
        if (markets == null) {
            return Optional.empty();
        }
        return markets.stream()
                .filter(m -> m != null && marketKey.equals(m.getKey()))
                .findFirst();
    }
}
