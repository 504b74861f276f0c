package com.mouse.odds.model.oddsapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OddsApiMarket {
    public static final String H2H = "h2h";
    public static final String METHOD = "fight_result_method";
    public static final String ROUND = "fight_result_round";

    private String key;
    @JsonProperty("last_update")
    private String lastUpdate;
    private List<OddsApiOutcome> outcomes;
}
