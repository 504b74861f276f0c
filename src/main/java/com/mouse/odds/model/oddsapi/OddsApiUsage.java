package com.mouse.odds.model.oddsapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class OddsApiUsage {
    @JsonProperty("requests_remaining")
    private int requestsRemaining;
    @JsonProperty("requests_used")
    private int requestsUsed;
}
