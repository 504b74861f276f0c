package com.mouse.odds.model.oddsapi;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.math.BigDecimal;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OddsApiOutcome {
    private String name;
    private BigDecimal price;
    private BigDecimal point;  // Present on spread/total markets only
}
