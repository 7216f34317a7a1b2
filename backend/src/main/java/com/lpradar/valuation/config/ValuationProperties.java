package com.lpradar.valuation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

/**
 * Position valuation settings under lpradar.valuation.
 */
@ConfigurationProperties(prefix = "lpradar.valuation")
@Getter
@Setter
public class ValuationProperties {

    /**
     * Positions whose combined value (token1 units) is below this are treated as empty.
     */
    private BigDecimal dustThreshold = new BigDecimal("0.01");
}
