package com.ledgerradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;

@ConfigurationProperties(prefix = "ledgerradar.audit")
@NoArgsConstructor
@Getter
@Setter
public class AuditProperties {

    /** Inclusive tolerance for page balance checks and statement chaining, in currency units. */
    private BigDecimal tolerance = new BigDecimal("0.01");
}
