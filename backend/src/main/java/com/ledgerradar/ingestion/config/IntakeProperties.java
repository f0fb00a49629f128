package com.ledgerradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Upload intake limits and local storage. Documented in application.yml under ledgerradar.intake.
 */
@ConfigurationProperties(prefix = "ledgerradar.intake")
@NoArgsConstructor
@Getter
@Setter
public class IntakeProperties {

    /** Upload size ceiling in bytes, checked before any parsing. Default 20 MiB. */
    private long maxFileBytes = 20L * 1024 * 1024;

    /** Accepted file extensions, lowercase without dot. */
    private List<String> allowedExtensions = new ArrayList<>(List.of("xml", "pdf", "csv", "txt"));

    /** Directory where uploaded files are kept until their job finishes. */
    private String storageDir = "./data/uploads";
}
