package com.ledgerradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable per-page result of an in-flight PDF job. Lets an interrupted job resume without re-extracting
 * pages that already resolved; removed once the statement is written.
 */
@Document(collection = "page_checkpoints")
@CompoundIndex(name = "job_page_uniq", def = "{'importJobId': 1, 'pageNumber': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PageCheckpoint {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String importJobId;
    private int pageNumber;
    private PageStatus status;
    private TierType tierUsed;
    private ImportErrorCode failureCode;
    private BigDecimal pageStartBalance;
    private BigDecimal pageEndBalance;
    private BigDecimal discrepancy;
    private Long sequenceNumber;
    private LocalDate statementDate;
    private LocalDate periodStart;
    private LocalDate periodEnd;
    private String currency;
    private String iban;
    private List<StatementLine> lines = new ArrayList<>();
    private Instant updatedAt;
}
