package com.ledgerradar.ingestion.store;

import com.ledgerradar.domain.Statement;

public record PersistedStatement(Statement statement, int transactionsWritten) {
}
