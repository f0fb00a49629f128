package com.ledgerradar.ingestion.pipeline;

@FunctionalInterface
public interface PageProgressCallback {
    void reportProgress(int pagesTotal, int pagesResolved, int pagesFailed);
}
