package com.ledgerradar.ingestion.store;

/**
 * Where uploaded statement files live between upload and job completion.
 */
public interface StatementFileStore {

    /**
     * @return opaque storage key to be kept on the import job
     */
    String store(String accountId, String checksum, String fileName, byte[] content);

    byte[] load(String storageKey);

    void delete(String storageKey);
}
