package com.ledgerradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PageCheckpointRepository extends MongoRepository<PageCheckpoint, String> {

    List<PageCheckpoint> findByImportJobId(String importJobId);

    void deleteByImportJobId(String importJobId);
}
