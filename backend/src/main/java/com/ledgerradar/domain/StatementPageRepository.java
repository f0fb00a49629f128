package com.ledgerradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface StatementPageRepository extends MongoRepository<StatementPage, String> {

    List<StatementPage> findByStatementIdOrderByPageNumberAsc(String statementId);

    void deleteByStatementId(String statementId);
}
