package com.ledgerradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface InvoiceRepository extends MongoRepository<Invoice, String> {

    List<Invoice> findByAccountIdAndDirectionAndPaidAtIsNull(String accountId, Invoice.InvoiceDirection direction);
}
