package com.ledgerradar.reconciliation.ledger;

import com.ledgerradar.domain.Invoice;
import com.ledgerradar.domain.InvoiceRepository;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Invoice ledger over the shared invoices collection.
 */
@Component
@RequiredArgsConstructor
public class MongoInvoiceLedger implements InvoiceLedger {

    private final InvoiceRepository invoiceRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public List<Invoice> findUnpaidOutbound(String accountId) {
        return invoiceRepository.findByAccountIdAndDirectionAndPaidAtIsNull(accountId, Invoice.InvoiceDirection.OUTBOUND);
    }

    @Override
    public Optional<Invoice> findById(String invoiceId) {
        return invoiceRepository.findById(invoiceId);
    }

    @Override
    public boolean markPaid(String invoiceId, String transactionId, Instant paidAt) {
        Query query = new Query(where("_id").is(invoiceId).and("paidAt").is(null));
        Update update = new Update().set("paidAt", paidAt).set("paidByTransactionId", transactionId);
        UpdateResult result = mongoTemplate.updateFirst(query, update, Invoice.class);
        return result.getModifiedCount() == 1;
    }

    @Override
    public void clearPaid(String invoiceId, String transactionId) {
        Query query = new Query(where("_id").is(invoiceId).and("paidByTransactionId").is(transactionId));
        Update update = new Update().unset("paidAt").unset("paidByTransactionId");
        mongoTemplate.updateFirst(query, update, Invoice.class);
    }
}
