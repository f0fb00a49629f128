package com.ledgerradar.domain;

import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed conditional updates for bank_transactions.
 */
@Repository
@RequiredArgsConstructor
public class BankTransactionRepositoryImpl implements BankTransactionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean claimMatch(String transactionId, String invoiceId, MatchStatus status, int confidence,
                              String actor, Instant matchedAt) {
        Query query = new Query(where("_id").is(transactionId).and("matchStatus").is(MatchStatus.UNMATCHED));
        Update update = new Update()
                .set("matchStatus", status)
                .set("matchedInvoiceId", invoiceId)
                .set("confidenceScore", confidence)
                .set("matchedBy", actor)
                .set("matchedAt", matchedAt)
                .set("updatedAt", matchedAt)
                .unset("suggestedInvoiceId");
        UpdateResult result = mongoTemplate.updateFirst(query, update, BankTransaction.class);
        return result.getModifiedCount() == 1;
    }

    @Override
    public void recordSuggestion(String transactionId, String invoiceId, int confidence) {
        Query query = new Query(where("_id").is(transactionId).and("matchStatus").is(MatchStatus.UNMATCHED));
        Update update = new Update()
                .set("suggestedInvoiceId", invoiceId)
                .set("confidenceScore", confidence)
                .set("updatedAt", Instant.now());
        mongoTemplate.updateFirst(query, update, BankTransaction.class);
    }

    @Override
    public boolean applyCorrection(BankTransaction corrected, MatchStatus expectedStatus) {
        Query query = new Query(where("_id").is(corrected.getId()).and("matchStatus").is(expectedStatus));
        Update update = new Update()
                .set("bookingDate", corrected.getBookingDate())
                .set("amount", corrected.getAmount())
                .set("direction", corrected.getDirection())
                .set("updatedAt", corrected.getUpdatedAt());
        // matched, not modified: re-saving identical values is still a successful correction
        return mongoTemplate.updateFirst(query, update, BankTransaction.class).getMatchedCount() == 1;
    }

    @Override
    public boolean releaseMatch(String transactionId, MatchStatus expectedStatus, String expectedInvoiceId,
                                Instant releasedAt) {
        Query query = new Query(where("_id").is(transactionId)
                .and("matchStatus").is(expectedStatus)
                .and("matchedInvoiceId").is(expectedInvoiceId));
        Update update = new Update()
                .set("matchStatus", MatchStatus.UNMATCHED)
                .unset("matchedInvoiceId")
                .unset("matchedAt")
                .unset("matchedBy")
                .unset("confidenceScore")
                .unset("suggestedInvoiceId")
                .set("updatedAt", releasedAt);
        return mongoTemplate.updateFirst(query, update, BankTransaction.class).getModifiedCount() == 1;
    }

    @Override
    public boolean markIgnored(String transactionId, Instant ignoredAt) {
        Query query = new Query(where("_id").is(transactionId).and("matchStatus").is(MatchStatus.UNMATCHED));
        Update update = new Update()
                .set("matchStatus", MatchStatus.IGNORED)
                .unset("suggestedInvoiceId")
                .set("updatedAt", ignoredAt);
        return mongoTemplate.updateFirst(query, update, BankTransaction.class).getModifiedCount() == 1;
    }
}
