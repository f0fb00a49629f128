package com.ledgerradar.api.controller;

import com.ledgerradar.domain.BankTransaction;
import com.ledgerradar.domain.BankTransactionRepository;
import com.ledgerradar.domain.Invoice;
import com.ledgerradar.domain.InvoiceRepository;
import com.ledgerradar.domain.MatchStatus;
import com.ledgerradar.domain.TransactionDirection;
import com.ledgerradar.domain.TransactionSource;
import com.ledgerradar.ingestion.job.ImportJobRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Sync feed, transaction listing, corrections and reconciliation endpoints against a real MongoDB.
 */
@SpringBootTest(properties = "ledgerradar.intake.storage-dir=target/test-uploads")
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class LedgerApiIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    BankTransactionRepository bankTransactionRepository;
    @Autowired
    InvoiceRepository invoiceRepository;

    @MockBean
    ImportJobRunner importJobRunner;

    @Test
    @DisplayName("sync feed inserts new entries; replaying it is skipped as strict duplicates")
    void syncFeedIsIdempotent() {
        String account = "acc-" + UUID.randomUUID();
        String body = """
                {"transactions":[
                  {"externalId":"gc-1","bookingDate":"2025-03-03","amount":-42.10,"description":"Telekom"},
                  {"externalId":"gc-2","bookingDate":"2025-03-04","amount":15.00,"counterpartyName":"Acme"}
                ]}
                """;

        postFeed(account, body).expectStatus().isOk()
                .expectBody()
                .jsonPath("$.received").isEqualTo(2)
                .jsonPath("$.inserted").isEqualTo(2);
        postFeed(account, body).expectStatus().isOk()
                .expectBody()
                .jsonPath("$.inserted").isEqualTo(0)
                .jsonPath("$.strictDuplicates").isEqualTo(2);

        webTestClient.get().uri("/api/v1/accounts/{account}/transactions", account)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].externalId").isEqualTo("gc-2")
                .jsonPath("$[0].source").isEqualTo("PROVIDER_SYNC")
                .jsonPath("$[1].direction").isEqualTo("OUTGOING");
    }

    @Test
    void syncFeedValidation() {
        postFeed("acc-v", "{\"transactions\":[]}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("EMPTY_FEED");
        postFeed("acc-v", "{\"transactions\":[{\"externalId\":\"x\",\"bookingDate\":\"2025-03-03\"}]}")
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_AMOUNT")
                .jsonPath("$.message").isEqualTo("Amount is missing or negative");
    }

    @Test
    @DisplayName("reconcile auto-matches INV-2025-007 and stamps the invoice paid")
    void reconcileEndpoint() {
        String account = "acc-" + UUID.randomUUID();
        BankTransaction tx = bankTransactionRepository.save(credit(account, "500.00", "HR00 INV-2025-007"));
        Invoice invoice = invoiceRepository.save(invoice(account, "INV-2025-007", "500.00"));

        webTestClient.post().uri("/api/v1/accounts/{account}/reconciliation", account)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.scanned").isEqualTo(1)
                .jsonPath("$.autoMatched").isEqualTo(1);

        webTestClient.get().uri("/api/v1/accounts/{account}/transactions?matchStatus=AUTO_MATCHED", account)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo(tx.getId())
                .jsonPath("$[0].matchedInvoiceId").isEqualTo(invoice.getId())
                .jsonPath("$[0].matchedBy").isEqualTo("reconciliation-engine");
        assertThat(invoiceRepository.findById(invoice.getId()).orElseThrow().getPaidByTransactionId()).isEqualTo(tx.getId());
    }

    @Test
    @DisplayName("manual match, correction blocked while matched, unmatch releases the invoice")
    void manualMatchLifecycle() {
        String account = "acc-" + UUID.randomUUID();
        BankTransaction tx = bankTransactionRepository.save(credit(account, "75.00", "no reference"));
        Invoice invoice = invoiceRepository.save(invoice(account, "INV-9", "80.00"));

        webTestClient.post().uri("/api/v1/transactions/{id}/match", tx.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"invoiceId\":\"" + invoice.getId() + "\",\"actor\":\"ana\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.matchStatus").isEqualTo("MANUALLY_MATCHED")
                .jsonPath("$.confidenceScore").isEqualTo(100)
                .jsonPath("$.matchedBy").isEqualTo("ana");

        webTestClient.patch().uri("/api/v1/transactions/{id}", tx.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\":80.00}")
                .exchange()
                .expectStatus().isEqualTo(409);

        webTestClient.post().uri("/api/v1/transactions/{id}/unmatch", tx.getId())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.matchStatus").isEqualTo("UNMATCHED");
        assertThat(invoiceRepository.findById(invoice.getId()).orElseThrow().isPaid()).isFalse();

        webTestClient.patch().uri("/api/v1/transactions/{id}", tx.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\":80.00,\"bookingDate\":\"2025-03-12\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.amount").value(amount -> assertThat(new BigDecimal(amount.toString())).isEqualByComparingTo("80"))
                .jsonPath("$.bookingDate").isEqualTo("2025-03-12");
    }

    @Test
    void errorsMapToStatusCodes() {
        webTestClient.post().uri("/api/v1/transactions/{id}/unmatch", "missing")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("TRANSACTION_NOT_FOUND");
        webTestClient.patch().uri("/api/v1/transactions/{id}", "missing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\":-5}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_AMOUNT");
        webTestClient.post().uri("/api/v1/transactions/{id}/match", "missing")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"invoiceId\":\" \"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_INVOICE");
    }

    private WebTestClient.ResponseSpec postFeed(String account, String body) {
        return webTestClient.post().uri("/api/v1/accounts/{account}/sync-feed", account)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    private static BankTransaction credit(String account, String amount, String reference) {
        BankTransaction tx = new BankTransaction();
        tx.setAccountId(account);
        tx.setSource(TransactionSource.PROVIDER_SYNC);
        tx.setBookingDate(LocalDate.of(2025, 3, 10));
        tx.setDirection(TransactionDirection.INCOMING);
        tx.setAmount(new BigDecimal(amount));
        tx.setCurrency("EUR");
        tx.setReference(reference);
        tx.setMatchStatus(MatchStatus.UNMATCHED);
        tx.setCreatedAt(Instant.now());
        return tx;
    }

    private static Invoice invoice(String account, String number, String total) {
        Invoice invoice = new Invoice();
        invoice.setAccountId(account);
        invoice.setInvoiceNumber(number);
        invoice.setDirection(Invoice.InvoiceDirection.OUTBOUND);
        invoice.setTotalAmount(new BigDecimal(total));
        invoice.setCurrency("EUR");
        invoice.setDueDate(LocalDate.of(2025, 3, 9));
        return invoice;
    }
}
