package com.ledgerradar.ingestion.xml;

import com.ledgerradar.domain.PageStatus;
import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.TierType;
import com.ledgerradar.domain.TransactionDirection;
import com.ledgerradar.ingestion.error.MalformedStatementException;
import com.ledgerradar.ingestion.store.PageDraft;
import com.ledgerradar.ingestion.store.StatementDraft;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Camt053ExtractorTest {

    private final Camt053Extractor extractor = new Camt053Extractor();

    @Test
    @DisplayName("parses balances, period, sequence number and entries into one verified page")
    void parsesSample() throws IOException {
        StatementDraft draft = extractor.extract(fixture(), "HRK");

        assertThat(draft.externalStatementId()).isEqualTo("STMT-2025-03");
        assertThat(draft.sequenceNumber()).isEqualTo(12L);
        assertThat(draft.periodStart()).isEqualTo(LocalDate.of(2025, 3, 1));
        assertThat(draft.periodEnd()).isEqualTo(LocalDate.of(2025, 3, 31));
        assertThat(draft.statementDate()).isEqualTo(LocalDate.of(2025, 4, 1));
        assertThat(draft.openingBalance()).isEqualByComparingTo("1000.00");
        assertThat(draft.closingBalance()).isEqualByComparingTo("1450.00");
        assertThat(draft.currency()).isEqualTo("EUR");
        assertThat(draft.iban()).isEqualTo("HR1210010051863000160");
        assertThat(draft.tierUsed()).isEqualTo(TierType.XML);
        assertThat(draft.failedPages()).isZero();

        assertThat(draft.pages()).hasSize(1);
        PageDraft page = draft.pages().get(0);
        assertThat(page.status()).isEqualTo(PageStatus.VERIFIED);
        assertThat(page.lines()).hasSize(2);
    }

    @Test
    @DisplayName("credit entry takes counterparty from debtor and reference from structured remittance")
    void creditEntry() throws IOException {
        StatementLine credit = extractor.extract(fixture(), "EUR").pages().get(0).lines().get(0);

        assertThat(credit.getDirection()).isEqualTo(TransactionDirection.INCOMING);
        assertThat(credit.getAmount()).isEqualByComparingTo("500.00");
        assertThat(credit.getBookingDate()).isEqualTo(LocalDate.of(2025, 3, 10));
        assertThat(credit.getCounterpartyName()).isEqualTo("Acme d.o.o.");
        assertThat(credit.getCounterpartyIban()).isEqualTo("HR6623400091110651272");
        assertThat(credit.getDescription()).isEqualTo("Payment INV-2025-007");
        assertThat(credit.getReference()).isEqualTo("HR00 2025-007");
        assertThat(credit.getExternalId()).isEqualTo("E2E-INV-2025-007");
        assertThat(credit.getCurrency()).isEqualTo("EUR");
    }

    @Test
    @DisplayName("debit entry with NOTPROVIDED end-to-end id falls back to servicer reference")
    void debitEntry() throws IOException {
        StatementLine debit = extractor.extract(fixture(), "EUR").pages().get(0).lines().get(1);

        assertThat(debit.getDirection()).isEqualTo(TransactionDirection.OUTGOING);
        assertThat(debit.getAmount()).isEqualByComparingTo("50.00");
        assertThat(debit.getCounterpartyName()).isEqualTo("Bank");
        assertThat(debit.getDescription()).isEqualTo("Monthly account fee");
        assertThat(debit.getExternalId()).isEqualTo("BANK-REF-002");
        assertThat(debit.getReference()).isEqualTo("2");
        assertThat(debit.getValueDate()).isNull();
    }

    @Test
    @DisplayName("missing closing balance is malformed")
    void missingClosing() throws IOException {
        String xml = new String(fixture(), StandardCharsets.UTF_8).replace("<Cd>CLBD</Cd>", "<Cd>ITBD</Cd>");

        assertThatThrownBy(() -> extractor.extract(xml.getBytes(StandardCharsets.UTF_8), "EUR"))
                .isInstanceOf(MalformedStatementException.class)
                .hasMessageContaining("CLBD");
    }

    @Test
    @DisplayName("invalid credit/debit indicator fails the whole document")
    void invalidIndicator() throws IOException {
        String xml = new String(fixture(), StandardCharsets.UTF_8)
                .replace("<CdtDbtInd>DBIT</CdtDbtInd>\n        <BookgDt>", "<CdtDbtInd>XXXX</CdtDbtInd>\n        <BookgDt>");

        assertThatThrownBy(() -> extractor.extract(xml.getBytes(StandardCharsets.UTF_8), "EUR"))
                .isInstanceOf(MalformedStatementException.class)
                .hasMessageContaining("Entry 2");
    }

    @Test
    @DisplayName("non-XML content is malformed, document without statements is malformed")
    void garbage() {
        assertThatThrownBy(() -> extractor.extract("<Document><oops".getBytes(StandardCharsets.UTF_8), "EUR"))
                .isInstanceOf(MalformedStatementException.class);
        assertThatThrownBy(() -> extractor.extract("<Document><Other/></Document>".getBytes(StandardCharsets.UTF_8), "EUR"))
                .isInstanceOf(MalformedStatementException.class)
                .hasMessageContaining("No Stmt");
    }

    @Test
    @DisplayName("document with two statements is rejected instead of importing only the first")
    void multipleStatements() throws IOException {
        String xml = new String(fixture(), StandardCharsets.UTF_8);
        String stmt = xml.substring(xml.indexOf("<Stmt>"), xml.indexOf("</Stmt>") + "</Stmt>".length());
        String doubled = xml.replace(stmt, stmt + "\n    " + stmt.replace("STMT-2025-03", "STMT-2025-04"));

        assertThatThrownBy(() -> extractor.extract(doubled.getBytes(StandardCharsets.UTF_8), "EUR"))
                .isInstanceOf(MalformedStatementException.class)
                .hasMessageContaining("2 Stmt/Rpt elements");
    }

    @Test
    void parseDate_acceptsDateTime() {
        assertThat(Camt053Extractor.parseDate("2025-03-31T23:59:59+01:00")).isEqualTo(LocalDate.of(2025, 3, 31));
        assertThat(Camt053Extractor.parseDate(" ")).isNull();
    }

    private static byte[] fixture() throws IOException {
        try (InputStream in = Camt053ExtractorTest.class.getResourceAsStream("/statements/camt053-sample.xml")) {
            assertThat(in).isNotNull();
            return in.readAllBytes();
        }
    }
}
