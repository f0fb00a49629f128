package com.ledgerradar.ingestion.csv;

import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.TransactionDirection;
import com.ledgerradar.ingestion.error.CsvParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvStatementParserTest {

    private final CsvStatementParser parser = new CsvStatementParser();

    @Test
    @DisplayName("semicolon export with Croatian dates and amounts")
    void croatianExport() {
        String csv = """
                Datum;Iznos;Opis;Poziv na broj
                01.03.2025;500,00;Uplata INV-0042;HR00 0042
                02.03.2025.;-1.234,56;Najam ureda;
                03.03.2025;75,10-;Bankovna naknada;
                """;

        CsvParseResult result = parser.parse(bytes(csv), "EUR");

        assertThat(result.format()).isEqualTo(BankCsvFormat.PBZ);
        assertThat(result.rejected()).isEmpty();
        assertThat(result.lines()).hasSize(3);

        StatementLine first = result.lines().get(0);
        assertThat(first.getBookingDate()).isEqualTo(LocalDate.of(2025, 3, 1));
        assertThat(first.getDirection()).isEqualTo(TransactionDirection.INCOMING);
        assertThat(first.getAmount()).isEqualByComparingTo("500.00");
        assertThat(first.getDescription()).isEqualTo("Uplata INV-0042");
        assertThat(first.getReference()).isEqualTo("HR00 0042");
        assertThat(first.getCurrency()).isEqualTo("EUR");

        StatementLine second = result.lines().get(1);
        assertThat(second.getBookingDate()).isEqualTo(LocalDate.of(2025, 3, 2));
        assertThat(second.getDirection()).isEqualTo(TransactionDirection.OUTGOING);
        assertThat(second.getAmount()).isEqualByComparingTo("1234.56");
        assertThat(second.getReference()).isNull();

        assertThat(result.lines().get(2).signedAmount()).isEqualByComparingTo("-75.10");
    }

    @Test
    @DisplayName("generic comma layout with explicit direction column and BOM")
    void genericLayout() {
        String csv = "\uFEFFdate,amount,direction,description,external_id,currency\n"
                + "2025-03-05,120.00,D,Office supplies,TX-1,usd\n"
                + "2025-03-06T10:15:00,80.00,C,Refund,TX-2,\n";

        CsvParseResult result = parser.parse(bytes(csv), "EUR");

        assertThat(result.format()).isEqualTo(BankCsvFormat.GENERIC);
        assertThat(result.lines()).hasSize(2);
        assertThat(result.lines().get(0).getDirection()).isEqualTo(TransactionDirection.OUTGOING);
        assertThat(result.lines().get(0).getCurrency()).isEqualTo("USD");
        assertThat(result.lines().get(0).getExternalId()).isEqualTo("TX-1");
        assertThat(result.lines().get(1).getBookingDate()).isEqualTo(LocalDate.of(2025, 3, 6));
        assertThat(result.lines().get(1).getCurrency()).isEqualTo("EUR");
    }

    @Test
    @DisplayName("a bad row is rejected with its row number, the rest survive")
    void badRowRejected() {
        String csv = """
                Datum;Iznos;Opis
                01.03.2025;500,00;ok
                31.02.2025;10,00;impossible date
                04.03.2025;abc;bad amount
                05.03.2025;;missing amount
                """;

        CsvParseResult result = parser.parse(bytes(csv), "EUR");

        assertThat(result.lines()).hasSize(1);
        assertThat(result.rejected()).extracting(CsvParseResult.RejectedRow::rowNumber).containsExactly(2L, 3L, 4L);
        assertThat(result.rejected().get(1).value()).isEqualTo("abc");
        assertThat(result.rejected().get(1).reason()).contains("Invalid amount format");
    }

    @Test
    @DisplayName("no date column or no parseable row fails the file")
    void fileLevelFailures() {
        assertThatThrownBy(() -> parser.parse(bytes("Iznos;Opis\n10,00;x\n"), "EUR"))
                .isInstanceOf(CsvParseException.class)
                .hasMessageContaining("Missing date column");
        assertThatThrownBy(() -> parser.parse(bytes("Datum;Iznos\nyesterday;10,00\n"), "EUR"))
                .isInstanceOf(CsvParseException.class)
                .hasMessageContaining("No parseable row");
    }

    @Test
    void parseAmount_notations() {
        assertThat(CsvStatementParser.parseAmount("1.234,56")).isEqualByComparingTo("1234.56");
        assertThat(CsvStatementParser.parseAmount("1.234.567")).isEqualByComparingTo("1234567");
        assertThat(CsvStatementParser.parseAmount("-1234.56")).isEqualByComparingTo("-1234.56");
        assertThat(CsvStatementParser.parseAmount("+10,5")).isEqualByComparingTo("10.5");
        assertThat(CsvStatementParser.parseAmount("1 000,00")).isEqualByComparingTo("1000.00");
        assertThatThrownBy(() -> CsvStatementParser.parseAmount("12,34,56")).isInstanceOf(CsvParseException.class);
    }

    @Test
    void direction_indicatorWinsOverSign() {
        assertThat(CsvStatementParser.direction(new BigDecimal("10"), "Duguje")).isEqualTo(TransactionDirection.OUTGOING);
        assertThat(CsvStatementParser.direction(new BigDecimal("-10"), "C")).isEqualTo(TransactionDirection.INCOMING);
        assertThat(CsvStatementParser.direction(new BigDecimal("-10"), "?")).isEqualTo(TransactionDirection.OUTGOING);
    }

    @Test
    void detectDelimiter_picksMostFrequent() {
        assertThat(CsvStatementParser.detectDelimiter("a;b;c\n1,2;3;4")).isEqualTo(';');
        assertThat(CsvStatementParser.detectDelimiter("a\tb\tc")).isEqualTo('\t');
        assertThat(CsvStatementParser.detectDelimiter("single")).isEqualTo(',');
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
