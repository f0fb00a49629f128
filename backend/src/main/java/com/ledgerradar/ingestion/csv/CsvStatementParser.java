package com.ledgerradar.ingestion.csv;

import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.TransactionDirection;
import com.ledgerradar.ingestion.error.CsvParseException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bank CSV exports to statement lines. Delimiter and bank layout are detected from the header row. A row that
 * cannot be parsed is rejected on its own; the file fails only when it has no date or amount column, or no
 * row parsed at all.
 */
@Component
@Slf4j
public class CsvStatementParser {

    private static final Pattern CROATIAN_DATE = Pattern.compile("^(\\d{1,2})\\.(\\d{1,2})\\.(\\d{4})\\.?$");
    private static final Pattern ISO_DATE = Pattern.compile("^(\\d{4})-(\\d{2})-(\\d{2})");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    public CsvParseResult parse(byte[] content, String defaultCurrency) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        char delimiter = detectDelimiter(text);
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setDelimiter(delimiter)
                .setHeader()
                .setSkipHeaderRecord(true)
                .setIgnoreEmptyLines(true)
                .setAllowMissingColumnNames(true)
                .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
                .setTrim(true)
                .build();

        try (CSVParser parser = CSVParser.parse(new StringReader(text), csvFormat)) {
            List<String> headers = parser.getHeaderNames();
            BankCsvFormat format = BankCsvFormat.detect(headers);
            Map<String, String> columns = indexHeaders(headers);
            String dateColumn = resolve(columns, format.date());
            String amountColumn = resolve(columns, format.amount());
            if (dateColumn == null) {
                throw new CsvParseException("Missing date column for " + format + " layout", format.date().get(0), null);
            }
            if (amountColumn == null) {
                throw new CsvParseException("Missing amount column for " + format + " layout", format.amount().get(0), null);
            }
            ColumnMap map = new ColumnMap(dateColumn, amountColumn,
                    resolve(columns, format.counterpartyName()),
                    resolve(columns, format.counterpartyIban()),
                    resolve(columns, format.reference()),
                    resolve(columns, format.description()),
                    resolve(columns, format.externalId()),
                    resolve(columns, format.direction()),
                    resolve(columns, format.currency()));

            List<StatementLine> lines = new ArrayList<>();
            List<CsvParseResult.RejectedRow> rejected = new ArrayList<>();
            long rowNumber = 0;
            for (CSVRecord record : parser) {
                rowNumber++;
                try {
                    lines.add(parseRow(record, map, defaultCurrency));
                } catch (CsvParseException e) {
                    log.debug("CSV row {} rejected: {}", rowNumber, e.getMessage());
                    rejected.add(new CsvParseResult.RejectedRow(rowNumber, e.getField(), e.getValue(), e.getMessage()));
                }
            }
            if (lines.isEmpty()) {
                throw new CsvParseException("No parseable row in " + rowNumber + " data row(s)", null, null);
            }
            log.debug("Parsed {} CSV row(s) as {} (delimiter '{}'), {} rejected", lines.size(), format, delimiter, rejected.size());
            return new CsvParseResult(format, lines, rejected);
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw new CsvParseException("Unreadable CSV: " + e.getMessage(), null, null, e);
        }
    }

    private record ColumnMap(String date, String amount, String counterpartyName, String counterpartyIban,
                             String reference, String description, String externalId, String direction,
                             String currency) {}

    private static StatementLine parseRow(CSVRecord record, ColumnMap map, String defaultCurrency) {
        String dateValue = value(record, map.date());
        String amountValue = value(record, map.amount());
        if (dateValue == null) {
            throw new CsvParseException("Date value is required", map.date(), null);
        }
        if (amountValue == null) {
            throw new CsvParseException("Amount value is required", map.amount(), null);
        }
        BigDecimal amount = parseAmount(amountValue);
        TransactionDirection direction = direction(amount, value(record, map.direction()));
        String currency = value(record, map.currency());

        StatementLine line = new StatementLine();
        line.setBookingDate(parseDate(dateValue));
        line.setDirection(direction);
        line.setAmount(amount.abs());
        line.setCurrency(currency != null ? currency.toUpperCase(Locale.ROOT) : defaultCurrency);
        line.setCounterpartyName(value(record, map.counterpartyName()));
        line.setCounterpartyIban(value(record, map.counterpartyIban()));
        line.setReference(value(record, map.reference()));
        line.setDescription(value(record, map.description()));
        line.setExternalId(value(record, map.externalId()));
        return line;
    }

    /**
     * Croatian notation ({@code 1.234,56}, {@code 1.234,56-}) or plain ({@code -1234.56}). With dots only, more
     * than one dot means thousands separators.
     */
    static BigDecimal parseAmount(String raw) {
        String value = raw.replace("\u00A0", "").replace(" ", "").strip();
        boolean negative = false;
        if (value.endsWith("-")) {
            negative = true;
            value = value.substring(0, value.length() - 1);
        }
        if (value.startsWith("+")) {
            value = value.substring(1);
        }
        String normalized;
        if (value.contains(",")) {
            normalized = value.replace(".", "").replace(",", ".");
        } else if (value.indexOf('.') != value.lastIndexOf('.')) {
            normalized = value.replace(".", "");
        } else {
            normalized = value;
        }
        if (!PLAIN_NUMBER.matcher(normalized).matches()) {
            throw new CsvParseException("Invalid amount format: \"" + raw + "\"", "amount", raw);
        }
        BigDecimal amount = new BigDecimal(normalized);
        return negative ? amount.negate() : amount;
    }

    /** {@code dd.MM.yyyy} (trailing dot allowed) or ISO {@code yyyy-MM-dd}, time part ignored. */
    static LocalDate parseDate(String raw) {
        String value = raw.strip();
        try {
            Matcher croatian = CROATIAN_DATE.matcher(value);
            if (croatian.matches()) {
                return LocalDate.of(Integer.parseInt(croatian.group(3)), Integer.parseInt(croatian.group(2)),
                        Integer.parseInt(croatian.group(1)));
            }
            Matcher iso = ISO_DATE.matcher(value);
            if (iso.find()) {
                return LocalDate.of(Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)),
                        Integer.parseInt(iso.group(3)));
            }
        } catch (DateTimeException e) {
            throw new CsvParseException("Invalid date: \"" + raw + "\"", "date", raw, e);
        }
        throw new CsvParseException("Invalid date format: \"" + raw + "\" (expected DD.MM.YYYY or YYYY-MM-DD)", "date", raw);
    }

    /** An explicit D/C indicator wins over the amount sign. */
    static TransactionDirection direction(BigDecimal signedAmount, String indicator) {
        if (indicator != null) {
            switch (indicator.strip().toUpperCase(Locale.ROOT)) {
                case "D", "DEBIT", "DUGUJE", "OUTGOING":
                    return TransactionDirection.OUTGOING;
                case "C", "CREDIT", "POTRAZUJE", "INCOMING":
                    return TransactionDirection.INCOMING;
                default:
                    break;
            }
        }
        return TransactionDirection.ofSigned(signedAmount);
    }

    static char detectDelimiter(String text) {
        int end = text.indexOf('\n');
        String header = end < 0 ? text : text.substring(0, end);
        char best = ',';
        long bestCount = 0;
        for (char candidate : new char[]{';', ',', '\t'}) {
            long count = header.chars().filter(c -> c == candidate).count();
            if (count > bestCount) {
                best = candidate;
                bestCount = count;
            }
        }
        return best;
    }

    private static Map<String, String> indexHeaders(List<String> headers) {
        Map<String, String> byLower = new HashMap<>();
        for (String header : headers) {
            if (header != null && !header.isBlank()) {
                byLower.putIfAbsent(header.strip().toLowerCase(Locale.ROOT), header);
            }
        }
        return byLower;
    }

    private static String resolve(Map<String, String> columns, List<String> aliases) {
        for (String alias : aliases) {
            String header = columns.get(alias.toLowerCase(Locale.ROOT));
            if (header != null) {
                return header;
            }
        }
        return null;
    }

    private static String value(CSVRecord record, String column) {
        if (column == null || !record.isSet(column)) {
            return null;
        }
        String v = record.get(column);
        return v == null || v.isBlank() ? null : v.strip();
    }
}
