package com.ledgerradar.ingestion.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ledgerradar.domain.TransactionDirection;
import com.ledgerradar.ingestion.error.ExtractionSchemaViolationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Validates model output against the page schema and converts it to a {@link PageCandidate}.
 * Anything that is not a JSON object with a {@code transactions} array of well-formed rows is a schema violation.
 * Numbers are read as {@link BigDecimal} straight from the JSON text.
 */
@Component
public class PageCandidateParser {

    private final ObjectMapper objectMapper;
    private final ObjectReader reader;

    public PageCandidateParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.reader = objectMapper.reader().with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    public PageCandidate parse(String content) {
        if (content == null || content.isBlank()) {
            throw new ExtractionSchemaViolationException("Empty model output");
        }
        JsonNode root;
        try {
            root = reader.readTree(stripCodeFence(content));
        } catch (JsonProcessingException e) {
            throw new ExtractionSchemaViolationException("Model output is not JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ExtractionSchemaViolationException("Model output is not a JSON object");
        }
        JsonNode rows = root.get("transactions");
        if (rows == null || !rows.isArray()) {
            throw new ExtractionSchemaViolationException("Missing transactions array");
        }
        List<CandidateTransaction> transactions = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            transactions.add(transaction(rows.get(i), i));
        }
        return new PageCandidate(
                transactions,
                optionalDecimal(root, "pageStartBalance"),
                optionalDecimal(root, "pageEndBalance"),
                metadata(root.get("metadata")));
    }

    /** Inverse of {@link #parse}: the candidate as the model would have returned it. */
    public String toJson(PageCandidate candidate) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode rows = root.putArray("transactions");
        for (CandidateTransaction tx : candidate.transactions()) {
            ObjectNode row = rows.addObject();
            row.put("date", tx.date().toString());
            row.put("direction", tx.direction().name());
            row.put("amount", tx.amount());
            row.put("payee", tx.payee());
            row.put("description", tx.description());
            row.put("reference", tx.reference());
            row.put("counterpartyIban", tx.counterpartyIban());
        }
        root.put("pageStartBalance", candidate.pageStartBalance());
        root.put("pageEndBalance", candidate.pageEndBalance());
        return root.toString();
    }

    private static CandidateTransaction transaction(JsonNode row, int index) {
        if (row == null || !row.isObject()) {
            throw new ExtractionSchemaViolationException("transactions[" + index + "] is not an object");
        }
        LocalDate date = requiredDate(row, "date", index);
        TransactionDirection direction = direction(row.get("direction"), index);
        BigDecimal amount = optionalDecimal(row, "amount");
        if (amount == null) {
            throw new ExtractionSchemaViolationException("transactions[" + index + "].amount is missing");
        }
        return new CandidateTransaction(
                date,
                direction,
                amount.abs(),
                optionalText(row, "payee"),
                optionalText(row, "description"),
                optionalText(row, "reference"),
                optionalText(row, "counterpartyIban"));
    }

    private static TransactionDirection direction(JsonNode node, int index) {
        if (node == null || !node.isTextual()) {
            throw new ExtractionSchemaViolationException("transactions[" + index + "].direction is missing");
        }
        try {
            return TransactionDirection.valueOf(node.asText().strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ExtractionSchemaViolationException(
                    "transactions[" + index + "].direction '" + node.asText() + "' is not INCOMING or OUTGOING", e);
        }
    }

    private static LocalDate requiredDate(JsonNode row, String field, int index) {
        String text = optionalText(row, field);
        if (text == null) {
            throw new ExtractionSchemaViolationException("transactions[" + index + "]." + field + " is missing");
        }
        LocalDate date = parseDate(text);
        if (date == null) {
            throw new ExtractionSchemaViolationException("transactions[" + index + "]." + field + " '" + text + "' is not ISO-8601");
        }
        return date;
    }

    private static CandidateMetadata metadata(JsonNode node) {
        if (node == null || node.isNull()) {
            return CandidateMetadata.EMPTY;
        }
        if (!node.isObject()) {
            throw new ExtractionSchemaViolationException("metadata is not an object");
        }
        BigDecimal sequence = optionalDecimal(node, "sequenceNumber");
        return new CandidateMetadata(
                sequence == null || sequence.signum() <= 0 ? null : sequence.longValue(),
                parseDate(optionalText(node, "statementDate")),
                parseDate(optionalText(node, "periodStart")),
                parseDate(optionalText(node, "periodEnd")),
                optionalText(node, "currency"),
                optionalText(node, "iban"));
    }

    private static BigDecimal optionalDecimal(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual() && !node.asText().isBlank()) {
            try {
                return new BigDecimal(node.asText().strip());
            } catch (NumberFormatException e) {
                throw new ExtractionSchemaViolationException(field + " '" + node.asText() + "' is not a number", e);
            }
        }
        throw new ExtractionSchemaViolationException(field + " is not a number");
    }

    private static String optionalText(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new ExtractionSchemaViolationException(field + " is not a scalar");
        }
        String text = node.asText().strip();
        return text.isEmpty() ? null : text;
    }

    private static LocalDate parseDate(String text) {
        if (text == null) {
            return null;
        }
        try {
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String stripCodeFence(String content) {
        String trimmed = content.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).strip();
    }
}
