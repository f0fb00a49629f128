package com.ledgerradar.ingestion.xml;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlFactory;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.ledgerradar.domain.PageStatus;
import com.ledgerradar.domain.StatementLine;
import com.ledgerradar.domain.TierType;
import com.ledgerradar.domain.TransactionDirection;
import com.ledgerradar.ingestion.error.MalformedStatementException;
import com.ledgerradar.ingestion.store.PageDraft;
import com.ledgerradar.ingestion.store.StatementDraft;
import com.ledgerradar.ingestion.xml.Camt053Document.Balance;
import com.ledgerradar.ingestion.xml.Camt053Document.DateChoice;
import com.ledgerradar.ingestion.xml.Camt053Document.Entry;
import com.ledgerradar.ingestion.xml.Camt053Document.Party;
import com.ledgerradar.ingestion.xml.Camt053Document.PartyAccount;
import com.ledgerradar.ingestion.xml.Camt053Document.Report;
import com.ledgerradar.ingestion.xml.Camt053Document.TransactionDetails;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLInputFactory;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Tier 1: deterministic CAMT.053 parser. Produces a single verified page; any structural defect fails
 * the whole document.
 */
@Component
@Slf4j
public class Camt053Extractor {

    static final String OPENING_BOOKED = "OPBD";
    static final String PREVIOUSLY_CLOSED_BOOKED = "PRCD";
    static final String CLOSING_BOOKED = "CLBD";
    private static final String NOT_PROVIDED = "NOTPROVIDED";

    private final XmlMapper xmlMapper;

    public Camt053Extractor() {
        XMLInputFactory inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        this.xmlMapper = new XmlMapper(new XmlFactory(inputFactory));
        this.xmlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public StatementDraft extract(byte[] xml, String defaultCurrency) {
        Camt053Document document;
        try {
            document = xmlMapper.readValue(xml, Camt053Document.class);
        } catch (IOException e) {
            throw new MalformedStatementException("Unparseable CAMT.053 XML: " + e.getMessage(), e);
        }
        Report report = singleReport(document);

        BigDecimal opening = balance(report, OPENING_BOOKED)
                .or(() -> balance(report, PREVIOUSLY_CLOSED_BOOKED))
                .orElseThrow(() -> new MalformedStatementException("Statement " + report.getId() + " has no OPBD balance"));
        BigDecimal closing = balance(report, CLOSING_BOOKED)
                .orElseThrow(() -> new MalformedStatementException("Statement " + report.getId() + " has no CLBD balance"));

        String currency = Optional.ofNullable(report.getAccount()).map(Camt053Document.Account::getCurrency)
                .or(() -> report.getBalances().stream()
                        .map(Balance::getAmount).filter(Objects::nonNull)
                        .map(Camt053Document.Amount::getCurrency).filter(Objects::nonNull).findFirst())
                .orElse(defaultCurrency);
        String iban = Optional.ofNullable(report.getAccount()).map(Camt053Document.Account::getId)
                .map(Camt053Document.AccountId::getIban).orElse(null);

        List<StatementLine> lines = new ArrayList<>();
        int index = 0;
        for (Entry entry : report.getEntries()) {
            index++;
            lines.add(toLine(entry, index, currency));
        }

        LocalDate periodStart = report.getPeriod() != null ? parseDate(report.getPeriod().getFrom()) : null;
        LocalDate periodEnd = report.getPeriod() != null ? parseDate(report.getPeriod().getTo()) : null;
        if (periodStart == null) {
            periodStart = lines.stream().map(StatementLine::getBookingDate).min(Comparator.naturalOrder()).orElse(null);
        }
        if (periodEnd == null) {
            periodEnd = lines.stream().map(StatementLine::getBookingDate).max(Comparator.naturalOrder()).orElse(null);
        }

        PageDraft page = new PageDraft(1, PageStatus.VERIFIED, TierType.XML, null, opening, closing, null,
                new String(xml, StandardCharsets.UTF_8), lines);
        return new StatementDraft(
                report.getId(),
                sequenceNumber(report),
                periodStart,
                periodEnd,
                parseDate(report.getCreatedAt()),
                opening,
                closing,
                currency,
                iban,
                TierType.XML,
                List.of(page));
    }

    private static Report singleReport(Camt053Document document) {
        List<Report> reports = Stream.of(document.getStatementMessage(), document.getReportMessage())
                .filter(Objects::nonNull)
                .flatMap(m -> Stream.concat(m.getStatements().stream(), m.getReports().stream()))
                .toList();
        if (reports.isEmpty()) {
            throw new MalformedStatementException("No Stmt or Rpt element found");
        }
        if (reports.size() > 1) {
            throw new MalformedStatementException("Document carries " + reports.size()
                    + " Stmt/Rpt elements; upload each statement separately");
        }
        return reports.get(0);
    }

    private static Optional<BigDecimal> balance(Report report, String code) {
        return report.getBalances().stream()
                .filter(b -> b.getType() != null && b.getType().getCodeOrProprietary() != null)
                .filter(b -> code.equals(b.getType().getCodeOrProprietary().getCode())
                        || code.equals(b.getType().getCodeOrProprietary().getProprietary()))
                .findFirst()
                .map(b -> {
                    BigDecimal amount = amount(b.getAmount(), "balance " + code);
                    return "DBIT".equals(b.getCreditDebitIndicator()) ? amount.negate() : amount;
                });
    }

    private static StatementLine toLine(Entry entry, int index, String statementCurrency) {
        BigDecimal amount = amount(entry.getAmount(), "entry " + index);
        TransactionDirection direction = switch (Objects.requireNonNullElse(entry.getCreditDebitIndicator(), "")) {
            case "CRDT" -> TransactionDirection.INCOMING;
            case "DBIT" -> TransactionDirection.OUTGOING;
            default -> throw new MalformedStatementException(
                    "Entry " + index + " has invalid CdtDbtInd '" + entry.getCreditDebitIndicator() + "'");
        };
        LocalDate bookingDate = date(entry.getBookingDate());
        LocalDate valueDate = date(entry.getValueDate());
        if (bookingDate == null) {
            bookingDate = valueDate;
        }
        if (bookingDate == null) {
            throw new MalformedStatementException("Entry " + index + " has neither BookgDt nor ValDt");
        }

        TransactionDetails tx = entry.getDetails().stream()
                .flatMap(d -> d.getTransactions().stream())
                .findFirst()
                .orElse(null);

        StatementLine line = new StatementLine();
        line.setBookingDate(bookingDate);
        line.setValueDate(valueDate);
        line.setDirection(direction);
        line.setAmount(amount.abs());
        line.setCurrency(entry.getAmount().getCurrency() != null ? entry.getAmount().getCurrency() : statementCurrency);
        line.setCounterpartyName(counterpartyName(tx, direction));
        line.setCounterpartyIban(counterpartyIban(tx, direction));
        line.setDescription(description(entry, tx));
        line.setReference(reference(entry, tx));
        line.setExternalId(externalId(entry, tx));
        return line;
    }

    /** Credits come from the debtor, debits go to the creditor. */
    private static String counterpartyName(TransactionDetails tx, TransactionDirection direction) {
        if (tx == null || tx.getRelatedParties() == null) {
            return null;
        }
        var parties = tx.getRelatedParties();
        Party primary = direction == TransactionDirection.INCOMING ? parties.getDebtor() : parties.getCreditor();
        Party ultimate = direction == TransactionDirection.INCOMING ? parties.getUltimateDebtor() : parties.getUltimateCreditor();
        return Stream.of(primary, ultimate)
                .filter(Objects::nonNull)
                .map(Party::resolvedName)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);
    }

    private static String counterpartyIban(TransactionDetails tx, TransactionDirection direction) {
        if (tx == null || tx.getRelatedParties() == null) {
            return null;
        }
        PartyAccount account = direction == TransactionDirection.INCOMING
                ? tx.getRelatedParties().getDebtorAccount()
                : tx.getRelatedParties().getCreditorAccount();
        if (account == null || account.getId() == null) {
            return null;
        }
        return blankToNull(account.getId().getIban());
    }

    private static String description(Entry entry, TransactionDetails tx) {
        String additional = blankToNull(entry.getAdditionalInfo());
        if (additional != null) {
            return additional;
        }
        if (tx != null && tx.getRemittanceInfo() != null && !tx.getRemittanceInfo().getUnstructured().isEmpty()) {
            String joined = String.join(" ", tx.getRemittanceInfo().getUnstructured()).strip();
            if (!joined.isEmpty()) {
                return joined;
            }
        }
        return tx == null ? null : blankToNull(tx.getAdditionalInfo());
    }

    private static String reference(Entry entry, TransactionDetails tx) {
        if (tx != null) {
            if (tx.getRemittanceInfo() != null) {
                Optional<String> structured = tx.getRemittanceInfo().getStructured().stream()
                        .map(Camt053Document.StructuredRemittance::getCreditorReference)
                        .filter(Objects::nonNull)
                        .map(Camt053Document.CreditorReference::getReference)
                        .map(Camt053Extractor::blankToNull)
                        .filter(Objects::nonNull)
                        .findFirst();
                if (structured.isPresent()) {
                    return structured.get();
                }
            }
            if (tx.getReferences() != null) {
                var refs = tx.getReferences();
                Optional<String> ref = Stream.of(refs.getEndToEndId(), refs.getTransactionId(), refs.getInstructionId())
                        .map(Camt053Extractor::providedOrNull)
                        .filter(Objects::nonNull)
                        .findFirst();
                if (ref.isPresent()) {
                    return ref.get();
                }
            }
        }
        return Optional.ofNullable(blankToNull(entry.getEntryReference()))
                .orElse(blankToNull(entry.getServicerReference()));
    }

    private static String externalId(Entry entry, TransactionDetails tx) {
        if (tx != null && tx.getReferences() != null) {
            String endToEnd = providedOrNull(tx.getReferences().getEndToEndId());
            if (endToEnd != null) {
                return endToEnd;
            }
            String servicer = blankToNull(tx.getReferences().getServicerReference());
            if (servicer != null) {
                return servicer;
            }
        }
        return blankToNull(entry.getServicerReference());
    }

    private static Long sequenceNumber(Report report) {
        for (String candidate : new String[]{report.getLegalSequenceNumber(), report.getElectronicSequenceNumber()}) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            try {
                long value = Long.parseLong(candidate.strip());
                if (value > 0) {
                    return value;
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric sequence number '{}' on statement {}", candidate, report.getId());
            }
        }
        return null;
    }

    private static BigDecimal amount(Camt053Document.Amount amount, String what) {
        if (amount == null || amount.getValue() == null || amount.getValue().isBlank()) {
            throw new MalformedStatementException("Missing Amt on " + what);
        }
        try {
            return new BigDecimal(amount.getValue().strip());
        } catch (NumberFormatException e) {
            throw new MalformedStatementException("Invalid Amt '" + amount.getValue() + "' on " + what, e);
        }
    }

    private static LocalDate date(DateChoice choice) {
        if (choice == null) {
            return null;
        }
        LocalDate d = parseDate(choice.getDate());
        return d != null ? d : parseDate(choice.getDateTime());
    }

    /** ISO date or the date part of an ISO date-time. */
    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.strip();
        try {
            return LocalDate.parse(v.length() > 10 ? v.substring(0, 10) : v);
        } catch (DateTimeParseException e) {
            throw new MalformedStatementException("Invalid date '" + value + "'", e);
        }
    }

    private static String providedOrNull(String value) {
        String v = blankToNull(value);
        return v == null || NOT_PROVIDED.equalsIgnoreCase(v) ? null : v;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
