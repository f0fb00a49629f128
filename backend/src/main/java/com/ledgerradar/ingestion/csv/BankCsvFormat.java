package com.ledgerradar.ingestion.csv;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Column layouts of the supported bank exports. Aliases are matched case-insensitively, first present wins.
 */
public enum BankCsvFormat {

    ERSTE(
            List.of("Datum knjizenja", "Datum valute", "Datum"),
            List.of("Iznos"),
            List.of("Naziv primatelja/platitelja", "Naziv"),
            List.of("IBAN primatelja/platitelja", "IBAN"),
            List.of("Poziv na broj", "Model i poziv na broj"),
            List.of("Opis placanja", "Opis"),
            List.of("ID transakcije", "Broj transakcije"),
            List.of(),
            List.of("Valuta"),
            Set.of("datum knjizenja", "opis placanja", "naziv primatelja/platitelja", "iban primatelja/platitelja")),
    PBZ(
            List.of("Datum", "Datum valute"),
            List.of("Iznos", "Promet"),
            List.of("Primatelj/Platitelj", "Naziv"),
            List.of("IBAN", "Racun"),
            List.of("Poziv na broj", "Referenca"),
            List.of("Opis", "Opis prometa"),
            List.of("ID", "Broj dokumenta"),
            List.of(),
            List.of("Valuta"),
            Set.of("primatelj/platitelj", "opis prometa", "novo stanje", "broj dokumenta")),
    ZABA(
            List.of("Datum izvrsenja", "Datum", "Datum valute"),
            List.of("Iznos", "Promet"),
            List.of("Naziv", "Naziv platitelja/primatelja"),
            List.of("IBAN racun", "IBAN"),
            List.of("Poziv na broj"),
            List.of("Svrha", "Opis"),
            List.of("Referenca", "ID transakcije"),
            List.of(),
            List.of("Valuta"),
            Set.of("datum izvrsenja", "svrha", "saldo", "iban racun")),
    GENERIC(
            List.of("date", "booking_date", "bookingDate"),
            List.of("amount"),
            List.of("counterparty_name", "counterpartyName", "payee"),
            List.of("counterparty_iban", "counterpartyIban"),
            List.of("reference"),
            List.of("description"),
            List.of("external_id", "externalId"),
            List.of("direction"),
            List.of("currency"),
            Set.of());

    private final List<String> date;
    private final List<String> amount;
    private final List<String> counterpartyName;
    private final List<String> counterpartyIban;
    private final List<String> reference;
    private final List<String> description;
    private final List<String> externalId;
    private final List<String> direction;
    private final List<String> currency;
    /** Lower-case headers that only this bank's export carries. */
    private final Set<String> signature;

    BankCsvFormat(List<String> date, List<String> amount, List<String> counterpartyName, List<String> counterpartyIban,
                  List<String> reference, List<String> description, List<String> externalId, List<String> direction,
                  List<String> currency, Set<String> signature) {
        this.date = date;
        this.amount = amount;
        this.counterpartyName = counterpartyName;
        this.counterpartyIban = counterpartyIban;
        this.reference = reference;
        this.description = description;
        this.externalId = externalId;
        this.direction = direction;
        this.currency = currency;
        this.signature = signature;
    }

    public List<String> date() {
        return date;
    }

    public List<String> amount() {
        return amount;
    }

    public List<String> counterpartyName() {
        return counterpartyName;
    }

    public List<String> counterpartyIban() {
        return counterpartyIban;
    }

    public List<String> reference() {
        return reference;
    }

    public List<String> description() {
        return description;
    }

    public List<String> externalId() {
        return externalId;
    }

    public List<String> direction() {
        return direction;
    }

    public List<String> currency() {
        return currency;
    }

    /**
     * The bank whose signature headers overlap most with the given header row; GENERIC when none overlaps.
     */
    public static BankCsvFormat detect(List<String> headers) {
        Set<String> lower = headers.stream()
                .map(h -> h.strip().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        BankCsvFormat best = GENERIC;
        long bestHits = 0;
        for (BankCsvFormat format : values()) {
            long hits = format.signature.stream().filter(lower::contains).count();
            if (hits > bestHits) {
                best = format;
                bestHits = hits;
            }
        }
        if (best == GENERIC && lower.contains("datum") && lower.contains("iznos")) {
            return PBZ;
        }
        return best;
    }
}
