package com.ledgerradar.ingestion.xml;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlText;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson XML binding for the parts of ISO 20022 camt.053 (and camt.052 reports) that the importer reads.
 * Element names are matched by local name, so any namespace version binds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@NoArgsConstructor
@Getter
@Setter
public class Camt053Document {

    @JacksonXmlProperty(localName = "BkToCstmrStmt")
    private Message statementMessage;

    @JacksonXmlProperty(localName = "BkToCstmrAcctRpt")
    private Message reportMessage;

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Message {
        @JacksonXmlProperty(localName = "Stmt")
        @JacksonXmlElementWrapper(useWrapping = false)
        private List<Report> statements = new ArrayList<>();

        @JacksonXmlProperty(localName = "Rpt")
        @JacksonXmlElementWrapper(useWrapping = false)
        private List<Report> reports = new ArrayList<>();
    }

    /** Stmt or Rpt: same element names in both messages. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Report {
        @JacksonXmlProperty(localName = "Id")
        private String id;
        @JacksonXmlProperty(localName = "ElctrncSeqNb")
        private String electronicSequenceNumber;
        @JacksonXmlProperty(localName = "LglSeqNb")
        private String legalSequenceNumber;
        @JacksonXmlProperty(localName = "CreDtTm")
        private String createdAt;
        @JacksonXmlProperty(localName = "FrToDt")
        private Period period;
        @JacksonXmlProperty(localName = "Acct")
        private Account account;
        @JacksonXmlProperty(localName = "Bal")
        @JacksonXmlElementWrapper(useWrapping = false)
        private List<Balance> balances = new ArrayList<>();
        @JacksonXmlProperty(localName = "Ntry")
        @JacksonXmlElementWrapper(useWrapping = false)
        private List<Entry> entries = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Period {
        @JacksonXmlProperty(localName = "FrDtTm")
        private String from;
        @JacksonXmlProperty(localName = "ToDtTm")
        private String to;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Account {
        @JacksonXmlProperty(localName = "Id")
        private AccountId id;
        @JacksonXmlProperty(localName = "Ccy")
        private String currency;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class AccountId {
        @JacksonXmlProperty(localName = "IBAN")
        private String iban;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Balance {
        @JacksonXmlProperty(localName = "Tp")
        private BalanceType type;
        @JacksonXmlProperty(localName = "Amt")
        private Amount amount;
        @JacksonXmlProperty(localName = "CdtDbtInd")
        private String creditDebitIndicator;
        @JacksonXmlProperty(localName = "Dt")
        private DateChoice date;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class BalanceType {
        @JacksonXmlProperty(localName = "CdOrPrtry")
        private CodeOrProprietary codeOrProprietary;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class CodeOrProprietary {
        @JacksonXmlProperty(localName = "Cd")
        private String code;
        @JacksonXmlProperty(localName = "Prtry")
        private String proprietary;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Amount {
        @JacksonXmlProperty(isAttribute = true, localName = "Ccy")
        private String currency;
        @JacksonXmlText
        private String value;
    }

    /** Dt or DtTm. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class DateChoice {
        @JacksonXmlProperty(localName = "Dt")
        private String date;
        @JacksonXmlProperty(localName = "DtTm")
        private String dateTime;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Entry {
        @JacksonXmlProperty(localName = "NtryRef")
        private String entryReference;
        @JacksonXmlProperty(localName = "Amt")
        private Amount amount;
        @JacksonXmlProperty(localName = "CdtDbtInd")
        private String creditDebitIndicator;
        @JacksonXmlProperty(localName = "BookgDt")
        private DateChoice bookingDate;
        @JacksonXmlProperty(localName = "ValDt")
        private DateChoice valueDate;
        @JacksonXmlProperty(localName = "AcctSvcrRef")
        private String servicerReference;
        @JacksonXmlProperty(localName = "AddtlNtryInf")
        private String additionalInfo;
        @JacksonXmlProperty(localName = "NtryDtls")
        @JacksonXmlElementWrapper(useWrapping = false)
        private List<EntryDetails> details = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class EntryDetails {
        @JacksonXmlProperty(localName = "TxDtls")
        @JacksonXmlElementWrapper(useWrapping = false)
        private List<TransactionDetails> transactions = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class TransactionDetails {
        @JacksonXmlProperty(localName = "Refs")
        private References references;
        @JacksonXmlProperty(localName = "RltdPties")
        private RelatedParties relatedParties;
        @JacksonXmlProperty(localName = "RmtInf")
        private RemittanceInfo remittanceInfo;
        @JacksonXmlProperty(localName = "AddtlTxInf")
        private String additionalInfo;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class References {
        @JacksonXmlProperty(localName = "EndToEndId")
        private String endToEndId;
        @JacksonXmlProperty(localName = "TxId")
        private String transactionId;
        @JacksonXmlProperty(localName = "InstrId")
        private String instructionId;
        @JacksonXmlProperty(localName = "AcctSvcrRef")
        private String servicerReference;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class RelatedParties {
        @JacksonXmlProperty(localName = "Dbtr")
        private Party debtor;
        @JacksonXmlProperty(localName = "DbtrAcct")
        private PartyAccount debtorAccount;
        @JacksonXmlProperty(localName = "UltmtDbtr")
        private Party ultimateDebtor;
        @JacksonXmlProperty(localName = "Cdtr")
        private Party creditor;
        @JacksonXmlProperty(localName = "CdtrAcct")
        private PartyAccount creditorAccount;
        @JacksonXmlProperty(localName = "UltmtCdtr")
        private Party ultimateCreditor;
    }

    /** Name directly under the party (camt.053.001.02) or under Pty (camt.053.001.08). */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Party {
        @JacksonXmlProperty(localName = "Nm")
        private String name;
        @JacksonXmlProperty(localName = "Pty")
        private Party party;

        public String resolvedName() {
            if (name != null && !name.isBlank()) {
                return name.strip();
            }
            return party == null ? null : party.resolvedName();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class PartyAccount {
        @JacksonXmlProperty(localName = "Id")
        private AccountId id;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class RemittanceInfo {
        @JacksonXmlProperty(localName = "Ustrd")
        @JacksonXmlElementWrapper(useWrapping = false)
        private List<String> unstructured = new ArrayList<>();
        @JacksonXmlProperty(localName = "Strd")
        @JacksonXmlElementWrapper(useWrapping = false)
        private List<StructuredRemittance> structured = new ArrayList<>();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class StructuredRemittance {
        @JacksonXmlProperty(localName = "CdtrRefInf")
        private CreditorReference creditorReference;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @NoArgsConstructor
    @Getter
    @Setter
    public static class CreditorReference {
        @JacksonXmlProperty(localName = "Ref")
        private String reference;
    }
}
