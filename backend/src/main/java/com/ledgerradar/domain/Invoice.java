package com.ledgerradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Invoice as seen by reconciliation. The invoice lifecycle is owned elsewhere; this service only reads
 * unpaid outbound invoices and stamps/clears the payment.
 */
@Document(collection = "invoices")
@CompoundIndex(name = "account_direction_paid", def = "{'accountId': 1, 'direction': 1, 'paidAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Invoice {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String accountId;
    private String invoiceNumber;
    /** Payment reference printed on the invoice (e.g. HR01 model reference). */
    private String paymentReference;
    private InvoiceDirection direction;
    private String customerName;
    private BigDecimal totalAmount;
    private String currency;
    private LocalDate issueDate;
    private LocalDate dueDate;
    private Instant paidAt;
    private String paidByTransactionId;

    public boolean isPaid() {
        return paidAt != null;
    }

    public enum InvoiceDirection {
        /** Issued by the account owner; paid by a customer credit. */
        OUTBOUND,
        INBOUND
    }
}
