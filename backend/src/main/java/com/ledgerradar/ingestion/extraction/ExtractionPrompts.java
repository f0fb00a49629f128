package com.ledgerradar.ingestion.extraction;

/**
 * Prompts and the response schema shared by every OpenAI-compatible provider.
 */
final class ExtractionPrompts {

    static final String SCHEMA_NAME = "statement_page";

    static final String TEXT_SYSTEM = """
            You extract bank statement data. You receive the text of ONE page of a bank statement.
            Return every booked transaction on the page in the order printed.
            Rules:
            - date: booking date as YYYY-MM-DD.
            - direction: INCOMING for credits (money received), OUTGOING for debits (money paid out).
            - amount: absolute value with a dot as decimal separator; never negative.
            - payee: the counterparty name, reference: payment reference or invoice number when printed.
            - pageStartBalance: balance printed at the top of the page (opening or carried-forward balance), else null.
            - pageEndBalance: balance printed at the bottom of the page (closing or carried-over balance), else null.
            - A description wrapped over several lines belongs to ONE transaction.
            - Do not invent values. Use null for anything not printed on this page.
            """;

    static final String VISION_SYSTEM = """
            You repair bank statement extractions. You receive the image of ONE statement page, the text
            extracted from it, and a previous extraction that failed a balance check
            (pageStartBalance + incoming - outgoing must equal pageEndBalance).
            Re-read the page image and return the corrected extraction.
            Typical errors: a wrapped description split into two transactions, a missed row,
            a credit read as a debit, a misread digit, balances taken from the wrong line.
            Same rules as the original extraction: ISO dates, absolute amounts, INCOMING or OUTGOING,
            null for anything not printed on the page.
            """;

    static final String RESPONSE_SCHEMA = """
            {
              "type": "object",
              "additionalProperties": false,
              "required": ["transactions", "pageStartBalance", "pageEndBalance", "metadata"],
              "properties": {
                "transactions": {
                  "type": "array",
                  "items": {
                    "type": "object",
                    "additionalProperties": false,
                    "required": ["date", "direction", "amount", "payee", "description", "reference", "counterpartyIban"],
                    "properties": {
                      "date": {"type": "string"},
                      "direction": {"type": "string", "enum": ["INCOMING", "OUTGOING"]},
                      "amount": {"type": "number"},
                      "payee": {"type": ["string", "null"]},
                      "description": {"type": ["string", "null"]},
                      "reference": {"type": ["string", "null"]},
                      "counterpartyIban": {"type": ["string", "null"]}
                    }
                  }
                },
                "pageStartBalance": {"type": ["number", "null"]},
                "pageEndBalance": {"type": ["number", "null"]},
                "metadata": {
                  "type": ["object", "null"],
                  "additionalProperties": false,
                  "required": ["sequenceNumber", "statementDate", "periodStart", "periodEnd", "currency", "iban"],
                  "properties": {
                    "sequenceNumber": {"type": ["integer", "null"]},
                    "statementDate": {"type": ["string", "null"]},
                    "periodStart": {"type": ["string", "null"]},
                    "periodEnd": {"type": ["string", "null"]},
                    "currency": {"type": ["string", "null"]},
                    "iban": {"type": ["string", "null"]}
                  }
                }
              }
            }
            """;

    private ExtractionPrompts() {
    }

    static String textUserMessage(PageContext context) {
        return "Page " + context.pageNumber() + " of " + context.pageCount()
                + ". Currency if none is printed: " + context.defaultCurrency() + ".\n\n"
                + "PAGE TEXT:\n" + context.text();
    }

    static String visionUserMessage(PageContext context) {
        return textUserMessage(context)
                + "\n\nPREVIOUS EXTRACTION (failed the balance check):\n"
                + (context.priorCandidateJson() == null ? "null" : context.priorCandidateJson());
    }
}
