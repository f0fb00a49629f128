package com.ledgerradar.ingestion.extraction;

/**
 * What a provider sees of one page. The image and prior candidate are only set for vision repair calls.
 *
 * @param pageNumber          1-based
 * @param pageCount           pages in the document
 * @param text                raw page text, possibly empty
 * @param imageBase64         rendered PNG, or null
 * @param priorCandidateJson  failed text-tier candidate to repair, or null
 * @param defaultCurrency     currency to assume when the page shows none
 */
public record PageContext(
        int pageNumber,
        int pageCount,
        String text,
        String imageBase64,
        String priorCandidateJson,
        String defaultCurrency
) {

    public static PageContext forText(int pageNumber, int pageCount, String text, String defaultCurrency) {
        return new PageContext(pageNumber, pageCount, text == null ? "" : text, null, null, defaultCurrency);
    }

    public PageContext withImage(String imageBase64, String priorCandidateJson) {
        return new PageContext(pageNumber, pageCount, text, imageBase64, priorCandidateJson, defaultCurrency);
    }

    public boolean hasImage() {
        return imageBase64 != null && !imageBase64.isEmpty();
    }
}
