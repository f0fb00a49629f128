package com.ledgerradar.ingestion.intake;

import com.ledgerradar.domain.DocumentFormat;
import com.ledgerradar.ingestion.error.UnsupportedFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Decides XML vs PDF vs CSV from the file extension and a sniff of the first KiB.
 * A positive sniff wins over a misleading extension; content that matches nothing is rejected.
 */
@Component
@Slf4j
public class FormatRouter {

    private static final int SNIFF_BYTES = 1024;
    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);

    public DocumentFormat route(String fileName, byte[] content) {
        if (content == null || content.length == 0) {
            throw new UnsupportedFormatException("Empty file");
        }
        DocumentFormat byExtension = fromExtension(extensionOf(fileName));
        DocumentFormat sniffed = sniff(content);
        if (sniffed == null) {
            throw new UnsupportedFormatException(byExtension == null
                    ? "Unrecognized statement format: " + fileName
                    : "File " + fileName + " does not contain " + byExtension + " content");
        }
        if (byExtension != null && byExtension != sniffed) {
            log.info("Extension of {} suggests {} but content is {}; using content", fileName, byExtension, sniffed);
        }
        return sniffed;
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static DocumentFormat fromExtension(String extension) {
        return switch (extension) {
            case "xml" -> DocumentFormat.CAMT053_XML;
            case "pdf" -> DocumentFormat.PDF;
            case "csv", "txt" -> DocumentFormat.CSV;
            default -> null;
        };
    }

    static DocumentFormat sniff(byte[] content) {
        int len = Math.min(content.length, SNIFF_BYTES);
        if (containsPdfMagic(content, len)) {
            return DocumentFormat.PDF;
        }
        String head = new String(content, 0, len, StandardCharsets.UTF_8);
        if (head.indexOf('\0') >= 0) {
            return null;
        }
        String trimmed = stripBom(head).stripLeading();
        if (trimmed.startsWith("<?xml") || (trimmed.startsWith("<")
                && (trimmed.contains("<Document") || trimmed.contains("BkToCstmrStmt")))) {
            return DocumentFormat.CAMT053_XML;
        }
        if (!trimmed.startsWith("<") && looksDelimited(trimmed)) {
            return DocumentFormat.CSV;
        }
        return null;
    }

    private static boolean containsPdfMagic(byte[] content, int len) {
        outer:
        for (int i = 0; i + PDF_MAGIC.length <= len; i++) {
            for (int j = 0; j < PDF_MAGIC.length; j++) {
                if (content[i + j] != PDF_MAGIC[j]) {
                    continue outer;
                }
            }
            return true;
        }
        return false;
    }

    private static boolean looksDelimited(String text) {
        int eol = text.indexOf('\n');
        String header = eol < 0 ? text : text.substring(0, eol);
        return header.indexOf(';') >= 0 || header.indexOf(',') >= 0 || header.indexOf('\t') >= 0;
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }
}
