package com.ledgerradar.ingestion.pdf;

import com.ledgerradar.ingestion.error.MalformedStatementException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSString;
import org.apache.pdfbox.pdfparser.PDFStreamParser;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Per-page text of a PDF statement. A page the layout-aware stripper cannot read falls back to a raw
 * scan of the page content stream for string operands.
 */
@Component
@Slf4j
public class PdfPageTextExtractor {

    /** Text-positioning operators that start a new visual line. */
    private static final Set<String> LINE_BREAK_OPERATORS = Set.of("ET", "T*", "Td", "TD", "'", "\"");

    /**
     * @return one entry per page, index 0 = page 1
     * @throws MalformedStatementException when the document cannot be opened or has no pages
     */
    public List<String> extractPages(byte[] pdf) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            int pageCount = document.getNumberOfPages();
            if (pageCount == 0) {
                throw new MalformedStatementException("PDF has no pages");
            }
            List<String> texts = new ArrayList<>(pageCount);
            for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
                texts.add(pageText(document, pageNumber));
            }
            return texts;
        } catch (IOException e) {
            throw new MalformedStatementException("Cannot open PDF: " + e.getMessage(), e);
        }
    }

    private String pageText(PDDocument document, int pageNumber) {
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setStartPage(pageNumber);
            stripper.setEndPage(pageNumber);
            return stripper.getText(document);
        } catch (IOException | RuntimeException e) {
            log.warn("Text stripper failed on page {}; using degraded content-stream scan. cause={}", pageNumber, e.toString());
            return degradedText(document.getPage(pageNumber - 1), pageNumber);
        }
    }

    /** String operands of the page content stream in stream order. Empty when the stream itself is unreadable. */
    static String degradedText(PDPage page, int pageNumber) {
        StringBuilder text = new StringBuilder();
        try {
            PDFStreamParser parser = new PDFStreamParser(page);
            Object token;
            while ((token = parser.parseNextToken()) != null) {
                if (token instanceof COSString s) {
                    text.append(s.getString());
                } else if (token instanceof COSArray array) {
                    for (COSBase element : array) {
                        if (element instanceof COSString s) {
                            text.append(s.getString());
                        }
                    }
                } else if (token instanceof Operator op && LINE_BREAK_OPERATORS.contains(op.getName())) {
                    if (text.length() > 0 && text.charAt(text.length() - 1) != '\n') {
                        text.append('\n');
                    }
                }
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Content stream of page {} is unreadable; page continues with {} chars. cause={}",
                    pageNumber, text.length(), e.toString());
        }
        return text.toString();
    }
}
