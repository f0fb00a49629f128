package com.ledgerradar.ingestion.pdf;

import com.ledgerradar.ingestion.config.ExtractionProperties;
import com.ledgerradar.ingestion.error.MalformedStatementException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;

/**
 * Renders single statement pages to PNG for the vision tier.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PdfPageRenderer {

    private final ExtractionProperties properties;

    /**
     * @param pageNumber 1-based
     * @return base64-encoded PNG
     */
    public String renderPngBase64(byte[] pdf, int pageNumber) {
        try (PDDocument document = Loader.loadPDF(pdf)) {
            if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
                throw new IllegalArgumentException("Page " + pageNumber + " out of range 1.." + document.getNumberOfPages());
            }
            BufferedImage image = new PDFRenderer(document)
                    .renderImageWithDPI(pageNumber - 1, properties.getRenderDpi(), ImageType.RGB);
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(image, "png", out);
            log.debug("Rendered page {} at {} dpi ({} bytes)", pageNumber, properties.getRenderDpi(), out.size());
            return Base64.getEncoder().encodeToString(out.toByteArray());
        } catch (IOException e) {
            throw new MalformedStatementException("Cannot render page " + pageNumber + ": " + e.getMessage(), e);
        }
    }
}
