package com.ai.courseassistant.service;

import com.ai.courseassistant.exception.TextExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * PdfExtractionService is responsible for extracting raw text content
 * from stored PDF course files using Apache PDFBox.
 */
@Slf4j
@Service
public class PdfExtractionService {

    /**
     * Extracts the text of every page and concatenates it in page order.
     *
     * <p>
     * A page with no text layer (a scanned image, a blank separator page)
     * contributes an empty string instead of failing the document. Deciding
     * whether the document as a whole is empty is left to the caller.
     * </p>
     *
     * @param filePath path of the stored PDF
     * @return the concatenated page text, possibly blank
     * @throws TextExtractionException if the file is missing, encrypted or not a readable PDF
     */
    public String extractText(Path filePath) {
        if (filePath == null || !Files.isReadable(filePath)) {
            throw new TextExtractionException("PDF file is missing or unreadable: " + filePath);
        }

        log.info("Starting PDF text extraction for file: {}", filePath.getFileName());

        try (PDDocument document = PDDocument.load(filePath.toFile())) {

            if (document.isEncrypted()) {
                log.warn("PDF is encrypted: {}", filePath.getFileName());
                throw new TextExtractionException("Cannot process encrypted PDF files. Please provide an unprotected PDF.");
            }

            int pageCount = document.getNumberOfPages();
            log.debug("PDF loaded. Total pages: {}", pageCount);

            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);    // handles multi-column layouts

            StringBuilder text = new StringBuilder();
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(document);
                text.append(pageText == null ? "" : pageText);
            }

            log.info("Text extraction complete. pages={}, characters={}", pageCount, text.length());
            return text.toString();

        } catch (IOException e) {
            log.error("Failed to extract text from PDF: {}", filePath.getFileName(), e);
            throw new TextExtractionException("Could not read PDF " + filePath.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
