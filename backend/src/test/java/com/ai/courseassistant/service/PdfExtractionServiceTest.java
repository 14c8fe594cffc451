package com.ai.courseassistant.service;

import com.ai.courseassistant.TestPdfs;
import com.ai.courseassistant.exception.TextExtractionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PdfExtractionServiceTest {

    private final PdfExtractionService service = new PdfExtractionService();

    @TempDir
    Path tempDir;

    @Test
    void concatenatesPagesAndTreatsImageOnlyPagesAsEmpty() throws Exception {
        Path pdf = TestPdfs.write(tempDir.resolve("lecture.pdf"),
                "Neural networks are layered models.", "", "Gradient descent updates weights.");

        String text = service.extractText(pdf);

        assertThat(text).contains("Neural networks are layered models.");
        assertThat(text).contains("Gradient descent updates weights.");
        assertThat(text.indexOf("Neural")).isLessThan(text.indexOf("Gradient"));
    }

    @Test
    void documentWithoutTextLayerExtractsBlank() throws Exception {
        Path pdf = TestPdfs.write(tempDir.resolve("scanned.pdf"), "", "");

        assertThat(service.extractText(pdf)).isBlank();
    }

    @Test
    void missingFileIsAnExtractionError() {
        assertThatThrownBy(() -> service.extractText(tempDir.resolve("nope.pdf")))
                .isInstanceOf(TextExtractionException.class);
    }

    @Test
    void nonPdfIsAnExtractionError() throws Exception {
        Path bogus = Files.writeString(tempDir.resolve("bogus.pdf"), "this is not a pdf");

        assertThatThrownBy(() -> service.extractText(bogus))
                .isInstanceOf(TextExtractionException.class)
                .hasMessageContaining("bogus.pdf");
    }
}
