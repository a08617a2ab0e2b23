package com.newsbrief.pipeline.service.attachment.extract;

import com.itextpdf.kernel.font.PdfFontFactory;
import com.itextpdf.io.font.constants.StandardFonts;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.canvas.PdfCanvas;
import com.newsbrief.pipeline.exception.TextExtractionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttachmentTextExtractorsTest {

    private AttachmentTextExtractors extractors;

    @BeforeEach
    void setUp() {
        extractors = new AttachmentTextExtractors(List.of(new PdfAttachmentTextExtractor(), new PlainTextExtractor()));
    }

    @Test
    @DisplayName("PDF 페이지 텍스트 추출")
    void extractsPdf() throws IOException {
        byte[] pdf = pdfWithText("Quarterly trade summary");

        String text = extractors.extractText(pdf, "pdf", 500);

        assertThat(text).contains("Quarterly trade summary");
    }

    @Test
    @DisplayName("손상된 PDF는 TextExtractionException")
    void corruptPdf() {
        assertThatThrownBy(() -> extractors.extractText("not a pdf".getBytes(StandardCharsets.UTF_8), "pdf", 500))
                .isInstanceOf(TextExtractionException.class);
    }

    @Test
    @DisplayName("텍스트 파일은 최대 길이까지")
    void plainText() {
        assertThat(extractors.extractText("abcdef".getBytes(StandardCharsets.UTF_8), "TXT", 3)).isEqualTo("abc");
    }

    @Test
    @DisplayName("추출기가 없는 유형은 지원하지 않음")
    void unsupported() {
        assertThat(extractors.supports("docx")).isFalse();
        assertThatThrownBy(() -> extractors.extractText(new byte[0], "docx", 10))
                .isInstanceOf(TextExtractionException.class);
    }

    private byte[] pdfWithText(String text) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (PdfDocument pdf = new PdfDocument(new PdfWriter(out))) {
            PdfCanvas canvas = new PdfCanvas(pdf.addNewPage());
            canvas.beginText()
                    .setFontAndSize(PdfFontFactory.createFont(StandardFonts.HELVETICA), 12)
                    .moveText(50, 700)
                    .showText(text)
                    .endText();
        }
        return out.toByteArray();
    }
}
