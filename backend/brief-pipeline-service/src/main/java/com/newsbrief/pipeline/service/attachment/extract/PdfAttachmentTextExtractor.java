package com.newsbrief.pipeline.service.attachment.extract;

import com.itextpdf.commons.exceptions.ITextException;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.canvas.parser.PdfTextExtractor;
import com.newsbrief.pipeline.exception.TextExtractionException;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Set;

/**
 * PDF 텍스트 추출 (iText)
 */
@Component
public class PdfAttachmentTextExtractor implements AttachmentTextExtractor {

    @Override
    public Set<String> supportedTypes() {
        return Set.of("pdf");
    }

    @Override
    public String extractText(byte[] content, String type, int maxChars) {
        try (PdfDocument pdf = new PdfDocument(new PdfReader(new ByteArrayInputStream(content)))) {
            StringBuilder text = new StringBuilder();
            for (int page = 1; page <= pdf.getNumberOfPages() && text.length() < maxChars; page++) {
                text.append(PdfTextExtractor.getTextFromPage(pdf.getPage(page))).append('\n');
            }
            return text.toString();
        } catch (IOException | ITextException e) {
            throw TextExtractionException.corrupt(type, e);
        }
    }
}
