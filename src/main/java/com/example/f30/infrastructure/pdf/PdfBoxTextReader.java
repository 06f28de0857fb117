package com.example.f30.infrastructure.pdf;

import com.example.f30.infrastructure.exception.UnreadableDocumentException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Reads the text layer of a PDF with {@link PDFTextStripper}. This is the OCR stage of the pipeline:
 * certificates issued by the registry carry an embedded text layer.
 */
@Service
public class PdfBoxTextReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextReader.class);

    /**
     * Extracts the full document text, one line per text line.
     *
     * @param bytes raw PDF bytes
     * @return stripped text, possibly empty for image-only PDFs
     * @throws UnreadableDocumentException when the bytes are not a readable PDF
     */
    public String readText(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new UnreadableDocumentException("Document is empty");
        }
        try (PDDocument document = Loader.loadPDF(bytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setShouldSeparateByBeads(true);
            stripper.setLineSeparator("\n");
            String text = stripper.getText(document).strip();
            log.debug("Read {} characters from {} page(s)", text.length(), document.getNumberOfPages());
            return text;
        } catch (IOException e) {
            throw new UnreadableDocumentException("Unable to read the PDF text layer", e);
        }
    }
}
