package com.example.f30.infrastructure.pdf;

import com.example.f30.CertificateFixtures;
import com.example.f30.domain.model.PdfDocumentMetadata;
import com.example.f30.infrastructure.exception.UnreadableDocumentException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.GregorianCalendar;
import java.util.List;
import java.util.TimeZone;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Unit tests for the PDFBox-backed metadata reader.
 */
class PdfBoxMetadataReaderTest {

    private final PdfBoxMetadataReader reader = new PdfBoxMetadataReader();

    /**
     * Verifies that info dictionary values and structure counters are read.
     */
    @Test
    void readsInfoDictionaryAndCounters() {
        GregorianCalendar created = new GregorianCalendar(TimeZone.getTimeZone("UTC"));
        created.setTimeInMillis(1_742_040_000_000L);
        byte[] pdf = CertificateFixtures.createPdf(List.of("CERTIFICADO"), info -> {
            info.setProducer("iText 5.5.13");
            info.setCreator("Direccion del Trabajo");
            info.setCreationDate(created);
        });

        PdfDocumentMetadata metadata = reader.readMetadata(pdf);

        assertThat(metadata.infoDictionary()).isNotNull();
        assertThat(metadata.infoDictionary().producer()).isEqualTo("iText 5.5.13");
        assertThat(metadata.infoDictionary().creator()).isEqualTo("Direccion del Trabajo");
        assertThat(metadata.infoDictionary().creationDate()).isEqualTo(created.toInstant());
        assertThat(metadata.xmpMetadata()).isNull();
        assertThat(metadata.pageCount()).isEqualTo(1);
        assertThat(metadata.fileSizeBytes()).isEqualTo(pdf.length);
        assertThat(metadata.incrementalUpdates()).isZero();
        assertThat(metadata.annotationCount()).isZero();
    }

    @Test
    void countsAppendedRevisions() {
        byte[] bytes = "%PDF-1.7\n...\n%%EOF\n...\n%%EOF\n...\n%%EOF\n".getBytes(StandardCharsets.US_ASCII);

        assertThat(PdfBoxMetadataReader.countEofMarkers(bytes)).isEqualTo(3);
        assertThat(PdfBoxMetadataReader.countEofMarkers(new byte[0])).isZero();
    }

    @Test
    void nonPdfBytesAreUnreadable() {
        byte[] bytes = "not a pdf".getBytes(StandardCharsets.US_ASCII);

        assertThrows(UnreadableDocumentException.class, () -> reader.readMetadata(bytes));
    }
}
