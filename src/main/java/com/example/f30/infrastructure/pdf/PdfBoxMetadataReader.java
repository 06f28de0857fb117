package com.example.f30.infrastructure.pdf;

import com.example.f30.domain.model.PdfDocumentMetadata;
import com.example.f30.domain.model.PdfInfoDictionary;
import com.example.f30.domain.model.PdfXmpMetadata;
import com.example.f30.infrastructure.exception.UnreadableDocumentException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentCatalog;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDMetadata;
import org.apache.xmpbox.XMPMetadata;
import org.apache.xmpbox.schema.AdobePDFSchema;
import org.apache.xmpbox.schema.XMPBasicSchema;
import org.apache.xmpbox.xml.DomXmpParser;
import org.apache.xmpbox.xml.XmpParsingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Calendar;

/**
 * Infrastructure service that turns PDFBox metadata and raw file structure into the DTOs consumed
 * by the authenticity heuristics. Hides the PDFBox parsing details from the rest of the application.
 */
@Service
public class PdfBoxMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxMetadataReader.class);
    private static final byte[] EOF_MARKER = "%%EOF".getBytes(StandardCharsets.US_ASCII);

    /**
     * Loads the PDF and reads its info dictionary, XMP packet and structure counters.
     *
     * @param bytes raw file bytes
     * @return structured metadata
     * @throws UnreadableDocumentException when PDFBox cannot open the file
     */
    public PdfDocumentMetadata readMetadata(byte[] bytes) {
        try (PDDocument document = Loader.loadPDF(bytes)) {
            return readMetadata(document, bytes);
        } catch (IOException e) {
            throw new UnreadableDocumentException("Unable to read PDF metadata", e);
        }
    }

    /**
     * Reads the metadata from an already opened {@link PDDocument}.
     *
     * @param document opened PDF document
     * @param bytes    the bytes the document was loaded from, scanned for appended revisions
     * @return structured metadata
     * @throws IOException when page annotations cannot be read
     */
    PdfDocumentMetadata readMetadata(PDDocument document, byte[] bytes) throws IOException {
        PdfInfoDictionary info = extractInfo(document.getDocumentInformation());
        PdfXmpMetadata xmp = extractXmp(document.getDocumentCatalog());

        return new PdfDocumentMetadata(
                info,
                xmp,
                document.getNumberOfPages(),
                String.valueOf(document.getDocument().getVersion()),
                document.isEncrypted(),
                bytes.length,
                Math.max(0, countEofMarkers(bytes) - 1),
                countAnnotations(document)
        );
    }

    private PdfInfoDictionary extractInfo(PDDocumentInformation info) {
        if (info == null) {
            return null;
        }
        return new PdfInfoDictionary(
                info.getTitle(),
                info.getAuthor(),
                info.getCreator(),
                info.getProducer(),
                toInstant(info.getCreationDate()),
                toInstant(info.getModificationDate())
        );
    }

    /**
     * Extracts the XMP payload into {@link PdfXmpMetadata}.
     *
     * @param catalog document catalog supplied by PDFBox
     * @return parsed XMP metadata or {@code null} if missing/invalid
     */
    private PdfXmpMetadata extractXmp(PDDocumentCatalog catalog) {
        if (catalog == null) {
            return null;
        }
        PDMetadata pdMetadata = catalog.getMetadata();
        if (pdMetadata == null) {
            return null;
        }
        try (InputStream metadataStream = pdMetadata.exportXMPMetadata()) {
            if (metadataStream == null) {
                return null;
            }
            DomXmpParser parser = new DomXmpParser();
            parser.setStrictParsing(false);
            XMPMetadata xmp = parser.parse(metadataStream);
            XMPBasicSchema basic = xmp.getXMPBasicSchema();
            AdobePDFSchema pdf = xmp.getAdobePDFSchema();

            return new PdfXmpMetadata(
                    basic != null ? basic.getCreatorTool() : null,
                    pdf != null ? pdf.getProducer() : null,
                    basic != null ? toInstant(basic.getCreateDate()) : null,
                    basic != null ? toInstant(basic.getModifyDate()) : null,
                    basic != null ? toInstant(basic.getMetadataDate()) : null
            );
        } catch (IOException | XmpParsingException ex) {
            log.warn("Failed to parse XMP metadata", ex);
            return null;
        }
    }

    private int countAnnotations(PDDocument document) throws IOException {
        int count = 0;
        for (PDPage page : document.getPages()) {
            count += page.getAnnotations().size();
        }
        return count;
    }

    /**
     * Counts {@code %%EOF} markers; every incremental save appends one.
     */
    static int countEofMarkers(byte[] bytes) {
        int count = 0;
        outer:
        for (int i = 0; i <= bytes.length - EOF_MARKER.length; i++) {
            for (int j = 0; j < EOF_MARKER.length; j++) {
                if (bytes[i + j] != EOF_MARKER[j]) {
                    continue outer;
                }
            }
            count++;
            i += EOF_MARKER.length - 1;
        }
        return count;
    }

    private Instant toInstant(Calendar calendar) {
        return calendar == null ? null : calendar.toInstant();
    }
}
