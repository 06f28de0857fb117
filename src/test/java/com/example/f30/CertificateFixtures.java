package com.example.f30;

import com.example.f30.application.service.DocumentTypeProfileRegistry;
import com.example.f30.infrastructure.config.F30Properties;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Shared fixtures for tests: in-memory certificate PDFs, the bundled profiles and test settings.
 */
public final class CertificateFixtures {

    public static final List<String> RAZON_SOCIAL_LINES = List.of(
            "CERTIFICADO DE ANTECEDENTES LABORALES Y PREVISIONALES",
            "CODIGO CERTIFICADO: AVXY BVBO NPLQ",
            "RUT EMPLEADOR: 77.301.140-0",
            "RAZON SOCIAL / NOMBRE: SOC COMERCIAL GAS MACUL LIMITADA",
            "FECHA EMISION: 15/03/2025",
            "MULTAS EJECUTORIADAS: -- NO REGISTRA --",
            "DEUDA PREVISIONAL: NO REGISTRA"
    );

    public static final List<String> PERSONA_NATURAL_LINES = List.of(
            "CERTIFICADO DE ANTECEDENTES LABORALES Y PREVISIONALES",
            "FOLIO: 2000/2025/284236",
            "RUT: 12.102.703-8",
            "NOMBRE: RUTH MARINA AGUAYO SAEZ",
            "FECHA EMISION: 15/03/2025",
            "MULTAS EJECUTORIADAS: NO REGISTRA",
            "DEUDA PREVISIONAL: NO REGISTRA",
            "CODIGO DE VERIFICACION: L1n81y6G"
    );

    private CertificateFixtures() {
    }

    public static DocumentTypeProfileRegistry profiles() {
        return DocumentTypeProfileRegistry.fromJson(
                CertificateFixtures.class.getResourceAsStream("/profiles/f30-profiles.json"));
    }

    /**
     * Settings with no retry backoff and no lower size bound, so small generated PDFs pass.
     */
    public static F30Properties properties(Path copyDirectory) {
        return new F30Properties(
                "classpath:profiles/f30-profiles.json",
                new F30Properties.Authenticity(0, 5120, List.of("iLovePDF", "Foxit", "Microsoft Word")),
                new F30Properties.Verification("http://localhost:8001", 3, Duration.ZERO, Duration.ofSeconds(5),
                        copyDirectory.toString()),
                new F30Properties.Callback(Duration.ofSeconds(1)),
                new F30Properties.Download(Duration.ofSeconds(1)),
                new F30Properties.Executor(1, 1, 10)
        );
    }

    public static byte[] createPdf(List<String> lines) {
        return createPdf(lines, info -> {
        });
    }

    /**
     * Creates an in-memory PDF with one text line per entry.
     *
     * @param lines       text lines to render
     * @param infoCustomizer hook to populate the info dictionary
     * @return PDF bytes
     */
    public static byte[] createPdf(List<String> lines, Consumer<PDDocumentInformation> infoCustomizer) {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {

            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);

            try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                contentStream.beginText();
                contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 11);
                contentStream.newLineAtOffset(72, 720);
                for (String line : lines) {
                    contentStream.showText(line);
                    contentStream.newLineAtOffset(0, -18);
                }
                contentStream.endText();
            }
            infoCustomizer.accept(document.getDocumentInformation());

            document.save(outputStream);
            return outputStream.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
