package com.example.pdfoutline;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Small in-memory PDFs for collector tests: a 20pt bold heading over 11pt body text per page.
 */
public final class PdfFixtures {

    public static final String BODY_LINE = "Replication keeps a copy of every record on three nodes";

    private PdfFixtures() {
    }

    public static byte[] headingDocument(String metadataTitle, String... pageHeadings) throws IOException {
        try (PDDocument doc = new PDDocument()) {
            for (String heading : pageHeadings) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                doc.addPage(page);
                try (PDPageContentStream cs = new PDPageContentStream(doc, page)) {
                    showLine(cs, PDType1Font.HELVETICA_BOLD, 20, 700, heading);
                    float y = 670;
                    for (int i = 0; i < 4; i++) {
                        showLine(cs, PDType1Font.HELVETICA, 11, y, BODY_LINE);
                        y -= 14;
                    }
                }
            }
            if (metadataTitle != null) {
                doc.getDocumentInformation().setTitle(metadataTitle);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.save(out);
            return out.toByteArray();
        }
    }

    private static void showLine(PDPageContentStream cs, PDFont font, float size, float y, String text)
            throws IOException {
        cs.beginText();
        cs.setFont(font, size);
        cs.newLineAtOffset(72, y);
        cs.showText(text);
        cs.endText();
    }
}
