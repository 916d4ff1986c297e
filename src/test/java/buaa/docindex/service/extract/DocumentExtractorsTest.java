package buaa.docindex.service.extract;

import buaa.docindex.dto.PageText;
import buaa.docindex.support.TestPdfs;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocumentExtractorsTest {

    private final DocumentExtractors extractors =
        new DocumentExtractors(List.of(new PdfDocumentExtractor(), new TikaDocumentExtractor()));

    @Test
    void pdfPagesAreNumberedFromOne() throws Exception {
        byte[] pdf = TestPdfs.pdfWithPages(
            new String[]{"Revenue grew 12% in 2023."},
            new String[]{"Costs fell."});

        List<PageText> pages = extractors.extract("report.PDF", pdf);

        assertEquals(2, pages.size());
        assertEquals(1, pages.get(0).getPageNumber());
        assertTrue(pages.get(0).getText().contains("Revenue grew 12% in 2023."));
        assertEquals(2, pages.get(1).getPageNumber());
        assertTrue(pages.get(1).getText().contains("Costs fell."));
    }

    @Test
    void plainTextIsSinglePage() throws Exception {
        List<PageText> pages = extractors.extract("notes.txt",
            "alpha beta gamma\nsecond line of notes".getBytes(StandardCharsets.UTF_8));

        assertEquals(1, pages.size());
        assertEquals(1, pages.get(0).getPageNumber());
        assertTrue(pages.get(0).getText().contains("alpha beta gamma"));
    }

    @Test
    void corruptPdfFailsWithExtractionException() {
        assertThrows(DocumentExtractionException.class,
            () -> extractors.extract("broken.pdf", "not a pdf".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void unsupportedExtensionFails() {
        assertThrows(DocumentExtractionException.class,
            () -> extractors.extract("image.png", new byte[]{1, 2, 3}));
    }

    @Test
    void extensionIsLowercasedWithoutDot() {
        assertEquals("pdf", DocumentExtractors.extensionOf("A.Report.PDF"));
        assertEquals("", DocumentExtractors.extensionOf("README"));
        assertEquals("", DocumentExtractors.extensionOf(null));
    }
}
