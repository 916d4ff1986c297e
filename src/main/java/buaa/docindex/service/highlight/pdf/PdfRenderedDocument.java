package buaa.docindex.service.highlight.pdf;

import buaa.docindex.service.highlight.PageTextLayer;
import buaa.docindex.service.highlight.RenderedDocument;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * 基于PDFBox的渲染文档
 */
public class PdfRenderedDocument implements RenderedDocument {

    private final PDDocument document;

    PdfRenderedDocument(PDDocument document) {
        this.document = document;
    }

    public static PdfRenderedDocument load(byte[] pdfBytes) throws IOException {
        return new PdfRenderedDocument(Loader.loadPDF(pdfBytes));
    }

    @Override
    public int getPageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public PageTextLayer getPage(int pageIndex) {
        return new PdfPageTextLayer(document, document.getPage(pageIndex), pageIndex + 1);
    }

    @Override
    public byte[] toBytes() throws IOException {
        ByteArrayOutputStream output = new ByteArrayOutputStream();
        document.save(output);
        return output.toByteArray();
    }

    @Override
    public void close() throws IOException {
        document.close();
    }
}
