package buaa.docindex.service.highlight.pdf;

import buaa.docindex.service.highlight.RenderedDocument;
import buaa.docindex.service.highlight.RenderedDocumentLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class PdfDocumentLoader implements RenderedDocumentLoader {

    @Override
    public RenderedDocument load(byte[] documentBytes) throws IOException {
        return PdfRenderedDocument.load(documentBytes);
    }
}
