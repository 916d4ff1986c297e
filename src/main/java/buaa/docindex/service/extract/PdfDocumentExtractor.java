package buaa.docindex.service.extract;

import buaa.docindex.dto.PageText;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 使用PDFBox逐页抽取PDF文本
 */
@Component
public class PdfDocumentExtractor implements DocumentExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfDocumentExtractor.class);

    @Override
    public Set<String> supportedExtensions() {
        return Set.of("pdf");
    }

    @Override
    public List<PageText> extract(byte[] content) throws DocumentExtractionException {
        try (PDDocument pdf = Loader.loadPDF(content)) {
            int pageCount = pdf.getNumberOfPages();
            PDFTextStripper stripper = new PDFTextStripper();
            List<PageText> pages = new ArrayList<>(pageCount);

            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(new PageText(page, stripper.getText(pdf)));
            }

            log.debug("PDF文本抽取完成，页数: {}", pageCount);
            return pages;
        } catch (IOException e) {
            throw new DocumentExtractionException("PDF解析失败", e);
        }
    }
}
