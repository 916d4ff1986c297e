package buaa.docindex.service.extract;

import buaa.docindex.dto.PageText;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Set;

/**
 * 使用Apache Tika抽取纯文本与Word文档
 * 这类文档没有物理分页，整篇作为第1页
 */
@Component
public class TikaDocumentExtractor implements DocumentExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentExtractor.class);

    @Override
    public Set<String> supportedExtensions() {
        return Set.of("txt", "docx");
    }

    @Override
    public List<PageText> extract(byte[] content) throws DocumentExtractionException {
        try (InputStream stream = new ByteArrayInputStream(content)) {
            String extractedText = performTextExtraction(stream);
            log.debug("文本提取成功，字符数: {}", extractedText.length());
            return List.of(new PageText(1, extractedText));
        } catch (IOException | TikaException | SAXException e) {
            throw new DocumentExtractionException("文档解析错误", e);
        }
    }

    /**
     * 使用Apache Tika提取文本
     */
    private String performTextExtraction(InputStream stream)
            throws IOException, TikaException, SAXException {
        BodyContentHandler contentHandler = new BodyContentHandler(-1);
        Metadata documentMetadata = new Metadata();
        ParseContext parseContext = new ParseContext();
        AutoDetectParser documentParser = new AutoDetectParser();

        documentParser.parse(stream, contentHandler, documentMetadata, parseContext);
        return contentHandler.toString();
    }
}
