package buaa.docindex.service.extract;

import buaa.docindex.dto.PageText;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 按扩展名选择抽取器
 */
@Component
public class DocumentExtractors {

    private final Map<String, DocumentExtractor> extractorsByExtension = new HashMap<>();

    public DocumentExtractors(List<DocumentExtractor> extractors) {
        for (DocumentExtractor extractor : extractors) {
            for (String extension : extractor.supportedExtensions()) {
                extractorsByExtension.put(extension.toLowerCase(Locale.ROOT), extractor);
            }
        }
    }

    /**
     * 查找文件对应的抽取器
     */
    public Optional<DocumentExtractor> forFilename(String filename) {
        return Optional.ofNullable(extractorsByExtension.get(extensionOf(filename)));
    }

    /**
     * 抽取文件页面文本
     *
     * @throws DocumentExtractionException 无对应抽取器或解析失败
     */
    public List<PageText> extract(String filename, byte[] content) throws DocumentExtractionException {
        DocumentExtractor extractor = forFilename(filename)
            .orElseThrow(() -> new DocumentExtractionException("不支持的文件格式: " + filename));
        return extractor.extract(content);
    }

    /**
     * 取小写扩展名，不含点号
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dotIndex = filename.lastIndexOf('.');
        if (dotIndex == -1) {
            return "";
        }
        return filename.substring(dotIndex + 1).toLowerCase(Locale.ROOT);
    }
}
