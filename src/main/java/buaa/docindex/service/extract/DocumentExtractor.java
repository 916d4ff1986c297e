package buaa.docindex.service.extract;

import buaa.docindex.dto.PageText;

import java.util.List;
import java.util.Set;

/**
 * 文档文本抽取器
 * 将原始字节转换为按页码排序的页面文本
 */
public interface DocumentExtractor {

    /**
     * 支持的扩展名（小写，不含点号）
     */
    Set<String> supportedExtensions();

    /**
     * 抽取页面文本
     *
     * @param content 文档原始字节
     * @return 按页码升序排列的页面文本，页码从1开始
     * @throws DocumentExtractionException 文档损坏或无法解析
     */
    List<PageText> extract(byte[] content) throws DocumentExtractionException;
}
