package buaa.docindex.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 文档索引配置
 * 统一管理文档目录、缓存目录、并发度与摘要长度
 */
@Component
@ConfigurationProperties(prefix = "indexing")
@Data
public class IndexingConfiguration {

    /** 待索引文档目录 */
    private String documentsDir = "documents";

    /** 内容缓存与注释文件目录 */
    private String contentCacheDir = "content_cache";

    /** 紧凑索引文件路径 */
    private String indexFile = "document_index.json";

    /** 允许索引的扩展名 */
    private List<String> allowedExtensions = new ArrayList<>(List.of("pdf", "txt", "docx"));

    /** 单文档内页面处理的并发线程数 */
    private int maxWorkers = 4;

    /** 页面摘要长度上限 */
    private int pageSummaryLength = 400;

    /** 文档摘要长度上限 */
    private int documentSummaryLength = 1000;

    /** 摘要实现：rule-based 或 llm */
    private SummarizerMode summarizer = SummarizerMode.RULE_BASED;

    private Search search = new Search();

    public enum SummarizerMode {
        RULE_BASED,
        LLM
    }

    /**
     * 检索参数
     */
    @Data
    public static class Search {
        /** 默认返回文档数 */
        private int defaultTopK = 3;
        /** 页面摘要检索返回数 */
        private int summaryTopK = 5;
        /** 每篇文档抽取的相关句子数 */
        private int sentencesPerDocument = 5;
        /** 句子抽取时的分块词数 */
        private int chunkWords = 2000;
    }
}
