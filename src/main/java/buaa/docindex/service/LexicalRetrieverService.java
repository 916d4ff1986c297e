package buaa.docindex.service;

import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.exception.ClientException;
import buaa.docindex.config.IndexingConfiguration;
import buaa.docindex.dto.RankedDocument;
import buaa.docindex.dto.SummaryHit;
import buaa.docindex.model.Annotation;
import buaa.docindex.model.ContentCache;
import buaa.docindex.model.IndexEntry;
import buaa.docindex.model.PageAnnotation;
import buaa.docindex.repository.ContentStore;
import buaa.docindex.repository.IndexStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 词频检索服务
 *
 * <p>文档得分为各查询词在缓存全文中的出现次数，加上在文档摘要中出现次数的2倍。
 * 不做归一化和词干处理。</p>
 */
@Service
public class LexicalRetrieverService {

    private static final Logger log = LoggerFactory.getLogger(LexicalRetrieverService.class);

    private static final int SUMMARY_WEIGHT = 2;
    private static final int PAGE_SUMMARY_WEIGHT = 3;
    private final IndexStore indexStore;
    private final ContentStore contentStore;
    private final IndexingConfiguration indexingConfig;

    public LexicalRetrieverService(IndexStore indexStore,
                                   ContentStore contentStore,
                                   IndexingConfiguration indexingConfig) {
        this.indexStore = indexStore;
        this.contentStore = contentStore;
        this.indexingConfig = indexingConfig;
    }

    /**
     * 检索相关文档
     *
     * @param query 查询文本
     * @param topK 返回文档数
     * @return 按得分降序排列的文档，附带缓存的页面与全文
     */
    public List<RankedDocument> retrieve(String query, int topK) {
        List<String> queryWords = splitQuery(query);
        Map<String, IndexEntry> index = indexStore.load();
        if (index.isEmpty()) {
            log.warn("索引为空，无法检索");
            return new ArrayList<>();
        }

        List<RankedDocument> candidates = new ArrayList<>();
        for (IndexEntry entry : index.values()) {
            Optional<ContentCache> cache = contentStore.loadContent(entry.getFilename());
            if (cache.isEmpty()) {
                log.debug("内容缓存缺失，跳过: {}", entry.getFilename());
                continue;
            }

            String fullContent = nullToEmpty(cache.get().getFullContent());
            long score = score(queryWords, fullContent, entry.getDocumentSummary());
            if (score > 0) {
                candidates.add(RankedDocument.builder()
                    .filename(entry.getFilename())
                    .filePath(entry.getFilePath())
                    .relevanceScore(score)
                    .pages(cache.get().getPages())
                    .fullContent(fullContent)
                    .documentSummary(entry.getDocumentSummary())
                    .build());
            }
        }

        // 稳定排序，同分保持索引顺序
        candidates.sort(Comparator.comparingLong(RankedDocument::getRelevanceScore).reversed());
        List<RankedDocument> results = candidates.stream().limit(Math.max(topK, 0)).collect(Collectors.toList());
        log.info("检索完成 - 查询: {}, 命中文档: {}, 返回: {}", query, candidates.size(), results.size());
        return results;
    }

    /**
     * 在页面注释中检索相关页面摘要
     * 每个不同的查询词按其在页面摘要中的出现次数的3倍计分
     */
    public List<SummaryHit> searchPageSummaries(String query) {
        Set<String> queryWords = new LinkedHashSet<>(splitQuery(query));
        List<SummaryHit> hits = new ArrayList<>();

        for (Annotation annotation : contentStore.loadAllAnnotations()) {
            for (PageAnnotation page : annotation.getSummaries()) {
                String summary = nullToEmpty(page.getSummary()).toLowerCase(Locale.ROOT);
                long score = 0;
                for (String word : queryWords) {
                    score += countOccurrences(summary, word) * PAGE_SUMMARY_WEIGHT;
                }
                if (score > 0) {
                    hits.add(SummaryHit.builder()
                        .filename(annotation.getFilename())
                        .pageNumber(page.getPageNumber())
                        .summary(page.getSummary())
                        .keywords(page.getKeywords())
                        .relations(page.getRelations())
                        .relevanceScore(score)
                        .build());
                }
            }
        }

        hits.sort(Comparator.comparingLong(SummaryHit::getRelevanceScore).reversed());
        return hits.stream().limit(indexingConfig.getSearch().getSummaryTopK()).collect(Collectors.toList());
    }

    /**
     * 计算文档得分
     */
    static long score(List<String> queryWords, String fullContent, String documentSummary) {
        String content = nullToEmpty(fullContent).toLowerCase(Locale.ROOT);
        String summary = nullToEmpty(documentSummary).toLowerCase(Locale.ROOT);
        long score = 0;
        for (String word : queryWords) {
            score += countOccurrences(content, word);
            score += countOccurrences(summary, word) * SUMMARY_WEIGHT;
        }
        return score;
    }

    /**
     * 统计不重叠的子串出现次数
     */
    static int countOccurrences(String text, String word) {
        if (word.isEmpty()) {
            return 0;
        }
        int count = 0;
        int index = text.indexOf(word);
        while (index >= 0) {
            count++;
            index = text.indexOf(word, index + word.length());
        }
        return count;
    }

    /**
     * 查询转小写并按空白切分
     *
     * @throws ClientException 查询为空
     */
    static List<String> splitQuery(String query) {
        if (query == null || query.isBlank()) {
            throw new ClientException(DocIndexErrorCode.QUERY_EMPTY);
        }
        return Arrays.asList(query.toLowerCase(Locale.ROOT).strip().split("\\s+"));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
