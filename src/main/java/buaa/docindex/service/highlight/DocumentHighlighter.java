package buaa.docindex.service.highlight;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 文档高亮服务
 *
 * <p>目标文本按长度从长到短处理，避免短句先命中长句的一部分。
 * 对每一页、每个目标文本依次尝试匹配策略，采用第一个找到区域的策略结果。</p>
 *
 * <p>高亮失败不向外抛出：一个区域都没有找到或处理出错时原样返回输入字节。
 * 对已高亮的文档再次调用会叠加新的标注。</p>
 */
@Service
public class DocumentHighlighter {

    private static final Logger log = LoggerFactory.getLogger(DocumentHighlighter.class);

    private final RenderedDocumentLoader documentLoader;
    private final List<RegionMatchStrategy> strategies;

    public DocumentHighlighter(RenderedDocumentLoader documentLoader, List<RegionMatchStrategy> strategies) {
        this.documentLoader = documentLoader;
        this.strategies = List.copyOf(strategies);
    }

    /**
     * 高亮文档中的目标文本
     *
     * @param documentBytes 原始文档
     * @param spans 目标文本
     * @return 添加标注后的文档；未命中任何区域时为原始字节
     */
    public byte[] highlight(byte[] documentBytes, List<String> spans) {
        if (spans == null || spans.isEmpty()) {
            return documentBytes;
        }
        List<String> targets = normalizeSpans(spans);
        if (targets.isEmpty()) {
            return documentBytes;
        }

        try (RenderedDocument document = documentLoader.load(documentBytes)) {
            int highlightsAdded = 0;
            for (int pageIndex = 0; pageIndex < document.getPageCount(); pageIndex++) {
                PageTextLayer page = document.getPage(pageIndex);
                for (String span : targets) {
                    MatchResult result = locate(page, span);
                    for (TextRegion region : result.getRegions()) {
                        page.mark(region);
                        highlightsAdded++;
                    }
                }
            }

            log.info("高亮完成，共添加 {} 处标注，页数: {}", highlightsAdded, document.getPageCount());
            if (highlightsAdded == 0) {
                return documentBytes;
            }
            return document.toBytes();
        } catch (Exception e) {
            log.error("文档高亮失败，返回原始文档", e);
            return documentBytes;
        }
    }

    /**
     * 依次尝试匹配策略，返回第一个命中的结果
     */
    MatchResult locate(PageTextLayer page, String span) {
        for (RegionMatchStrategy strategy : strategies) {
            MatchResult result;
            try {
                result = strategy.match(page, span);
            } catch (RuntimeException e) {
                log.warn("匹配策略 {} 在第{}页执行失败: {}", strategy.name(), page.getPageNumber(), e.getMessage());
                continue;
            }
            if (result.isFound()) {
                log.debug("第{}页由策略 {} 命中 {} 处", page.getPageNumber(), strategy.name(), result.getRegions().size());
                return result;
            }
        }
        return MatchResult.none();
    }

    /**
     * 合并连续空白、去掉空串与重复项，并按长度降序排列
     */
    static List<String> normalizeSpans(List<String> spans) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String span : spans) {
            if (span == null) {
                continue;
            }
            String cleaned = span.replaceAll("\\s+", " ").strip();
            if (!cleaned.isEmpty()) {
                normalized.add(cleaned);
            }
        }
        return normalized.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .collect(Collectors.toList());
    }
}
