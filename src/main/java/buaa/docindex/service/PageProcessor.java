package buaa.docindex.service;

import buaa.docindex.config.IndexingConfiguration;
import buaa.docindex.dto.PageText;
import buaa.docindex.dto.ProcessedPage;
import buaa.docindex.model.Page;
import buaa.docindex.service.annotation.PageAnnotator;
import buaa.docindex.service.summary.Summarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 单页处理：摘要与注释
 * 在页面线程池中执行，不持有可变状态
 */
@Component
public class PageProcessor {

    private static final Logger log = LoggerFactory.getLogger(PageProcessor.class);

    private final Summarizer summarizer;
    private final PageAnnotator pageAnnotator;
    private final int summaryLength;

    public PageProcessor(Summarizer summarizer,
                         PageAnnotator pageAnnotator,
                         IndexingConfiguration indexingConfiguration) {
        this.summarizer = summarizer;
        this.pageAnnotator = pageAnnotator;
        this.summaryLength = indexingConfiguration.getPageSummaryLength();
    }

    /**
     * 处理单页
     *
     * @param filename 所属文件名，仅用于日志
     * @param pageText 页面原始文本
     * @return 处理结果；空白页或处理失败时为空
     */
    public Optional<ProcessedPage> process(String filename, PageText pageText) {
        if (!pageText.hasContent()) {
            return Optional.empty();
        }
        try {
            String content = pageText.getText().strip();
            Page page = Page.builder()
                .pageNumber(pageText.getPageNumber())
                .content(content)
                .summary(summarizer.summarize(content, summaryLength))
                .wordCount(countWords(content))
                .build();
            log.debug("页面处理完成: {} 第{}页", filename, page.getPageNumber());
            return Optional.of(new ProcessedPage(page, pageAnnotator.annotate(page)));
        } catch (RuntimeException e) {
            log.error("页面处理失败，跳过该页: {} 第{}页", filename, pageText.getPageNumber(), e);
            return Optional.empty();
        }
    }

    static int countWords(String content) {
        String stripped = content.strip();
        return stripped.isEmpty() ? 0 : stripped.split("\\s+").length;
    }
}
