package buaa.docindex.service.annotation;

import buaa.docindex.model.Annotation;
import buaa.docindex.model.Page;
import buaa.docindex.model.PageAnnotation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 为文档各页生成关键词与关系注释
 */
@Component
public class PageAnnotator {

    private final KeywordExtractor keywordExtractor;
    private final RelationExtractor relationExtractor;

    public PageAnnotator(KeywordExtractor keywordExtractor, RelationExtractor relationExtractor) {
        this.keywordExtractor = keywordExtractor;
        this.relationExtractor = relationExtractor;
    }

    public PageAnnotation annotate(Page page) {
        return PageAnnotation.builder()
            .pageNumber(page.getPageNumber())
            .summary(page.getSummary())
            .keywords(keywordExtractor.extract(page.getContent()))
            .relations(relationExtractor.extract(page.getContent()))
            .build();
    }

    /**
     * 按页序生成整篇文档的注释
     */
    public Annotation annotate(String filename, List<Page> pages) {
        List<PageAnnotation> summaries = new ArrayList<>(pages.size());
        for (Page page : pages) {
            summaries.add(annotate(page));
        }
        return Annotation.builder()
            .filename(filename)
            .summaries(summaries)
            .build();
    }
}
