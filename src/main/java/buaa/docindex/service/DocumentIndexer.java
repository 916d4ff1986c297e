package buaa.docindex.service;

import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.exception.ServiceException;
import buaa.docindex.common.toolkit.TextTruncator;
import buaa.docindex.config.IndexingConfiguration;
import buaa.docindex.dto.IndexingReport;
import buaa.docindex.dto.PageText;
import buaa.docindex.dto.ProcessedPage;
import buaa.docindex.model.Annotation;
import buaa.docindex.model.ContentCache;
import buaa.docindex.model.IndexEntry;
import buaa.docindex.model.Page;
import buaa.docindex.repository.ContentStore;
import buaa.docindex.repository.IndexStore;
import buaa.docindex.service.annotation.PageAnnotator;
import buaa.docindex.service.extract.DocumentExtractionException;
import buaa.docindex.service.extract.DocumentExtractors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 文档增量索引服务
 *
 * <p>逐个处理文档目录中的文件：内容哈希未变化的沿用已有索引条目，
 * 其余文件抽取页面后在页面线程池中并行生成摘要与注释，按页码排序后写入内容缓存。
 * 全部文档处理完毕后整体替换索引表。</p>
 *
 * <p>同一索引存储同一时刻只允许一个构建任务。</p>
 */
@Service
public class DocumentIndexer {

    private static final Logger log = LoggerFactory.getLogger(DocumentIndexer.class);

    private final IndexingConfiguration indexingConfig;
    private final IndexStore indexStore;
    private final ContentStore contentStore;
    private final ContentHasher contentHasher;
    private final DocumentExtractors documentExtractors;
    private final PageProcessor pageProcessor;
    private final PageAnnotator pageAnnotator;
    private final Executor pageExecutor;
    private final Clock clock;

    public DocumentIndexer(IndexingConfiguration indexingConfig,
                           IndexStore indexStore,
                           ContentStore contentStore,
                           ContentHasher contentHasher,
                           DocumentExtractors documentExtractors,
                           PageProcessor pageProcessor,
                           PageAnnotator pageAnnotator,
                           @Qualifier("pageProcessingExecutor") Executor pageExecutor,
                           Clock clock) {
        this.indexingConfig = indexingConfig;
        this.indexStore = indexStore;
        this.contentStore = contentStore;
        this.contentHasher = contentHasher;
        this.documentExtractors = documentExtractors;
        this.pageProcessor = pageProcessor;
        this.pageAnnotator = pageAnnotator;
        this.pageExecutor = pageExecutor;
        this.clock = clock;
    }

    /**
     * 构建或增量更新文档索引
     *
     * @return 本次构建统计与最终索引表
     * @throws ServiceException 文档目录无法读取或索引、缓存写入失败
     */
    public IndexingReport rebuildIndex() {
        long startTime = System.currentTimeMillis();
        Map<String, IndexEntry> existingIndex = indexStore.load();
        Map<String, IndexEntry> updatedIndex = new LinkedHashMap<>();

        List<Path> candidates = listCandidates();
        log.info("开始构建索引，共 {} 个候选文档，已有索引 {} 条", candidates.size(), existingIndex.size());

        int indexed = 0;
        int skipped = 0;
        int failed = 0;
        for (Path file : candidates) {
            String filename = file.getFileName().toString();
            String fileHash = contentHasher.hash(file);

            IndexEntry existing = existingIndex.get(filename);
            if (existing != null && contentHasher.isKnown(fileHash) && existing.matchesHash(fileHash)) {
                log.info("文档未变化，沿用缓存: {}", filename);
                updatedIndex.put(filename, existing);
                skipped++;
                continue;
            }

            log.info("处理文档: {}", filename);
            Optional<IndexEntry> entry = indexDocument(file, filename, fileHash);
            if (entry.isPresent()) {
                updatedIndex.put(filename, entry.get());
                indexed++;
            } else {
                failed++;
            }
        }

        backfillAnnotations(updatedIndex);
        indexStore.replaceAll(updatedIndex);

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("索引构建完成: 新处理 {}，沿用 {}，失败 {}，共 {} 个文档，耗时 {}ms",
            indexed, skipped, failed, updatedIndex.size(), elapsed);

        return IndexingReport.builder()
            .indexed(indexed)
            .skipped(skipped)
            .failed(failed)
            .elapsedMillis(elapsed)
            .index(updatedIndex)
            .build();
    }

    /**
     * 读取当前索引表
     */
    public Map<String, IndexEntry> currentIndex() {
        return indexStore.load();
    }

    /**
     * 处理单个变更文档
     *
     * @return 新的索引条目；读取、抽取失败或没有任何有效页面时为空
     */
    private Optional<IndexEntry> indexDocument(Path file, String filename, String fileHash) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            log.error("文档读取失败，跳过: {}", filename, e);
            return Optional.empty();
        }

        List<PageText> pageTexts;
        try {
            pageTexts = documentExtractors.extract(filename, content);
        } catch (DocumentExtractionException e) {
            log.error("文档抽取失败，跳过: {}", filename, e);
            return Optional.empty();
        }

        List<ProcessedPage> processedPages = processPages(filename, pageTexts);
        if (processedPages.isEmpty()) {
            log.warn("文档没有可用内容，跳过: {}", filename);
            return Optional.empty();
        }

        List<Page> pages = processedPages.stream()
            .map(ProcessedPage::getPage)
            .collect(Collectors.toList());
        String documentSummary = buildDocumentSummary(pages);
        String fullContent = pages.stream()
            .map(Page::getContent)
            .collect(Collectors.joining(" "));

        LocalDateTime now = LocalDateTime.now(clock);
        Path cachePath = contentStore.saveContent(ContentCache.builder()
            .filename(filename)
            .pages(pages)
            .fullContent(fullContent)
            .cachedAt(now)
            .build());
        contentStore.saveAnnotation(Annotation.builder()
            .filename(filename)
            .summaries(processedPages.stream()
                .map(ProcessedPage::getAnnotation)
                .collect(Collectors.toList()))
            .build());

        log.info("文档处理完成: {}，共 {} 页", filename, pages.size());
        return Optional.of(IndexEntry.builder()
            .filename(filename)
            .filePath(file.toString())
            .fileHash(fileHash)
            .totalPages(pages.size())
            .totalWords(pages.stream().mapToInt(Page::getWordCount).sum())
            .documentSummary(documentSummary)
            .lastUpdated(now)
            .contentCachePath(cachePath.toString())
            .build());
    }

    /**
     * 页面并行处理，结果按页码升序返回
     */
    List<ProcessedPage> processPages(String filename, List<PageText> pageTexts) {
        List<CompletableFuture<Optional<ProcessedPage>>> futures = new ArrayList<>(pageTexts.size());
        for (PageText pageText : pageTexts) {
            futures.add(CompletableFuture.supplyAsync(
                () -> pageProcessor.process(filename, pageText), pageExecutor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        // 完成顺序不确定，持久化前按页码重排
        return futures.stream()
            .map(CompletableFuture::join)
            .flatMap(Optional::stream)
            .sorted(Comparator.comparingInt(ProcessedPage::getPageNumber))
            .collect(Collectors.toList());
    }

    private String buildDocumentSummary(List<Page> pages) {
        String joined = pages.stream()
            .map(Page::getSummary)
            .collect(Collectors.joining(" "));
        int limit = indexingConfig.getDocumentSummaryLength();
        return joined.length() > limit
            ? TextTruncator.abbreviate(joined, limit)
            : joined;
    }

    /**
     * 为沿用的索引条目补齐缺失的注释文件
     */
    private void backfillAnnotations(Map<String, IndexEntry> index) {
        for (String filename : index.keySet()) {
            if (contentStore.loadAnnotation(filename).isPresent()) {
                continue;
            }
            contentStore.loadContent(filename).ifPresent(cache -> {
                contentStore.saveAnnotation(pageAnnotator.annotate(filename, cache.getPages()));
                log.info("已补齐注释文件: {}", filename);
            });
        }
    }

    /**
     * 列出文档目录下允许索引的文件，按文件名排序
     */
    private List<Path> listCandidates() {
        Path documentsDir = Path.of(indexingConfig.getDocumentsDir());
        if (!Files.isDirectory(documentsDir)) {
            log.warn("文档目录不存在: {}", documentsDir.toAbsolutePath());
            return new ArrayList<>();
        }
        Set<String> allowed = indexingConfig.getAllowedExtensions().stream()
            .map(extension -> extension.toLowerCase(Locale.ROOT))
            .collect(Collectors.toSet());
        try (Stream<Path> files = Files.list(documentsDir)) {
            return files.filter(Files::isRegularFile)
                .filter(file -> allowed.contains(DocumentExtractors.extensionOf(file.getFileName().toString())))
                .sorted(Comparator.comparing(file -> file.getFileName().toString()))
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ServiceException("文档目录读取失败: " + documentsDir, e, DocIndexErrorCode.INDEXING_ERROR);
        }
    }
}
