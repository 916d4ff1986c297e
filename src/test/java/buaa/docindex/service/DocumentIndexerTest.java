package buaa.docindex.service;

import buaa.docindex.config.AsyncConfig;
import buaa.docindex.config.IndexingConfiguration;
import buaa.docindex.dto.IndexingReport;
import buaa.docindex.model.Annotation;
import buaa.docindex.model.ContentCache;
import buaa.docindex.model.IndexEntry;
import buaa.docindex.model.Page;
import buaa.docindex.repository.FileContentStore;
import buaa.docindex.repository.FileIndexStore;
import buaa.docindex.service.annotation.KeywordExtractor;
import buaa.docindex.service.annotation.PageAnnotator;
import buaa.docindex.service.annotation.RelationExtractor;
import buaa.docindex.service.extract.DocumentExtractors;
import buaa.docindex.service.extract.PdfDocumentExtractor;
import buaa.docindex.service.extract.TikaDocumentExtractor;
import buaa.docindex.service.summary.RuleBasedSummarizer;
import buaa.docindex.support.TestPdfs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DocumentIndexerTest {

    private static final Clock FIRST_RUN = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
    private static final Clock SECOND_RUN = Clock.fixed(Instant.parse("2024-02-01T00:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tmp;

    private Path documentsDir;
    private IndexingConfiguration config;
    private ThreadPoolTaskExecutor executor;
    private FileIndexStore indexStore;
    private FileContentStore contentStore;

    @BeforeEach
    void setUp() throws Exception {
        documentsDir = Files.createDirectories(tmp.resolve("documents"));
        config = new IndexingConfiguration();
        config.setDocumentsDir(documentsDir.toString());
        config.setContentCacheDir(tmp.resolve("content_cache").toString());
        config.setIndexFile(tmp.resolve("document_index.json").toString());
        executor = new AsyncConfig().pageProcessingExecutor(config);
        indexStore = new FileIndexStore(Path.of(config.getIndexFile()));
        contentStore = new FileContentStore(Path.of(config.getContentCacheDir()));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void indexesSingleTextFileEndToEnd() throws Exception {
        Files.writeString(documentsDir.resolve("notes.txt"), words(500));

        IndexingReport report = indexer(FIRST_RUN).rebuildIndex();

        assertEquals(1, report.getIndexed());
        assertEquals(0, report.getSkipped());
        assertEquals(1, report.getTotalDocuments());

        IndexEntry entry = indexStore.load().get("notes.txt");
        assertEquals(1, entry.getTotalPages());
        assertEquals(500, entry.getTotalWords());
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), entry.getLastUpdated());
        assertEquals(new ContentHasher().hash(documentsDir.resolve("notes.txt")), entry.getFileHash());

        ContentCache cache = contentStore.loadContent("notes.txt").orElseThrow();
        assertEquals(1, cache.getPages().size());
        assertEquals(1, cache.getPages().get(0).getPageNumber());
        assertTrue(cache.getPages().get(0).getSummary().length() <= 403);

        Annotation annotation = contentStore.loadAnnotation("notes.txt").orElseThrow();
        assertEquals(1, annotation.getSummaries().size());
        assertFalse(annotation.getSummaries().get(0).getKeywords().isEmpty());
        assertTrue(annotation.getSummaries().get(0).getKeywords().size() <= 20);
    }

    @Test
    void supplementaryCharacterAtSummaryCutDoesNotAbortRebuild() throws Exception {
        Files.writeString(documentsDir.resolve("math.txt"),
            "a".repeat(399) + "\uD835\uDC65" + " tail words without any sentence break");
        Files.writeString(documentsDir.resolve("plain.txt"), words(30));

        IndexingReport report = indexer(FIRST_RUN).rebuildIndex();

        assertEquals(2, report.getIndexed());
        assertEquals(0, report.getFailed());
        assertTrue(indexStore.load().containsKey("plain.txt"));

        String summary = contentStore.loadContent("math.txt").orElseThrow().getPages().get(0).getSummary();
        assertTrue(summary.endsWith("..."));
        assertFalse(hasUnpairedSurrogate(summary));
        assertFalse(hasUnpairedSurrogate(indexStore.load().get("math.txt").getDocumentSummary()));
    }

    @Test
    void unchangedFileIsCarriedForwardUntouched() throws Exception {
        Files.writeString(documentsDir.resolve("notes.txt"), words(50));
        indexer(FIRST_RUN).rebuildIndex();
        IndexEntry first = indexStore.load().get("notes.txt");

        IndexingReport report = indexer(SECOND_RUN).rebuildIndex();

        assertEquals(0, report.getIndexed());
        assertEquals(1, report.getSkipped());
        assertEquals(first, indexStore.load().get("notes.txt"));
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), indexStore.load().get("notes.txt").getLastUpdated());
    }

    @Test
    void singleByteChangeTriggersReprocessing() throws Exception {
        Path file = documentsDir.resolve("notes.txt");
        Files.writeString(file, words(50));
        indexer(FIRST_RUN).rebuildIndex();
        IndexEntry first = indexStore.load().get("notes.txt");

        byte[] content = Files.readAllBytes(file);
        content[0] = (byte) 'X';
        Files.write(file, content);
        IndexingReport report = indexer(SECOND_RUN).rebuildIndex();

        IndexEntry second = indexStore.load().get("notes.txt");
        assertEquals(1, report.getIndexed());
        assertNotEquals(first.getFileHash(), second.getFileHash());
        assertEquals(LocalDateTime.of(2024, 2, 1, 0, 0), second.getLastUpdated());
        assertTrue(contentStore.loadContent("notes.txt").orElseThrow().getFullContent().startsWith("X"));
    }

    @Test
    void pagesAreOrderedAndBlankPagesDropped() throws Exception {
        String[][] pages = new String[12][];
        for (int i = 0; i < pages.length; i++) {
            pages[i] = i == 4 ? new String[0] : new String[]{"Content of page " + (i + 1) + "."};
        }
        Files.write(documentsDir.resolve("report.pdf"), TestPdfs.pdfWithPages(pages));

        indexer(FIRST_RUN).rebuildIndex();

        ContentCache cache = contentStore.loadContent("report.pdf").orElseThrow();
        List<Integer> pageNumbers = cache.getPages().stream().map(Page::getPageNumber).collect(Collectors.toList());
        assertEquals(List.of(1, 2, 3, 4, 6, 7, 8, 9, 10, 11, 12), pageNumbers);
        assertEquals(11, indexStore.load().get("report.pdf").getTotalPages());
        assertTrue(cache.getFullContent().startsWith("Content of page 1. Content of page 2."));

        List<Integer> annotated = contentStore.loadAnnotation("report.pdf").orElseThrow().getSummaries().stream()
            .map(summary -> summary.getPageNumber())
            .collect(Collectors.toList());
        assertEquals(pageNumbers, annotated);
    }

    @Test
    void documentSummaryIsBounded() throws Exception {
        String[][] pages = new String[4][];
        for (int p = 0; p < pages.length; p++) {
            final int pageNumber = p + 1;
            pages[p] = IntStream.rangeClosed(1, 10)
                .mapToObj(line -> "Line " + line + " of page " + pageNumber + " describes the quarterly figures.")
                .toArray(String[]::new);
        }
        Files.write(documentsDir.resolve("long.pdf"), TestPdfs.pdfWithPages(pages));

        indexer(FIRST_RUN).rebuildIndex();

        String summary = indexStore.load().get("long.pdf").getDocumentSummary();
        assertEquals(1003, summary.length());
        assertTrue(summary.endsWith("..."));
    }

    @Test
    void corruptDocumentIsSkippedWithoutRecord() throws Exception {
        Files.writeString(documentsDir.resolve("broken.pdf"), "this is not a pdf");
        Files.writeString(documentsDir.resolve("notes.txt"), words(20));
        Files.writeString(documentsDir.resolve("ignored.md"), words(20));

        IndexingReport report = indexer(FIRST_RUN).rebuildIndex();

        assertEquals(1, report.getIndexed());
        assertEquals(1, report.getFailed());
        Map<String, IndexEntry> index = indexStore.load();
        assertEquals(List.of("notes.txt"), List.copyOf(index.keySet()));
        assertTrue(contentStore.loadContent("broken.pdf").isEmpty());
        assertTrue(contentStore.loadAnnotation("broken.pdf").isEmpty());
    }

    @Test
    void removedDocumentDropsOutOfIndex() throws Exception {
        Files.writeString(documentsDir.resolve("a.txt"), words(20));
        Files.writeString(documentsDir.resolve("b.txt"), words(30));
        indexer(FIRST_RUN).rebuildIndex();

        Files.delete(documentsDir.resolve("a.txt"));
        IndexingReport report = indexer(SECOND_RUN).rebuildIndex();

        assertEquals(List.of("b.txt"), List.copyOf(report.getIndex().keySet()));
        assertEquals(List.of("b.txt"), List.copyOf(indexStore.load().keySet()));
    }

    @Test
    void missingAnnotationIsBackfilledForUnchangedDocument() throws Exception {
        Files.writeString(documentsDir.resolve("notes.txt"), words(40));
        indexer(FIRST_RUN).rebuildIndex();
        Files.delete(contentStore.annotationPath("notes.txt"));

        indexer(SECOND_RUN).rebuildIndex();

        assertTrue(contentStore.loadAnnotation("notes.txt").isPresent());
        assertEquals(LocalDateTime.of(2024, 1, 1, 0, 0), indexStore.load().get("notes.txt").getLastUpdated());
    }

    private DocumentIndexer indexer(Clock clock) {
        PageAnnotator annotator = new PageAnnotator(new KeywordExtractor(), new RelationExtractor());
        PageProcessor pageProcessor = new PageProcessor(new RuleBasedSummarizer(), annotator, config);
        DocumentExtractors extractors = new DocumentExtractors(
            List.of(new PdfDocumentExtractor(), new TikaDocumentExtractor()));
        return new DocumentIndexer(config, indexStore, contentStore, new ContentHasher(),
            extractors, pageProcessor, annotator, executor, clock);
    }

    private static String words(int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> "term" + (i % 37) + "x" + i)
            .collect(Collectors.joining(" "));
    }

    private static boolean hasUnpairedSurrogate(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    return true;
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return true;
            }
        }
        return false;
    }
}
