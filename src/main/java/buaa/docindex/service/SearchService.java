package buaa.docindex.service;

import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.exception.ClientException;
import buaa.docindex.common.convention.exception.ServiceException;
import buaa.docindex.config.IndexingConfiguration;
import buaa.docindex.dto.DocumentSearchResult;
import buaa.docindex.dto.RankedDocument;
import buaa.docindex.dto.RelevantSentences;
import buaa.docindex.model.IndexEntry;
import buaa.docindex.model.Page;
import buaa.docindex.service.extract.DocumentExtractors;
import buaa.docindex.service.highlight.DocumentHighlighter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 文档搜索服务
 * 词频检索出候选文档后，抽取相关句子并对PDF原文进行高亮
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private static final String PDF_EXTENSION = "pdf";

    private final LexicalRetrieverService retrieverService;
    private final SentenceExtractionService sentenceExtractionService;
    private final DocumentHighlighter documentHighlighter;
    private final DocumentIndexer documentIndexer;
    private final IndexingConfiguration indexingConfig;

    public SearchService(LexicalRetrieverService retrieverService,
                         SentenceExtractionService sentenceExtractionService,
                         DocumentHighlighter documentHighlighter,
                         DocumentIndexer documentIndexer,
                         IndexingConfiguration indexingConfig) {
        this.retrieverService = retrieverService;
        this.sentenceExtractionService = sentenceExtractionService;
        this.documentHighlighter = documentHighlighter;
        this.documentIndexer = documentIndexer;
        this.indexingConfig = indexingConfig;
    }

    /**
     * 检索并高亮
     * 单个文档抽取失败不影响其他文档，没有相关句子的文档不出现在结果中
     *
     * @param query 查询文本
     * @param topK 候选文档数
     */
    public List<DocumentSearchResult> search(String query, int topK) {
        List<RankedDocument> rankedDocuments = retrieverService.retrieve(query, topK);
        List<DocumentSearchResult> results = new ArrayList<>();

        for (RankedDocument document : rankedDocuments) {
            try {
                searchDocument(query, document).ifPresent(results::add);
            } catch (Exception e) {
                log.error("文档搜索处理失败: {}", document.getFilename(), e);
            }
        }

        log.info("搜索完成 - 查询: {}, 候选文档: {}, 有结果文档: {}", query, rankedDocuments.size(), results.size());
        return results;
    }

    /**
     * 对已索引的PDF文档按查询高亮相关句子
     *
     * @return 高亮后的PDF；没有可高亮的句子时为原文件
     * @throws ClientException 文档未索引或不是PDF
     */
    public byte[] highlightDocument(String filename, String query) {
        IndexEntry entry = documentIndexer.currentIndex().get(filename);
        if (entry == null) {
            throw new ClientException("文档不存在或尚未索引: " + filename, DocIndexErrorCode.DOCUMENT_NOT_FOUND);
        }
        if (!PDF_EXTENSION.equals(DocumentExtractors.extensionOf(filename))) {
            throw new ClientException("仅支持高亮PDF文档: " + filename, DocIndexErrorCode.FILE_TYPE_NOT_SUPPORTED);
        }

        int sentenceCount = indexingConfig.getSearch().getSentencesPerDocument();
        RelevantSentences sentences = sentenceExtractionService.extractFromDocument(query, filename, sentenceCount);
        return documentHighlighter.highlight(readDocument(entry.getFilePath()), sentences.getSentences());
    }

    private Optional<DocumentSearchResult> searchDocument(String query, RankedDocument document) {
        List<String> chunks = sentenceExtractionService.splitIntoChunks(document.getFullContent());
        int sentenceCount = indexingConfig.getSearch().getSentencesPerDocument();
        List<String> sentences = sentenceExtractionService.extract(query, chunks, sentenceCount).getSentences();
        if (sentences.isEmpty()) {
            return Optional.empty();
        }

        DocumentSearchResult result = DocumentSearchResult.builder()
            .filename(document.getFilename())
            .relevanceScore(document.getRelevanceScore())
            .relevantSentences(sentences)
            .pageSummaries(document.getPages() == null ? new ArrayList<>()
                : document.getPages().stream().map(Page::getSummary).collect(Collectors.toList()))
            .build();

        if (document.isPdf() && document.getFilePath() != null) {
            result.setHighlightedPdf(documentHighlighter.highlight(readDocument(document.getFilePath()), sentences));
        }
        return Optional.of(result);
    }

    private byte[] readDocument(String filePath) {
        try {
            return Files.readAllBytes(Path.of(filePath));
        } catch (IOException e) {
            throw new ServiceException("原始文档读取失败: " + filePath, e, DocIndexErrorCode.STORAGE_SERVICE_ERROR);
        }
    }
}
