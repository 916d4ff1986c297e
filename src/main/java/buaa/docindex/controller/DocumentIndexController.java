package buaa.docindex.controller;

import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.exception.ClientException;
import buaa.docindex.common.convention.exception.ServiceException;
import buaa.docindex.common.convention.result.Result;
import buaa.docindex.common.convention.result.Results;
import buaa.docindex.config.IndexingConfiguration;
import buaa.docindex.dto.ChatAnswer;
import buaa.docindex.dto.DocumentSearchResult;
import buaa.docindex.dto.IndexingReport;
import buaa.docindex.dto.RankedDocument;
import buaa.docindex.dto.RelevantSentences;
import buaa.docindex.dto.SentenceRequest;
import buaa.docindex.dto.SummaryHit;
import buaa.docindex.model.IndexEntry;
import buaa.docindex.service.AnswerService;
import buaa.docindex.service.DocumentIndexer;
import buaa.docindex.service.LexicalRetrieverService;
import buaa.docindex.service.SearchService;
import buaa.docindex.service.SentenceExtractionService;
import buaa.docindex.service.extract.DocumentExtractors;
import buaa.docindex.service.highlight.DocumentHighlighter;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * 文档索引控制器
 * 提供索引构建、检索、相关句子抽取、文档问答与PDF高亮接口
 */
@RestController
@RequestMapping("/api")
public class DocumentIndexController {

    private final DocumentIndexer documentIndexer;
    private final LexicalRetrieverService retrieverService;
    private final SentenceExtractionService sentenceExtractionService;
    private final SearchService searchService;
    private final DocumentHighlighter documentHighlighter;
    private final AnswerService answerService;
    private final IndexingConfiguration indexingConfig;

    public DocumentIndexController(DocumentIndexer documentIndexer,
                                   LexicalRetrieverService retrieverService,
                                   SentenceExtractionService sentenceExtractionService,
                                   SearchService searchService,
                                   DocumentHighlighter documentHighlighter,
                                   AnswerService answerService,
                                   IndexingConfiguration indexingConfig) {
        this.documentIndexer = documentIndexer;
        this.retrieverService = retrieverService;
        this.sentenceExtractionService = sentenceExtractionService;
        this.searchService = searchService;
        this.documentHighlighter = documentHighlighter;
        this.answerService = answerService;
        this.indexingConfig = indexingConfig;
    }

    /**
     * 构建或增量更新索引
     * POST /api/index/rebuild
     */
    @PostMapping("/index/rebuild")
    public Result<IndexingReport> rebuildIndex() {
        return Results.success(documentIndexer.rebuildIndex());
    }

    /**
     * 查看当前索引表
     * GET /api/index
     */
    @GetMapping("/index")
    public Result<Map<String, IndexEntry>> getIndex() {
        return Results.success(documentIndexer.currentIndex());
    }

    /**
     * 文档检索
     * GET /api/search?query=xxx&topK=3
     *
     * @param query 查询文本
     * @param topK 返回文档数，默认取配置值
     */
    @GetMapping("/search")
    public Result<List<RankedDocument>> search(
            @RequestParam String query,
            @RequestParam(required = false) Integer topK) {
        return Results.success(retrieverService.retrieve(query, resolveTopK(topK)));
    }

    /**
     * 检索并抽取相关句子，PDF文档附带高亮结果
     * GET /api/search/results?query=xxx&topK=3
     */
    @GetMapping("/search/results")
    public Result<List<DocumentSearchResult>> searchWithHighlights(
            @RequestParam String query,
            @RequestParam(required = false) Integer topK) {
        if (isBlankString(query)) {
            throw new ClientException(DocIndexErrorCode.QUERY_EMPTY);
        }
        return Results.success(searchService.search(query, resolveTopK(topK)));
    }

    /**
     * 页面摘要检索
     * GET /api/search/summaries?query=xxx
     */
    @GetMapping("/search/summaries")
    public Result<List<SummaryHit>> searchSummaries(@RequestParam String query) {
        return Results.success(retrieverService.searchPageSummaries(query));
    }

    /**
     * 相关句子抽取
     * POST /api/search/sentences
     */
    @PostMapping("/search/sentences")
    public Result<RelevantSentences> extractSentences(@RequestBody SentenceRequest request) {
        if (isBlankString(request.getQuery())) {
            throw new ClientException(DocIndexErrorCode.QUERY_EMPTY);
        }
        if (isBlankString(request.getFilename())) {
            throw new ClientException("文件名不能为空", DocIndexErrorCode.PARAM_EMPTY);
        }
        int topK = request.getTopK() != null && request.getTopK() > 0
            ? request.getTopK()
            : indexingConfig.getSearch().getSentencesPerDocument();
        return Results.success(sentenceExtractionService.extractFromDocument(
            request.getQuery(), request.getFilename(), topK));
    }

    /**
     * 基于页面摘要的文档问答
     * GET /api/chat?query=xxx
     */
    @GetMapping("/chat")
    public Result<ChatAnswer> chat(@RequestParam String query) {
        return Results.success(answerService.answer(query));
    }

    /**
     * 高亮上传的PDF
     * POST /api/highlight (multipart: file, spans)
     *
     * @param uploadedFile PDF文件
     * @param spans 需要高亮的文本
     * @return 高亮后的PDF，未命中任何文本时为原文件
     */
    @PostMapping("/highlight")
    public ResponseEntity<byte[]> highlightUpload(
            @RequestParam("file") MultipartFile uploadedFile,
            @RequestParam("spans") List<String> spans) {
        String originalFilename = uploadedFile.getOriginalFilename();
        if (!"pdf".equals(DocumentExtractors.extensionOf(originalFilename))) {
            throw new ClientException("仅支持高亮PDF文档", DocIndexErrorCode.FILE_TYPE_NOT_SUPPORTED);
        }

        byte[] content;
        try {
            content = uploadedFile.getBytes();
        } catch (IOException e) {
            throw new ServiceException("上传文件读取失败: " + e.getMessage(), e, DocIndexErrorCode.HIGHLIGHT_ERROR);
        }
        return pdfResponse(originalFilename, documentHighlighter.highlight(content, spans));
    }

    /**
     * 按查询高亮已索引的PDF
     * GET /api/documents/{filename}/highlight?query=xxx
     */
    @GetMapping("/documents/{filename}/highlight")
    public ResponseEntity<byte[]> highlightIndexedDocument(
            @PathVariable String filename,
            @RequestParam String query) {
        if (isBlankString(query)) {
            throw new ClientException(DocIndexErrorCode.QUERY_EMPTY);
        }
        return pdfResponse(filename, searchService.highlightDocument(filename, query));
    }

    private ResponseEntity<byte[]> pdfResponse(String filename, byte[] body) {
        ContentDisposition disposition = ContentDisposition.inline()
            .filename("highlighted_" + filename, StandardCharsets.UTF_8)
            .build();
        return ResponseEntity.ok()
            .contentType(MediaType.APPLICATION_PDF)
            .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
            .body(body);
    }

    private int resolveTopK(Integer topK) {
        return topK != null && topK > 0 ? topK : indexingConfig.getSearch().getDefaultTopK();
    }

    /**
     * 检查字符串是否为空
     */
    private boolean isBlankString(String str) {
        return str == null || str.isBlank();
    }
}
