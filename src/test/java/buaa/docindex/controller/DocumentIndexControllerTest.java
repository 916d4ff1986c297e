package buaa.docindex.controller;

import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.exception.ClientException;
import buaa.docindex.common.convention.exception.ServiceException;
import buaa.docindex.common.web.GlobalExceptionHandler;
import buaa.docindex.config.IndexingConfiguration;
import buaa.docindex.dto.ChatAnswer;
import buaa.docindex.dto.DocumentSearchResult;
import buaa.docindex.dto.IndexingReport;
import buaa.docindex.dto.RankedDocument;
import buaa.docindex.dto.RelevantSentences;
import buaa.docindex.dto.SummaryHit;
import buaa.docindex.service.AnswerService;
import buaa.docindex.service.DocumentIndexer;
import buaa.docindex.service.LexicalRetrieverService;
import buaa.docindex.service.SearchService;
import buaa.docindex.service.SentenceExtractionService;
import buaa.docindex.service.highlight.DocumentHighlighter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class DocumentIndexControllerTest {

    private static final byte[] PDF_BYTES = "%PDF-1.7 highlighted".getBytes(StandardCharsets.UTF_8);

    private DocumentIndexer documentIndexer;
    private LexicalRetrieverService retrieverService;
    private SentenceExtractionService sentenceExtractionService;
    private SearchService searchService;
    private DocumentHighlighter documentHighlighter;
    private AnswerService answerService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        documentIndexer = mock(DocumentIndexer.class);
        retrieverService = mock(LexicalRetrieverService.class);
        sentenceExtractionService = mock(SentenceExtractionService.class);
        searchService = mock(SearchService.class);
        documentHighlighter = mock(DocumentHighlighter.class);
        answerService = mock(AnswerService.class);

        DocumentIndexController controller = new DocumentIndexController(documentIndexer, retrieverService,
            sentenceExtractionService, searchService, documentHighlighter, answerService, new IndexingConfiguration());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @Test
    void rebuildReturnsReport() throws Exception {
        when(documentIndexer.rebuildIndex()).thenReturn(IndexingReport.builder()
            .indexed(2)
            .skipped(1)
            .index(new LinkedHashMap<>())
            .build());

        mockMvc.perform(post("/api/index/rebuild"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.code").value("0"))
            .andExpect(jsonPath("$.data.indexed").value(2))
            .andExpect(jsonPath("$.data.skipped").value(1));
    }

    @Test
    void searchUsesDefaultTopK() throws Exception {
        when(retrieverService.retrieve("apple", 3)).thenReturn(List.of(
            RankedDocument.builder().filename("a.txt").relevanceScore(4).build()));

        mockMvc.perform(get("/api/search").param("query", "apple"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].filename").value("a.txt"))
            .andExpect(jsonPath("$.data[0].relevanceScore").value(4));
    }

    @Test
    void searchHonoursExplicitTopK() throws Exception {
        when(retrieverService.retrieve("apple", 7)).thenReturn(List.of());

        mockMvc.perform(get("/api/search").param("query", "apple").param("topK", "7"))
            .andExpect(status().isOk());

        verify(retrieverService).retrieve("apple", 7);
    }

    @Test
    void missingQueryParameterIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/search"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(DocIndexErrorCode.PARAM_EMPTY.code()));
    }

    @Test
    void malformedTopKIsRejected() throws Exception {
        mockMvc.perform(get("/api/search").param("query", "apple").param("topK", "abc"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(DocIndexErrorCode.PARAM_INVALID.code()));
    }

    @Test
    void clientExceptionMapsToBadRequest() throws Exception {
        when(retrieverService.retrieve(" ", 3)).thenThrow(new ClientException(DocIndexErrorCode.QUERY_EMPTY));

        mockMvc.perform(get("/api/search").param("query", " "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(DocIndexErrorCode.QUERY_EMPTY.code()));
    }

    @Test
    void serviceExceptionMapsToServerError() throws Exception {
        when(retrieverService.searchPageSummaries("revenue"))
            .thenThrow(new ServiceException("store unavailable", DocIndexErrorCode.STORAGE_SERVICE_ERROR));

        mockMvc.perform(get("/api/search/summaries").param("query", "revenue"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.code").value(DocIndexErrorCode.STORAGE_SERVICE_ERROR.code()))
            .andExpect(jsonPath("$.message").value("store unavailable"));
    }

    @Test
    void searchResultsRejectBlankQuery() throws Exception {
        mockMvc.perform(get("/api/search/results").param("query", "  "))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(DocIndexErrorCode.QUERY_EMPTY.code()));

        verify(searchService, never()).search(anyString(), anyInt());
    }

    @Test
    void searchResultsReturnSentences() throws Exception {
        when(searchService.search("revenue", 3)).thenReturn(List.of(DocumentSearchResult.builder()
            .filename("report.pdf")
            .relevantSentences(List.of("Revenue grew."))
            .build()));

        mockMvc.perform(get("/api/search/results").param("query", "revenue"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].relevantSentences[0]").value("Revenue grew."));
    }

    @Test
    void sentenceExtractionDefaultsTopK() throws Exception {
        when(sentenceExtractionService.extractFromDocument("revenue", "report.pdf", 5))
            .thenReturn(new RelevantSentences("revenue", List.of("Revenue grew.")));

        mockMvc.perform(post("/api/search/sentences")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"revenue\",\"filename\":\"report.pdf\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.sentences[0]").value("Revenue grew."));
    }

    @Test
    void sentenceExtractionRequiresFilename() throws Exception {
        mockMvc.perform(post("/api/search/sentences")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\":\"revenue\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(DocIndexErrorCode.PARAM_EMPTY.code()));
    }

    @Test
    void chatReturnsAnswerWithSources() throws Exception {
        when(answerService.answer("revenue")).thenReturn(new ChatAnswer("revenue", "Revenue grew.",
            List.of(SummaryHit.builder().filename("report.pdf").pageNumber(2).summary("Revenue grew 12%.").build())));

        mockMvc.perform(get("/api/chat").param("query", "revenue"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.answer").value("Revenue grew."))
            .andExpect(jsonPath("$.data.sources[0].filename").value("report.pdf"))
            .andExpect(jsonPath("$.data.sources[0].pageNumber").value(2));
    }

    @Test
    void chatRequiresQuery() throws Exception {
        mockMvc.perform(get("/api/chat"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(DocIndexErrorCode.PARAM_EMPTY.code()));

        verify(answerService, never()).answer(anyString());
    }

    @Test
    void highlightsUploadedPdf() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "report.pdf", "application/pdf",
            "%PDF-1.7 original".getBytes(StandardCharsets.UTF_8));
        when(documentHighlighter.highlight(eq(file.getBytes()), eq(List.of("Revenue grew.", "Costs fell."))))
            .thenReturn(PDF_BYTES);

        mockMvc.perform(multipart("/api/highlight")
                .file(file)
                .param("spans", "Revenue grew.", "Costs fell."))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_PDF))
            .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION, containsString("highlighted_report.pdf")))
            .andExpect(content().bytes(PDF_BYTES));
    }

    @Test
    void highlightRejectsNonPdfUpload() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "notes.txt", "text/plain",
            "plain".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart("/api/highlight").file(file).param("spans", "plain"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(DocIndexErrorCode.FILE_TYPE_NOT_SUPPORTED.code()));

        verify(documentHighlighter, never()).highlight(any(), anyList());
    }

    @Test
    void highlightRequiresFilePart() throws Exception {
        mockMvc.perform(multipart("/api/highlight").param("spans", "plain"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.code").value(DocIndexErrorCode.PARAM_EMPTY.code()));
    }

    @Test
    void highlightsIndexedDocumentByQuery() throws Exception {
        when(searchService.highlightDocument("report.pdf", "revenue")).thenReturn(PDF_BYTES);

        mockMvc.perform(get("/api/documents/report.pdf/highlight").param("query", "revenue"))
            .andExpect(status().isOk())
            .andExpect(content().contentType(MediaType.APPLICATION_PDF))
            .andExpect(content().bytes(PDF_BYTES));
    }
}
