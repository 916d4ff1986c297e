package buaa.docindex.service;

import buaa.docindex.client.LlmChatClient;
import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.exception.ClientException;
import buaa.docindex.config.LlmConfiguration;
import buaa.docindex.dto.ChatAnswer;
import buaa.docindex.dto.SummaryHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 文档问答服务
 * 以页面摘要检索结果为上下文，请求大模型回答用户问题
 */
@Service
public class AnswerService {

    private static final Logger log = LoggerFactory.getLogger(AnswerService.class);

    private static final String CONTEXT_HEADER = "Based on the following information from your documents:\n\n";

    private final LexicalRetrieverService retrieverService;
    private final LlmChatClient chatClient;
    private final LlmConfiguration.PromptTemplate promptTemplate;

    public AnswerService(LexicalRetrieverService retrieverService,
                         LlmChatClient chatClient,
                         LlmConfiguration llmConfig) {
        this.retrieverService = retrieverService;
        this.chatClient = chatClient;
        this.promptTemplate = llmConfig.getPromptTemplate();
    }

    /**
     * 回答用户问题
     * 没有命中页面摘要时不调用模型；模型调用失败时返回固定提示，不向上抛出
     *
     * @throws ClientException 问题为空
     */
    public ChatAnswer answer(String query) {
        if (query == null || query.isBlank()) {
            throw new ClientException(DocIndexErrorCode.QUERY_EMPTY);
        }

        List<SummaryHit> hits = retrieverService.searchPageSummaries(query);
        if (hits.isEmpty()) {
            log.info("问答未命中任何页面摘要 - 问题: {}", query);
            return new ChatAnswer(query, promptTemplate.getNoResultAnswer(), hits);
        }

        String prompt = String.format(promptTemplate.getAnswer(), query, buildContext(hits));
        String response;
        try {
            response = chatClient.complete(prompt);
        } catch (RuntimeException e) {
            log.warn("问答生成失败 - 问题: {}, 原因: {}", query, e.getMessage());
            return new ChatAnswer(query, promptTemplate.getFailureAnswer(), hits);
        }

        if (response == null || response.isBlank()) {
            log.warn("模型回答为空 - 问题: {}", query);
            return new ChatAnswer(query, promptTemplate.getFailureAnswer(), hits);
        }
        return new ChatAnswer(query, response.strip(), hits);
    }

    /**
     * 拼接上下文，每个命中页面一段
     */
    static String buildContext(List<SummaryHit> hits) {
        StringBuilder context = new StringBuilder(CONTEXT_HEADER);
        for (SummaryHit hit : hits) {
            context.append("From ").append(hit.getFilename())
                .append(" (Page ").append(hit.getPageNumber()).append("): ")
                .append(hit.getSummary())
                .append("\n\n");
        }
        return context.toString();
    }
}
