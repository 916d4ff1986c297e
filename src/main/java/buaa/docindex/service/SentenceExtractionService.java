package buaa.docindex.service;

import buaa.docindex.client.LlmChatClient;
import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.exception.ClientException;
import buaa.docindex.common.convention.exception.ServiceException;
import buaa.docindex.config.IndexingConfiguration;
import buaa.docindex.config.LlmConfiguration;
import buaa.docindex.dto.RelevantSentences;
import buaa.docindex.model.ContentCache;
import buaa.docindex.repository.ContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 相关句子抽取服务
 * 将文档全文按词数分块后交给大模型，要求原样摘录与查询最相关的句子
 */
@Service
public class SentenceExtractionService {

    private static final Logger log = LoggerFactory.getLogger(SentenceExtractionService.class);

    /** 编号 1. 到 10. 开头的行 */
    private static final Pattern NUMBERED_LINE = Pattern.compile("^(?:10|[1-9])\\..*", Pattern.DOTALL);

    private final LlmChatClient chatClient;
    private final ContentStore contentStore;
    private final IndexingConfiguration indexingConfig;
    private final LlmConfiguration llmConfig;

    public SentenceExtractionService(LlmChatClient chatClient,
                                     ContentStore contentStore,
                                     IndexingConfiguration indexingConfig,
                                     LlmConfiguration llmConfig) {
        this.chatClient = chatClient;
        this.contentStore = contentStore;
        this.indexingConfig = indexingConfig;
        this.llmConfig = llmConfig;
    }

    /**
     * 从已索引文档中抽取相关句子
     *
     * @throws ClientException 文档没有内容缓存
     */
    public RelevantSentences extractFromDocument(String query, String filename, int topK) {
        ContentCache cache = contentStore.loadContent(filename)
            .orElseThrow(() -> new ClientException("文档不存在或尚未索引: " + filename,
                DocIndexErrorCode.DOCUMENT_NOT_FOUND));
        return extract(query, splitIntoChunks(cache.getFullContent()), topK);
    }

    /**
     * 从文本块中抽取相关句子
     *
     * @param query 查询文本
     * @param textChunks 文本块
     * @param topK 最多返回的句子数
     * @throws ClientException 文本块为空
     * @throws ServiceException 模型调用失败
     */
    public RelevantSentences extract(String query, List<String> textChunks, int topK) {
        if (textChunks == null || textChunks.isEmpty()) {
            throw new ClientException(DocIndexErrorCode.TEXT_CHUNKS_EMPTY);
        }

        String prompt = String.format(llmConfig.getPromptTemplate().getSentenceExtraction(),
            query, topK, String.join("\n\n", textChunks));

        String response;
        try {
            response = chatClient.complete(prompt);
        } catch (ServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ServiceException("相关句子抽取失败: " + e.getMessage(), e, DocIndexErrorCode.LLM_API_ERROR);
        }

        List<String> sentences = parseResponse(response);
        log.debug("相关句子抽取完成 - 查询: {}, 句子数: {}", query, sentences.size());
        return new RelevantSentences(query, sentences);
    }

    /**
     * 按词数切分文本
     */
    public List<String> splitIntoChunks(String text) {
        List<String> chunks = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return chunks;
        }
        String[] words = text.strip().split("\\s+");
        int chunkWords = Math.max(1, indexingConfig.getSearch().getChunkWords());
        for (int start = 0; start < words.length; start += chunkWords) {
            int end = Math.min(start + chunkWords, words.length);
            chunks.add(String.join(" ", Arrays.copyOfRange(words, start, end)));
        }
        return chunks;
    }

    /**
     * 解析模型返回的编号列表
     * 只接受以 1. 至 10. 开头的行，去掉编号后保留句子原文
     */
    static List<String> parseResponse(String responseText) {
        List<String> sentences = new ArrayList<>();
        if (responseText == null) {
            return sentences;
        }
        for (String line : responseText.split("\n")) {
            if (NUMBERED_LINE.matcher(line.strip()).matches()) {
                sentences.add(line.substring(line.indexOf('.') + 1).strip());
            }
        }
        return sentences;
    }
}
