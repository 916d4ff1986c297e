package buaa.docindex.client;

import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.exception.ServiceException;
import buaa.docindex.config.LlmConfiguration;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 大语言模型对话客户端
 * 以非流式方式调用兼容OpenAI协议的 /chat/completions 接口
 */
@Component
public class LlmChatClient {

    private static final Logger log = LoggerFactory.getLogger(LlmChatClient.class);

    private final WebClient httpClient;
    private final LlmConfiguration llmConfig;
    private final ObjectMapper jsonParser;

    public LlmChatClient(WebClient llmWebClient, LlmConfiguration llmConfig, ObjectMapper objectMapper) {
        this.httpClient = llmWebClient;
        this.llmConfig = llmConfig;
        this.jsonParser = objectMapper;
    }

    /**
     * 发送单轮提示词并返回模型回答
     *
     * @param prompt 提示词
     * @return 模型回答文本，可能为空字符串
     * @throws ServiceException 调用失败、超时或响应格式异常
     */
    public String complete(String prompt) {
        Map<String, Object> requestBody = buildRequestBody(prompt);
        log.debug("发起模型请求，模型: {}, 提示词长度: {}", llmConfig.getApi().getModel(), prompt.length());

        try {
            String response = httpClient.post()
                .uri("/chat/completions")
                .bodyValue(requestBody)
                .retrieve()
                .bodyToMono(String.class)
                .retryWhen(createRetryPolicy())
                .block(Duration.ofSeconds(llmConfig.getApi().getTimeoutSeconds()));
            return extractContent(response);
        } catch (ServiceException e) {
            throw e;
        } catch (Exception e) {
            throw new ServiceException("大模型调用失败: " + e.getMessage(), e, DocIndexErrorCode.LLM_API_ERROR);
        }
    }

    /**
     * 构建请求体
     */
    private Map<String, Object> buildRequestBody(String prompt) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", llmConfig.getApi().getModel());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("stream", false);

        LlmConfiguration.GenerationParams params = llmConfig.getGenerationParams();
        if (params.getTemperature() != null) {
            body.put("temperature", params.getTemperature());
        }
        if (params.getTopP() != null) {
            body.put("top_p", params.getTopP());
        }
        if (params.getMaxTokens() != null) {
            body.put("max_tokens", params.getMaxTokens());
        }
        return body;
    }

    /**
     * 创建重试策略
     */
    private Retry createRetryPolicy() {
        return Retry.fixedDelay(2, Duration.ofSeconds(1))
            .filter(error -> error instanceof WebClientResponseException);
    }

    /**
     * 从响应中提取回答文本
     */
    String extractContent(String response) throws Exception {
        if (response == null || response.isBlank()) {
            throw new ServiceException("API响应为空", DocIndexErrorCode.LLM_API_ERROR);
        }
        JsonNode root = jsonParser.readTree(response);
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ServiceException("API响应格式异常: 缺少choices数组", DocIndexErrorCode.LLM_API_ERROR);
        }
        return choices.get(0).path("message").path("content").asText("");
    }
}
