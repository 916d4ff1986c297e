package buaa.docindex.service.summary;

import buaa.docindex.client.LlmChatClient;
import buaa.docindex.common.toolkit.TextTruncator;
import buaa.docindex.config.LlmConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * 基于大模型的摘要策略
 * 只发送原文前缀，调用失败、结果为空或明显超长时返回空结果
 */
public class LlmSummaryStrategy implements SummaryStrategy {

    private static final Logger log = LoggerFactory.getLogger(LlmSummaryStrategy.class);

    private final LlmChatClient chatClient;
    private final LlmConfiguration.PromptTemplate promptTemplate;

    public LlmSummaryStrategy(LlmChatClient chatClient, LlmConfiguration llmConfig) {
        this.chatClient = chatClient;
        this.promptTemplate = llmConfig.getPromptTemplate();
    }

    @Override
    public Optional<String> attempt(String text, int maxLength) {
        String input = TextTruncator.prefix(text, promptTemplate.getMaxSummaryInputChars());
        String prompt = String.format(promptTemplate.getSummary(), maxLength, input);

        String summary;
        try {
            summary = chatClient.complete(prompt);
        } catch (RuntimeException e) {
            log.warn("模型摘要失败，改用规则摘要: {}", e.getMessage());
            return Optional.empty();
        }

        if (summary == null || summary.isBlank()) {
            log.warn("模型摘要为空，改用规则摘要");
            return Optional.empty();
        }
        summary = summary.strip();
        if (summary.length() > maxLength + promptTemplate.getSummaryOvershootTolerance()) {
            log.warn("模型摘要超长({} > {})，改用规则摘要", summary.length(), maxLength);
            return Optional.empty();
        }
        return Optional.of(summary);
    }

    @Override
    public String name() {
        return "llm";
    }
}
