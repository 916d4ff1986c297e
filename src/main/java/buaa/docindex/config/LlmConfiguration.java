package buaa.docindex.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 大语言模型配置属性类
 * 统一管理接口地址、提示词模板和生成参数
 */
@Component
@ConfigurationProperties(prefix = "ai")
@Data
public class LlmConfiguration {

    private Api api = new Api();
    private PromptTemplate promptTemplate = new PromptTemplate();
    private GenerationParams generationParams = new GenerationParams();

    /**
     * 接口配置
     */
    @Data
    public static class Api {
        private String url = "https://api.deepseek.com";
        private String key;
        private String model = "deepseek-chat";
        /** 单次调用超时（秒） */
        private int timeoutSeconds = 60;
    }

    /**
     * 提示词模板配置
     */
    @Data
    public static class PromptTemplate {
        /** 摘要提示词，占位符依次为：目标长度、原文 */
        private String summary = "Please create a concise summary of the following text in approximately %d characters or less. "
            + "Focus on the most important information, key findings, main points, and essential details. "
            + "Preserve important numbers, dates, names, and technical terms.\n\nText to summarize:\n%s";
        /** 相关句子抽取提示词，占位符依次为：查询、句子数、文本 */
        private String sentenceExtraction = "You are an expert at finding relevant text in documents. "
            + "The user is searching for: '%s'. "
            + "Find and extract up to %d of the most relevant sentences from the text below. "
            + "CRITICAL: You must copy the sentences EXACTLY as they appear in the text - do not paraphrase, summarize, or modify them in any way. "
            + "Return only the exact sentences as they are written, numbered 1., 2., etc.\n\n"
            + "Text:\n---\n%s\n---";
        /** 文档问答提示词，占位符依次为：用户问题、页面摘要上下文 */
        private String answer = "You are an AI assistant helping a user understand their documents. "
            + "Based on the context provided below, please answer the user's question in a helpful and informative way.\n\n"
            + "User Question: %s\n\n"
            + "Context from documents:\n%s\n\n"
            + "Please provide a comprehensive answer based on the information available. "
            + "If the information is incomplete, mention what additional details might be helpful. "
            + "Be conversational and helpful.";
        /** 没有命中任何页面摘要时的固定回答 */
        private String noResultAnswer = "I couldn't find any relevant information in your documents for that query.";
        /** 模型调用失败或返回为空时的固定回答 */
        private String failureAnswer = "I'm having trouble generating a response right now. Please try again.";
        /** 送入摘要模型的最大原文字符数 */
        private int maxSummaryInputChars = 2000;
        /** 模型摘要允许超出目标长度的宽容字符数 */
        private int summaryOvershootTolerance = 50;
    }

    /**
     * 生成参数配置
     */
    @Data
    public static class GenerationParams {
        /** 温度参数（控制随机性） */
        private Double temperature = 0.3;
        /** 最大生成token数 */
        private Integer maxTokens = 2000;
        /** Top-P采样参数 */
        private Double topP = 0.9;
    }
}
