package buaa.docindex.config;

import buaa.docindex.client.LlmChatClient;
import buaa.docindex.service.summary.LlmSummaryStrategy;
import buaa.docindex.service.summary.RuleBasedSummarizer;
import buaa.docindex.service.summary.StrategyChainSummarizer;
import buaa.docindex.service.summary.Summarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * 摘要实现装配
 * 由 indexing.summarizer 显式选择，不依据密钥是否存在推断
 */
@Configuration
public class SummarizerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SummarizerConfiguration.class);

    @Bean
    public Summarizer summarizer(IndexingConfiguration indexingConfiguration,
                                 LlmChatClient llmChatClient,
                                 LlmConfiguration llmConfiguration) {
        RuleBasedSummarizer ruleBased = new RuleBasedSummarizer();
        if (indexingConfiguration.getSummarizer() == IndexingConfiguration.SummarizerMode.LLM) {
            log.info("使用模型摘要，失败时回退规则摘要");
            return new StrategyChainSummarizer(List.of(
                new LlmSummaryStrategy(llmChatClient, llmConfiguration),
                ruleBased));
        }
        log.info("使用规则摘要");
        return ruleBased;
    }
}
