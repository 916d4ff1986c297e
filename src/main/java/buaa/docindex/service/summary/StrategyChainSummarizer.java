package buaa.docindex.service.summary;

import buaa.docindex.common.toolkit.TextTruncator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 按顺序尝试摘要策略，取第一个成功的结果
 */
public class StrategyChainSummarizer implements Summarizer {

    private static final Logger log = LoggerFactory.getLogger(StrategyChainSummarizer.class);

    private final List<SummaryStrategy> strategies;

    public StrategyChainSummarizer(List<SummaryStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    @Override
    public String summarize(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        for (SummaryStrategy strategy : strategies) {
            Optional<String> summary;
            try {
                summary = strategy.attempt(text, maxLength);
            } catch (RuntimeException e) {
                log.warn("摘要策略 {} 执行异常: {}", strategy.name(), e.getMessage());
                continue;
            }
            if (summary.isPresent()) {
                return summary.get();
            }
            log.debug("摘要策略 {} 未产出结果，尝试下一个", strategy.name());
        }
        return TextTruncator.abbreviate(text, maxLength);
    }

    public List<SummaryStrategy> getStrategies() {
        return strategies;
    }
}
