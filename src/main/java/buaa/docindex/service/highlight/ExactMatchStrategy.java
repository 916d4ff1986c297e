package buaa.docindex.service.highlight;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 原文精确匹配
 */
@Component
@Order(1)
public class ExactMatchStrategy implements RegionMatchStrategy {

    @Override
    public MatchResult match(PageTextLayer page, String span) {
        return MatchResult.found(name(), page.search(span));
    }

    @Override
    public String name() {
        return "exact";
    }
}
