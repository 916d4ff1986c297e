package buaa.docindex.service.highlight;

import buaa.docindex.common.consts.IndexingConstants;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * 去除缓存文本中残留的 "--- Page N ---" 页码标记后重新匹配
 */
@Component
@Order(2)
public class PageMarkerStrippedStrategy implements RegionMatchStrategy {

    @Override
    public MatchResult match(PageTextLayer page, String span) {
        String stripped = IndexingConstants.PAGE_MARKER.matcher(span).replaceAll(" ")
            .replaceAll("\\s+", " ")
            .strip();
        if (stripped.isEmpty() || stripped.equals(span)) {
            return MatchResult.none();
        }
        return MatchResult.found(name(), page.search(stripped));
    }

    @Override
    public String name() {
        return "page-marker-stripped";
    }
}
