package buaa.docindex.service.highlight;

import lombok.Getter;

import java.util.List;

/**
 * 单个匹配策略的执行结果
 */
@Getter
public class MatchResult {

    private static final MatchResult NONE = new MatchResult(null, List.of());

    /** 命中的策略名称，未命中时为空 */
    private final String strategy;

    private final List<TextRegion> regions;

    private MatchResult(String strategy, List<TextRegion> regions) {
        this.strategy = strategy;
        this.regions = regions;
    }

    public static MatchResult found(String strategy, List<TextRegion> regions) {
        if (regions == null || regions.isEmpty()) {
            return NONE;
        }
        return new MatchResult(strategy, List.copyOf(regions));
    }

    public static MatchResult none() {
        return NONE;
    }

    public boolean isFound() {
        return !regions.isEmpty();
    }
}
