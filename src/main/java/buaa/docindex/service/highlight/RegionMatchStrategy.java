package buaa.docindex.service.highlight;

/**
 * 文本到页面区域的匹配策略
 */
public interface RegionMatchStrategy {

    /**
     * 在页面中定位目标文本
     *
     * @param page 页面文本层
     * @param span 已规范化空白的目标文本
     * @return 匹配结果，未找到时为 {@link MatchResult#none()}
     */
    MatchResult match(PageTextLayer page, String span);

    String name();
}
