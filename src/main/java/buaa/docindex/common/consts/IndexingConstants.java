package buaa.docindex.common.consts;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 索引与文本分析相关常量
 */
public final class IndexingConstants {

    private IndexingConstants() {
    }

    /**
     * 文件不可读时使用的哈希占位值，永远不会与缓存中的哈希相同
     */
    public static final String UNKNOWN_HASH = "unknown";

    /**
     * 截断后缀
     */
    public static final String ELLIPSIS = "...";

    /**
     * 提取文本中可能残留的页码标记，如 "--- Page 3 ---"
     */
    public static final Pattern PAGE_MARKER = Pattern.compile("--- Page \\d+ ---");

    /**
     * 关键词抽取使用的停用词
     */
    public static final Set<String> STOP_WORDS = Set.of(
        "the", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
        "is", "are", "was", "were", "been", "be", "have", "has", "had", "do", "does", "did",
        "will", "would", "could", "should", "may", "might", "can", "this", "that", "these",
        "those", "a", "an", "as", "if", "then", "than", "so", "very", "much", "more", "most",
        "such", "no", "not", "only", "own", "same", "other", "some", "any", "all", "each",
        "every", "many", "few", "several", "page"
    );

    /**
     * 规则摘要中用于提升句子权重的重要词
     */
    public static final List<String> IMPORTANT_TERMS = List.of(
        "important", "key", "main", "primary", "significant", "conclusion", "result",
        "summary", "objective", "goal", "purpose", "method", "approach", "finding",
        "recommendation"
    );
}
