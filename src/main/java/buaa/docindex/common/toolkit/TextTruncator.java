package buaa.docindex.common.toolkit;

import buaa.docindex.common.consts.IndexingConstants;

/**
 * 文本截断工具
 *
 * <p>截断位置按 UTF-16 单元计算，若恰好落在代理对中间则向前退一位，
 * 保证结果可以按 UTF-8 正常编码。</p>
 */
public final class TextTruncator {

    private TextTruncator() {
    }

    /**
     * 取不超过 maxLength 个 UTF-16 单元的前缀
     */
    public static String prefix(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        int end = Math.max(0, maxLength);
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    /**
     * 截断并追加省略号
     */
    public static String abbreviate(String text, int maxLength) {
        return prefix(text, maxLength) + IndexingConstants.ELLIPSIS;
    }
}
