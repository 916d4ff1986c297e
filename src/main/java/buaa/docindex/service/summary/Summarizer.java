package buaa.docindex.service.summary;

/**
 * 文本摘要能力
 */
public interface Summarizer {

    /**
     * 生成摘要
     * 文本长度不超过上限时原样返回
     *
     * @param text 原文
     * @param maxLength 摘要长度上限
     * @return 摘要
     */
    String summarize(String text, int maxLength);
}
