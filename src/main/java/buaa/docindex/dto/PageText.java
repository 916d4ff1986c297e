package buaa.docindex.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 抽取器输出的单页原始文本
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageText {

    /** 页码，从1开始 */
    private int pageNumber;

    private String text;

    /**
     * 判断去除空白后是否仍有内容
     */
    public boolean hasContent() {
        return text != null && !text.isBlank();
    }
}
