package buaa.docindex.dto;

import buaa.docindex.model.Page;
import buaa.docindex.model.PageAnnotation;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 单页处理结果，页面内容与其注释一同返回
 */
@Data
@AllArgsConstructor
public class ProcessedPage {

    private Page page;

    private PageAnnotation annotation;

    public int getPageNumber() {
        return page.getPageNumber();
    }
}
