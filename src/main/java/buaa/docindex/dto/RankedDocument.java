package buaa.docindex.dto;

import buaa.docindex.model.Page;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

/**
 * 检索命中的文档
 * 附带内容缓存中的分页与全文
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RankedDocument {

    private String filename;

    private String filePath;

    /** 词频相关度分数 */
    private long relevanceScore;

    private List<Page> pages;

    private String fullContent;

    private String documentSummary;

    /**
     * 判断是否为PDF文档
     */
    public boolean isPdf() {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}
