package buaa.docindex.dto;

import buaa.docindex.model.IndexEntry;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 一次索引构建的统计结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexingReport {

    /** 本次重新处理成功的文档数 */
    private int indexed;

    /** 内容未变化、沿用缓存的文档数 */
    private int skipped;

    /** 抽取失败被跳过的文档数 */
    private int failed;

    private long elapsedMillis;

    private Map<String, IndexEntry> index;

    public int getTotalDocuments() {
        return index == null ? 0 : index.size();
    }
}
