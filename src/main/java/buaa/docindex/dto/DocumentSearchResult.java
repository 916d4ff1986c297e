package buaa.docindex.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 检索并抽取相关句子后的单文档结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentSearchResult {

    private String filename;

    private long relevanceScore;

    private List<String> relevantSentences;

    private List<String> pageSummaries;

    /** 仅PDF文档存在，已标注相关句子的PDF */
    private byte[] highlightedPdf;
}
