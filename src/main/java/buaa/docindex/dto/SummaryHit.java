package buaa.docindex.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 页面摘要检索结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryHit {

    private String filename;

    private int pageNumber;

    private String summary;

    private List<String> keywords;

    private List<String> relations;

    private long relevanceScore;
}
