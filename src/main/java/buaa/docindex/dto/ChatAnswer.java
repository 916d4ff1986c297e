package buaa.docindex.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 文档问答结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatAnswer {

    private String query;

    private String answer;

    /** 作为上下文的页面摘要 */
    private List<SummaryHit> sources;
}
