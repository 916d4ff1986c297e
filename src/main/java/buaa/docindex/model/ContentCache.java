package buaa.docindex.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 文档内容缓存
 * 与索引条目按文件名一一对应，重新处理时整体替换
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ContentCache {

    private String filename;

    @Builder.Default
    private List<Page> pages = new ArrayList<>();

    private String fullContent;

    private LocalDateTime cachedAt;
}
