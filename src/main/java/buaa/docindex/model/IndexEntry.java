package buaa.docindex.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 文档索引条目
 * 仅保存文档元数据，完整文本存放于内容缓存
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class IndexEntry {

    private String filename;

    private String filePath;

    /** 文件全部字节的MD5摘要 */
    @JsonProperty("content_hash")
    @JsonAlias("file_hash")
    private String fileHash;

    private int totalPages;

    private int totalWords;

    private String documentSummary;

    private LocalDateTime lastUpdated;

    /** 对应内容缓存文件路径 */
    @JsonProperty("content_cache_reference")
    @JsonAlias("content_cache_path")
    private String contentCachePath;

    /**
     * 判断条目是否与最新计算的哈希一致
     */
    public boolean matchesHash(String currentHash) {
        return fileHash != null && fileHash.equals(currentHash);
    }
}
