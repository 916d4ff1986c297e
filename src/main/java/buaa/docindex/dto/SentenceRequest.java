package buaa.docindex.dto;

import lombok.Data;

/**
 * 相关句子抽取请求
 */
@Data
public class SentenceRequest {

    private String query;

    /** 已索引的文档文件名 */
    private String filename;

    /** 为空时使用配置的每文档句子数 */
    private Integer topK;
}
