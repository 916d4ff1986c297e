package buaa.docindex.common.convention.errorcode;

/**
 * 文档索引业务错误码枚举
 *
 * 错误码规范：
 * - A0xxx: 客户端错误（参数校验、文件格式等）
 * - B0xxx: 服务端错误（索引、存储等）
 * - C0xxx: 外部依赖错误（大模型服务）
 */
public enum DocIndexErrorCode implements IErrorCode {

    // ==================== 通用错误 ====================
    CLIENT_ERROR("A0001", "客户端请求错误"),

    SERVICE_ERROR("B0001", "服务端执行错误"),

    // ==================== 参数校验错误 (A01xx) ====================
    PARAM_EMPTY("A0101", "必填参数为空"),

    PARAM_INVALID("A0102", "参数格式错误"),

    /**
     * 搜索关键词不能为空
     */
    QUERY_EMPTY("A0104", "搜索关键词不能为空"),

    /**
     * 待抽取文本片段为空
     */
    TEXT_CHUNKS_EMPTY("A0105", "待抽取的文本片段不能为空"),

    // ==================== 文件相关错误 (A02xx) ====================
    FILE_TYPE_NOT_SUPPORTED("A0201", "不支持的文件格式"),

    FILE_SIZE_EXCEEDED("A0202", "上传文件大小超出限制"),

    // ==================== 业务逻辑错误 (A04xx) ====================
    DOCUMENT_NOT_FOUND("A0401", "文档不存在"),

    // ==================== 服务端错误 (B0xxx) ====================
    /**
     * 索引构建异常
     */
    INDEXING_ERROR("B0101", "索引构建异常"),

    /**
     * 索引或内容缓存持久化失败
     */
    STORAGE_SERVICE_ERROR("B0105", "存储服务异常"),

    /**
     * 高亮处理异常
     */
    HIGHLIGHT_ERROR("B0107", "高亮处理异常"),

    // ==================== 外部依赖错误 (C0xxx) ====================
    /**
     * 大模型API异常
     */
    LLM_API_ERROR("C0103", "大模型API异常");

    private final String code;
    private final String message;

    DocIndexErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return this.code;
    }

    @Override
    public String message() {
        return this.message;
    }
}
