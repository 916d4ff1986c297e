package buaa.docindex.service.extract;

/**
 * 文档无法解析（损坏、格式不支持或不可读）
 */
public class DocumentExtractionException extends Exception {

    public DocumentExtractionException(String message) {
        super(message);
    }

    public DocumentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
