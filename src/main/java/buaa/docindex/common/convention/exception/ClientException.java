package buaa.docindex.common.convention.exception;

import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.errorcode.IErrorCode;

import java.util.Optional;

/**
 * 客户端异常
 * 用于表示由调用方输入引起的错误（如查询为空、文件格式不支持等）
 */
public class ClientException extends AbstractException {

    public ClientException(IErrorCode errorCode) {
        this(null, null, errorCode);
    }

    public ClientException(String message) {
        this(message, null, DocIndexErrorCode.CLIENT_ERROR);
    }

    public ClientException(String message, IErrorCode errorCode) {
        this(message, null, errorCode);
    }

    public ClientException(String message, Throwable throwable, IErrorCode errorCode) {
        super(Optional.ofNullable(message).orElse(errorCode.message()), throwable, errorCode);
    }
}
