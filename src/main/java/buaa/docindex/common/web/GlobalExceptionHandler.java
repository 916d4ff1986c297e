package buaa.docindex.common.web;

import buaa.docindex.common.convention.errorcode.DocIndexErrorCode;
import buaa.docindex.common.convention.exception.AbstractException;
import buaa.docindex.common.convention.exception.ClientException;
import buaa.docindex.common.convention.result.Result;
import buaa.docindex.common.convention.result.Results;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * 全局异常处理器
 * 统一捕获并处理所有Controller抛出的异常
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理缺失请求参数
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<Void> handleMissingParameter(MissingServletRequestParameterException ex,
                                               HttpServletRequest request) {
        log.error("[{}] {} - 缺少请求参数: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                ex.getParameterName());

        return Results.failure(DocIndexErrorCode.PARAM_EMPTY.code(), "缺少请求参数: " + ex.getParameterName());
    }

    /**
     * 处理缺失的上传文件
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<Void> handleMissingPart(MissingServletRequestPartException ex, HttpServletRequest request) {
        log.error("[{}] {} - 缺少上传文件: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                ex.getRequestPartName());

        return Results.failure(DocIndexErrorCode.PARAM_EMPTY.code(), "缺少上传文件: " + ex.getRequestPartName());
    }

    /**
     * 处理请求体无法解析或参数类型不匹配（如 topK=abc）
     */
    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<Void> handleUnreadableRequest(Exception ex, HttpServletRequest request) {
        log.warn("[{}] {} - 请求参数格式错误: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                ex.getMessage());

        return Results.failure(DocIndexErrorCode.PARAM_INVALID);
    }

    /**
     * 处理上传文件超出大小限制
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    @ResponseStatus(HttpStatus.PAYLOAD_TOO_LARGE)
    public Result<Void> handleUploadTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        log.warn("[{}] {} - 上传文件超出大小限制: {}",
                request.getMethod(),
                getFullRequestUrl(request),
                ex.getMaxUploadSize());

        return Results.failure(DocIndexErrorCode.FILE_SIZE_EXCEEDED);
    }

    /**
     * 处理客户端异常
     */
    @ExceptionHandler(ClientException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<Void> handleClientException(ClientException ex, HttpServletRequest request) {
        log.warn("[{}] {} - 请求错误: {} ({})",
                request.getMethod(),
                getFullRequestUrl(request),
                ex.getErrorMessage(),
                ex.getErrorCode());

        return Results.failure(ex);
    }

    /**
     * 处理业务异常（ServiceException）
     */
    @ExceptionHandler(AbstractException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Result<Void> handleAbstractException(AbstractException ex, HttpServletRequest request) {
        // 如果有原始异常，打印完整堆栈；否则只打印错误信息
        if (ex.getCause() != null) {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode(),
                    ex);
        } else {
            log.error("[{}] {} - 业务异常: {} ({})",
                    request.getMethod(),
                    getFullRequestUrl(request),
                    ex.getErrorMessage(),
                    ex.getErrorCode());
        }

        return Results.failure(ex);
    }

    /**
     * 处理未捕获的异常（兜底处理）
     */
    @ExceptionHandler(Throwable.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Result<Void> handleThrowable(Throwable throwable, HttpServletRequest request) {
        log.error("[{}] {} - 系统异常",
                request.getMethod(),
                getFullRequestUrl(request),
                throwable);

        // 返回通用服务端错误，避免暴露内部异常细节
        return Results.failure(DocIndexErrorCode.SERVICE_ERROR);
    }

    /**
     * 获取完整请求URL（包含查询参数）
     */
    private String getFullRequestUrl(HttpServletRequest request) {
        String queryString = request.getQueryString();
        return request.getRequestURI() +
                (queryString != null ? "?" + queryString : "");
    }
}
