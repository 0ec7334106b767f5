package com.invoiceocr.exception;

import cn.dev33.satoken.exception.NotLoginException;
import com.invoiceocr.model.vo.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import top.continew.starter.core.exception.BusinessException;

import java.util.stream.Collectors;

/**
 * 全局异常处理器
 *
 * @author invoice-ocr
 * @since 2026-10-12
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 带状态码的业务异常（不存在、无权限、类型不支持等）
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiResponse<Void>> handleApiException(ApiException e) {
        log.warn("业务异常: status={}, code={}, message={}", e.getHttpStatus().value(), e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(e.getHttpStatus())
            .body(ApiResponse.error(e.getMessage(), e.getErrorCode()));
    }

    /**
     * 其余业务异常按参数错误处理
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(ApiResponse.error(e.getMessage(), "VALIDATION_ERROR"));
    }

    /**
     * Sa-Token 未登录异常
     */
    @ExceptionHandler(NotLoginException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotLoginException(NotLoginException e) {
        log.warn("未登录异常: {}", e.getMessage());
        String message = switch (e.getType()) {
            case NotLoginException.NOT_TOKEN -> "Missing access token";
            case NotLoginException.INVALID_TOKEN -> "Invalid access token";
            case NotLoginException.TOKEN_TIMEOUT -> "Access token expired";
            default -> "Unauthorized";
        };
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
            .body(ApiResponse.error(message, "UNAUTHORIZED"));
    }

    /**
     * 参数校验异常 - @Valid / 参数绑定
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ApiResponse<Void>> handleBindException(BindException e) {
        String message = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("参数校验异常: {}", message);
        return ResponseEntity.badRequest()
            .body(ApiResponse.error("Validation failed: " + message, "VALIDATION_ERROR"));
    }

    /**
     * 缺少上传文件或必填参数
     */
    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiResponse<Void>> handleMissingPart(Exception e) {
        log.warn("缺少请求参数: {}", e.getMessage());
        return ResponseEntity.badRequest()
            .body(ApiResponse.error("No file provided", "NO_FILE"));
    }

    /**
     * 超出 multipart 上传上限
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiResponse<Void>> handleMaxUploadSize(MaxUploadSizeExceededException e) {
        log.warn("上传文件过大: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(ApiResponse.error("File too large", "FILE_TOO_LARGE"));
    }

    /**
     * 其他未捕获的异常，不向调用方暴露内部细节
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleException(Exception e) {
        log.error("系统异常: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ApiResponse.error("Internal server error", "INTERNAL_ERROR"));
    }
}
