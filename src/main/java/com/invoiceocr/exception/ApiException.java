package com.invoiceocr.exception;

import org.springframework.http.HttpStatus;
import top.continew.starter.core.exception.BusinessException;

/**
 * 带 HTTP 状态和错误码的业务异常
 *
 * @author invoice-ocr
 */
public class ApiException extends BusinessException {

    private final HttpStatus httpStatus;

    private final String errorCode;

    public ApiException(HttpStatus httpStatus, String errorCode, String message) {
        super(message);
        this.httpStatus = httpStatus;
        this.errorCode = errorCode;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
