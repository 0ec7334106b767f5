package com.invoiceocr.exception;

import org.springframework.http.HttpStatus;

/**
 * 资源不存在
 *
 * @author invoice-ocr
 */
public class NotFoundException extends ApiException {

    public NotFoundException(String errorCode, String message) {
        super(HttpStatus.NOT_FOUND, errorCode, message);
    }
}
