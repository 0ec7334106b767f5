package com.invoiceocr.exception;

import org.springframework.http.HttpStatus;

/**
 * 任务存在但不属于当前用户
 *
 * @author invoice-ocr
 */
public class TaskAccessDeniedException extends ApiException {

    public TaskAccessDeniedException() {
        super(HttpStatus.FORBIDDEN, "ACCESS_DENIED", "Access denied");
    }
}
