package com.invoiceocr.exception;

/**
 * 非法的任务状态迁移
 *
 * @author invoice-ocr
 */
public class IllegalTaskStateException extends RuntimeException {

    public IllegalTaskStateException(String message) {
        super(message);
    }
}
