package com.invoiceocr.exception;

/**
 * 字段抽取后端不可用、超时或未配置
 *
 * @author invoice-ocr
 */
public class InvoiceExtractionException extends RuntimeException {

    public InvoiceExtractionException(String message) {
        super(message);
    }

    public InvoiceExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
