package com.invoiceocr.exception;

/**
 * 流水线阶段执行失败
 *
 * @author invoice-ocr
 */
public class OcrPipelineException extends RuntimeException {

    public OcrPipelineException(String message) {
        super(message);
    }

    public OcrPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
