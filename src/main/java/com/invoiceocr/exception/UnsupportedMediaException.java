package com.invoiceocr.exception;

import org.springframework.http.HttpStatus;

import java.util.Collection;

/**
 * 不支持的文件类型或文件过大，任务创建前拒绝
 *
 * @author invoice-ocr
 */
public class UnsupportedMediaException extends ApiException {

    private UnsupportedMediaException(HttpStatus httpStatus, String errorCode, String message) {
        super(httpStatus, errorCode, message);
    }

    public static UnsupportedMediaException invalidType(Collection<String> allowedExtensions) {
        return new UnsupportedMediaException(HttpStatus.BAD_REQUEST, "INVALID_FILE_TYPE",
            "Unsupported file type. Allowed: " + String.join(", ", allowedExtensions));
    }

    public static UnsupportedMediaException tooLarge(long maxMegabytes) {
        return new UnsupportedMediaException(HttpStatus.PAYLOAD_TOO_LARGE, "FILE_TOO_LARGE",
            "File too large. Maximum size: " + maxMegabytes + "MB");
    }
}
