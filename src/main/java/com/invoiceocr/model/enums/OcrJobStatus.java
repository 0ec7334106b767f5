package com.invoiceocr.model.enums;

import java.util.Arrays;

/**
 * 外部队列任务状态
 *
 * @author invoice-ocr
 */
public enum OcrJobStatus {

    PENDING("pending"),

    SUCCESS("success"),

    FAILURE("failure");

    private final String value;

    OcrJobStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * 未知取值按 pending 处理
     */
    public static OcrJobStatus fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equals(value))
            .findFirst()
            .orElse(PENDING);
    }
}
