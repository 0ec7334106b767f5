package com.invoiceocr.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * OCR 任务状态
 *
 * <p>processing 为创建时的初始状态，completed、failed 为终态。</p>
 *
 * @author invoice-ocr
 */
public enum OcrTaskStatus {

    PROCESSING("processing"),

    COMPLETED("completed"),

    FAILED("failed");

    private final String value;

    OcrTaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this != PROCESSING;
    }

    public static Optional<OcrTaskStatus> fromValue(String value) {
        return Arrays.stream(values())
            .filter(status -> status.value.equalsIgnoreCase(value))
            .findFirst();
    }

    @Override
    public String toString() {
        return value;
    }
}
