package com.invoiceocr.model.dto;

import com.invoiceocr.model.enums.OcrJobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 队列任务轮询结果
 *
 * @author invoice-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OcrJobState {

    private OcrJobStatus status;

    /**
     * 成功时的逐页文本
     */
    private List<String> pageTexts;

    /**
     * 失败原因
     */
    private String error;

    public static OcrJobState pending() {
        return OcrJobState.builder().status(OcrJobStatus.PENDING).build();
    }
}
