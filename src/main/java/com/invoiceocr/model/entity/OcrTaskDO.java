package com.invoiceocr.model.entity;

import com.invoiceocr.model.enums.OcrTaskStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * OCR 任务实体
 *
 * @author invoice-ocr
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class OcrTaskDO {

    private String id;

    private String userId;

    private OcrTaskStatus status;

    /**
     * 存储文件名（不含目录）
     */
    private String filename;

    private String language;

    private Boolean useGpu;

    private String errorMessage;

    /**
     * 委托执行模式下的外部任务ID
     */
    private String externalJobId;

    private LocalDateTime createTime;

    private LocalDateTime endTime;
}
