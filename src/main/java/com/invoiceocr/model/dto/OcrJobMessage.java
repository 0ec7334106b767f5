package com.invoiceocr.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * OCR 队列任务消息
 *
 * @author invoice-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OcrJobMessage implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * 队列任务ID（投递时生成）
     */
    private String jobId;

    /**
     * 对应的 OCR 任务ID
     */
    private String taskId;

    /**
     * 存储文件名
     */
    private String filename;

    /**
     * 声明的扩展名（小写，不含点）
     */
    private String extension;

    private String language;

    private Boolean useGpu;
}
