package com.invoiceocr.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 流水线输入
 *
 * @author invoice-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OcrPipelineInput {

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

    private boolean useGpu;
}
