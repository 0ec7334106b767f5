package com.invoiceocr.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * OCR 识别结果
 *
 * @author invoice-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OcrResultDO {

    /**
     * 逐页文本，下标 + 1 即页码
     */
    private List<String> detectedTexts;

    /**
     * 按页序换行拼接的全文
     */
    private String allText;

    private Integer pagesProcessed;
}
