package com.invoiceocr.core;

import com.invoiceocr.model.entity.OcrResultDO;

import java.util.ArrayList;
import java.util.List;

/**
 * 逐页文本汇总
 *
 * @author invoice-ocr
 */
public final class OcrResultAggregator {

    private OcrResultAggregator() {
    }

    /**
     * 按页序汇总，空页保留为空字符串以维持页码对应关系
     */
    public static OcrResultDO aggregate(List<String> pageTexts) {
        List<String> pages = new ArrayList<>(pageTexts.size());
        for (String text : pageTexts) {
            pages.add(text == null ? "" : text);
        }
        return OcrResultDO.builder()
            .detectedTexts(pages)
            .allText(String.join("\n", pages))
            .pagesProcessed(pages.size())
            .build();
    }
}
