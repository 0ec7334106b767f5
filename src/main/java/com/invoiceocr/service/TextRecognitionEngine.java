package com.invoiceocr.service;

import java.nio.file.Path;
import java.util.List;

/**
 * 文字识别引擎
 *
 * @author invoice-ocr
 */
public interface TextRecognitionEngine {

    /**
     * 识别单张图片中的文本区域，按引擎返回顺序排列
     */
    List<String> recognizeRegions(Path image, String language, boolean useGpu);
}
