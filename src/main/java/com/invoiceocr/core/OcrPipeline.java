package com.invoiceocr.core;

import cn.hutool.core.io.FileUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceocr.exception.OcrPipelineException;
import com.invoiceocr.model.dto.OcrPipelineInput;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.service.DocumentConverter;
import com.invoiceocr.service.FileStorageService;
import com.invoiceocr.service.TextRecognitionEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * OCR 流水线：转换 → 逐页识别 → 汇总 → 导出
 *
 * <p>不做任何状态写入，由调用方根据返回值或异常决定任务终态。</p>
 *
 * @author invoice-ocr
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OcrPipeline {

    private final DocumentConverter documentConverter;
    private final TextRecognitionEngine textRecognitionEngine;
    private final FileStorageService fileStorageService;
    private final ObjectMapper objectMapper;

    /**
     * 完整执行
     */
    public OcrResultDO run(OcrPipelineInput input) {
        List<String> pageTexts = recognize(input);
        return assemble(input.getFilename(), pageTexts);
    }

    /**
     * 转换并逐页识别，返回每页文本（同页内区域按换行拼接）
     *
     * @throws OcrPipelineException 未能转换出任何页面
     */
    public List<String> recognize(OcrPipelineInput input) {
        long start = System.currentTimeMillis();
        Path source = fileStorageService.resolveUpload(input.getFilename());
        List<Path> pages = documentConverter.convert(source, input.getExtension());
        if (pages.isEmpty()) {
            throw new OcrPipelineException("No pages could be converted from the uploaded file");
        }
        log.info("任务 {} 转换完成, 共 {} 页", input.getTaskId(), pages.size());

        List<String> pageTexts = new ArrayList<>(pages.size());
        for (Path page : pages) {
            List<String> regions = textRecognitionEngine.recognizeRegions(page, input.getLanguage(), input.isUseGpu());
            pageTexts.add(String.join("\n", regions));
        }
        log.info("任务 {} 识别完成, 页数: {}, 耗时: {}ms", input.getTaskId(), pageTexts.size(),
            System.currentTimeMillis() - start);
        return pageTexts;
    }

    /**
     * 汇总逐页文本并导出派生文件；导出失败只记录日志
     */
    public OcrResultDO assemble(String filename, List<String> pageTexts) {
        OcrResultDO result = OcrResultAggregator.aggregate(pageTexts);
        String baseName = FileUtil.mainName(filename);
        try {
            fileStorageService.writeOutput(baseName + ".txt",
                result.getAllText().getBytes(StandardCharsets.UTF_8));
            fileStorageService.writeOutput(baseName + ".json", objectMapper.writeValueAsBytes(result));
        } catch (Exception e) {
            log.warn("导出识别结果失败: {}, 原因: {}", baseName, e.getMessage());
        }
        return result;
    }
}
