package com.invoiceocr.service;

import com.invoiceocr.model.dto.OcrPipelineInput;
import com.invoiceocr.model.entity.OcrTaskDO;

/**
 * 任务调度策略
 *
 * @author invoice-ocr
 */
public interface OcrTaskDispatcher {

    /**
     * 提交任务，立即返回
     */
    void submit(OcrTaskDO task, OcrPipelineInput input);

    /**
     * 读取路径上同步外部执行结果
     */
    void reconcile(OcrTaskDO task);
}
