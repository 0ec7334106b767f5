package com.invoiceocr.service;

import com.invoiceocr.model.dto.OcrJobMessage;
import com.invoiceocr.model.dto.OcrJobState;

/**
 * 外部任务队列
 *
 * @author invoice-ocr
 */
public interface OcrJobQueue {

    /**
     * 投递任务
     *
     * @return 队列任务ID
     */
    String submit(OcrJobMessage message);

    /**
     * 查询任务执行情况，未知ID视为 pending
     */
    OcrJobState poll(String jobId);
}
