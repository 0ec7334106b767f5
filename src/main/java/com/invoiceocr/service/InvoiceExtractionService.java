package com.invoiceocr.service;

import com.invoiceocr.model.dto.InvoiceExtractRequest;
import com.invoiceocr.model.vo.InvoiceExtractVO;

/**
 * 发票字段抽取服务
 *
 * @author invoice-ocr
 */
public interface InvoiceExtractionService {

    /**
     * 对已完成任务的识别文本逐页抽取，不修改任务状态
     */
    InvoiceExtractVO extract(InvoiceExtractRequest request, String userId);
}
