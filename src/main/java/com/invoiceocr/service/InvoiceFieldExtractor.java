package com.invoiceocr.service;

import com.invoiceocr.model.vo.InvoiceFieldsVO;

/**
 * 单页发票字段抽取
 *
 * @author invoice-ocr
 */
public interface InvoiceFieldExtractor {

    /**
     * 抽取一页文本中的发票字段，无法识别的字段为空字符串
     *
     * @throws com.invoiceocr.exception.InvoiceExtractionException 后端不可用、超时或未配置
     */
    InvoiceFieldsVO extract(String pageText);

    /**
     * 后端是否已配置
     */
    boolean isConfigured();
}
