package com.invoiceocr.service.impl;

import cn.hutool.core.util.StrUtil;
import com.invoiceocr.config.OcrProperties;
import com.invoiceocr.exception.InvoiceExtractionException;
import com.invoiceocr.model.vo.InvoiceFieldsVO;
import com.invoiceocr.service.InvoiceFieldExtractor;
import com.invoiceocr.utils.LLMJsonUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 基于 ChatClient 的发票字段抽取
 *
 * @author invoice-ocr
 */
@Slf4j
@Service
public class ChatClientInvoiceFieldExtractor implements InvoiceFieldExtractor {

    static final String NOT_CONFIGURED_KEY = "not-configured";

    private static final String PROMPT_TEMPLATE = """
        You are an information extraction assistant. Given OCR text from an invoice page, \
        extract the following fields as concise strings. If missing, return empty string. \
        Fields: Invoice Number, Invoice Date, Vendor Name, Customer Name, Total Amount, Tax Amount.

        OCR Page Text:
        %s

        Return strict JSON with keys: invoice_number, invoice_date, vendor_name, customer_name, total_amount, tax_amount.""";

    private final ChatClient chatClient;
    private final boolean configured;

    public ChatClientInvoiceFieldExtractor(@Qualifier("invoiceChatClient") ChatClient chatClient,
                                           OcrProperties ocrProperties,
                                           @Value("${spring.ai.openai.api-key:}") String apiKey) {
        this.chatClient = chatClient;
        this.configured = ocrProperties.getExtraction().isEnabled()
            && StrUtil.isNotBlank(apiKey)
            && !NOT_CONFIGURED_KEY.equals(apiKey);
        if (!configured) {
            log.warn("发票字段抽取后端未配置, 抽取请求将逐页返回错误");
        }
    }

    @Override
    public InvoiceFieldsVO extract(String pageText) {
        if (!configured) {
            throw new InvoiceExtractionException("Extraction backend credentials are not configured");
        }
        String content;
        try {
            content = chatClient.prompt()
                .user(String.format(PROMPT_TEMPLATE, pageText == null ? "" : pageText))
                .call()
                .content();
        } catch (Exception e) {
            throw new InvoiceExtractionException("Extraction backend call failed: " + e.getMessage(), e);
        }

        Map<String, Object> data = LLMJsonUtils.parseObjectOrEmpty(content);
        return InvoiceFieldsVO.builder()
            .invoiceNumber(field(data, "invoice_number"))
            .invoiceDate(field(data, "invoice_date"))
            .vendorName(field(data, "vendor_name"))
            .customerName(field(data, "customer_name"))
            .totalAmount(field(data, "total_amount"))
            .taxAmount(field(data, "tax_amount"))
            .build();
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    private static String field(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value == null ? "" : value.toString();
    }
}
