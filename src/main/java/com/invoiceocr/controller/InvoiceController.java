package com.invoiceocr.controller;

import cn.dev33.satoken.stp.StpUtil;
import com.invoiceocr.model.dto.InvoiceExtractRequest;
import com.invoiceocr.model.vo.ApiResponse;
import com.invoiceocr.model.vo.InvoiceExtractVO;
import com.invoiceocr.service.InvoiceExtractionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 发票字段抽取控制器
 *
 * @author invoice-ocr
 */
@Tag(name = "发票抽取", description = "从已完成任务的识别文本中抽取发票字段")
@RestController
@RequestMapping("/api/v1/invoice")
@RequiredArgsConstructor
public class InvoiceController {

    private final InvoiceExtractionService invoiceExtractionService;

    @Operation(summary = "抽取发票字段", description = "不指定页码时逐页抽取全部页面，单页失败不影响其他页")
    @PostMapping("/extract")
    public ApiResponse<InvoiceExtractVO> extract(@Valid @RequestBody InvoiceExtractRequest request) {
        InvoiceExtractVO extracted = invoiceExtractionService.extract(request, StpUtil.getLoginIdAsString());
        return ApiResponse.ok(extracted, "Invoice data extracted successfully");
    }
}
