package com.invoiceocr.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * 发票字段抽取请求
 *
 * @author invoice-ocr
 */
@Data
@Schema(description = "发票字段抽取请求")
public class InvoiceExtractRequest {

    @NotBlank(message = "Task ID is required")
    @Size(max = 100, message = "Task ID must be at most 100 characters")
    @Schema(description = "OCR 任务ID")
    private String taskId;

    @Min(value = 1, message = "Page number must be positive")
    @Schema(description = "指定页码（为空则抽取全部页）")
    private Integer pageNumber;
}
