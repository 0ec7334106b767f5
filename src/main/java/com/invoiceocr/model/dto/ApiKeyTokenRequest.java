package com.invoiceocr.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * API Key 换取令牌请求
 *
 * @author invoice-ocr
 */
@Data
@Schema(description = "API Key 换取令牌请求")
public class ApiKeyTokenRequest {

    @NotBlank(message = "API key is required")
    @Size(min = 8, max = 100, message = "API key must be between 8 and 100 characters")
    @Schema(description = "API Key")
    private String apiKey;
}
