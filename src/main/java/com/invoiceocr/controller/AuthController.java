package com.invoiceocr.controller;

import com.invoiceocr.model.dto.ApiKeyTokenRequest;
import com.invoiceocr.model.vo.ApiResponse;
import com.invoiceocr.model.vo.TokenVO;
import com.invoiceocr.service.AuthService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 认证控制器
 *
 * @author invoice-ocr
 */
@Tag(name = "认证", description = "API Key 换取访问令牌")
@RestController
@RequestMapping("/api/v1/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @Operation(summary = "获取访问令牌")
    @PostMapping("/token")
    public ApiResponse<TokenVO> token(@Valid @RequestBody ApiKeyTokenRequest request) {
        return ApiResponse.ok(authService.issueToken(request.getApiKey()));
    }
}
