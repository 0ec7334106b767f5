package com.invoiceocr.service.impl;

import cn.dev33.satoken.stp.SaTokenInfo;
import cn.dev33.satoken.stp.StpUtil;
import cn.hutool.core.util.StrUtil;
import com.invoiceocr.config.OcrProperties;
import com.invoiceocr.exception.ApiException;
import com.invoiceocr.model.vo.TokenVO;
import com.invoiceocr.service.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 认证服务实现：API Key 换取 Sa-Token 令牌
 *
 * @author invoice-ocr
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    private final OcrProperties ocrProperties;

    @Override
    public TokenVO issueToken(String apiKey) {
        OcrProperties.Auth auth = ocrProperties.getAuth();
        if (StrUtil.isBlank(auth.getApiKey())) {
            log.error("服务端未配置 API Key, 无法签发令牌");
            throw new ApiException(HttpStatus.INTERNAL_SERVER_ERROR, "API_KEY_NOT_CONFIGURED",
                "Server API key not configured");
        }
        // 常量时间比较
        boolean matches = MessageDigest.isEqual(
            auth.getApiKey().getBytes(StandardCharsets.UTF_8),
            StrUtil.nullToEmpty(apiKey).getBytes(StandardCharsets.UTF_8));
        if (!matches) {
            log.warn("API Key 校验失败");
            throw new ApiException(HttpStatus.UNAUTHORIZED, "INVALID_API_KEY", "Invalid API key");
        }

        StpUtil.login(auth.getPrincipal());
        SaTokenInfo tokenInfo = StpUtil.getTokenInfo();
        log.info("签发访问令牌: principal={}", auth.getPrincipal());
        return TokenVO.builder()
            .accessToken(tokenInfo.getTokenValue())
            .tokenType("bearer")
            .expiresIn(tokenInfo.getTokenTimeout())
            .build();
    }
}
