package com.invoiceocr.service;

import com.invoiceocr.model.vo.TokenVO;

/**
 * 认证服务
 *
 * @author invoice-ocr
 */
public interface AuthService {

    /**
     * API Key 换取访问令牌
     */
    TokenVO issueToken(String apiKey);
}
