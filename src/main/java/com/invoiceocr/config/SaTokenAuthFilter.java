package com.invoiceocr.config;

import cn.hutool.core.util.StrUtil;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Collections;
import java.util.Enumeration;

/**
 * 去除 Authorization 头的 "Bearer " 前缀，交给 Sa-Token 校验
 *
 * @author invoice-ocr
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class SaTokenAuthFilter implements Filter {

    private static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BEARER_PREFIX = "Bearer ";

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String authHeader = httpRequest.getHeader(AUTHORIZATION_HEADER);
        if (StrUtil.isBlank(authHeader) || !StrUtil.startWithIgnoreCase(authHeader, BEARER_PREFIX)) {
            chain.doFilter(request, response);
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        chain.doFilter(new HttpServletRequestWrapper(httpRequest) {
            @Override
            public String getHeader(String name) {
                return AUTHORIZATION_HEADER.equalsIgnoreCase(name) ? token : super.getHeader(name);
            }

            @Override
            public Enumeration<String> getHeaders(String name) {
                if (AUTHORIZATION_HEADER.equalsIgnoreCase(name)) {
                    return Collections.enumeration(Collections.singletonList(token));
                }
                return super.getHeaders(name);
            }
        }, response);
    }
}
