package com.invoiceocr.controller;

import com.invoiceocr.config.OcrProperties;
import com.invoiceocr.model.vo.ApiResponse;
import com.invoiceocr.model.vo.HealthVO;
import com.invoiceocr.service.InvoiceFieldExtractor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 健康检查
 *
 * @author invoice-ocr
 */
@Slf4j
@Tag(name = "健康检查")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthController {

    private final OcrProperties ocrProperties;
    private final InvoiceFieldExtractor invoiceFieldExtractor;
    private final ObjectProvider<StringRedisTemplate> redisTemplateProvider;

    @Operation(summary = "服务健康检查")
    @GetMapping("/health")
    public ApiResponse<HealthVO> health() {
        Map<String, String> services = new LinkedHashMap<>();
        services.put("store", ocrProperties.getStore().getType());
        if ("redis".equals(ocrProperties.getStore().getType())) {
            services.put("redis", pingRedis());
        }
        services.put("dispatch", ocrProperties.getDispatch().getMode());
        services.put("extraction", invoiceFieldExtractor.isConfigured() ? "configured" : "not_configured");

        HealthVO health = HealthVO.builder()
            .status(services.containsValue("unavailable") ? "degraded" : "healthy")
            .version(ocrProperties.getVersion())
            .uptime(ManagementFactory.getRuntimeMXBean().getUptime() / 1000)
            .services(services)
            .build();
        return ApiResponse.ok(health);
    }

    private String pingRedis() {
        StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
        if (redisTemplate == null) {
            return "unavailable";
        }
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) connection -> connection.ping());
            return "PONG".equalsIgnoreCase(pong) ? "healthy" : "unavailable";
        } catch (Exception e) {
            log.warn("Redis 健康检查失败: {}", e.getMessage());
            return "unavailable";
        }
    }
}
