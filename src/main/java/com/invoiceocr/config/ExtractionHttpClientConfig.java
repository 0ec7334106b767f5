package com.invoiceocr.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

/**
 * 抽取后端 HTTP 客户端超时配置
 *
 * <p>读取超时即单页抽取的超时时间，超时只影响当前页。</p>
 *
 * @author invoice-ocr
 */
@Slf4j
@Configuration
public class ExtractionHttpClientConfig {

    @Bean
    public RestClientCustomizer extractionRestClientCustomizer(OcrProperties ocrProperties) {
        OcrProperties.Extraction extraction = ocrProperties.getExtraction();
        log.info("配置抽取后端 HTTP 客户端超时: 连接超时={}, 读取超时={}",
            extraction.getConnectTimeout(), extraction.getTimeout());
        return restClientBuilder -> {
            SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
            factory.setConnectTimeout(extraction.getConnectTimeout());
            factory.setReadTimeout(extraction.getTimeout());
            restClientBuilder.requestFactory(factory);
        };
    }
}
