package com.invoiceocr.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * 识别引擎专用 HTTP 客户端配置
 *
 * @author invoice-ocr
 */
@Slf4j
@Configuration
public class OcrEngineHttpClientConfig {

    @Bean("ocrEngineRestTemplate")
    public RestTemplate ocrEngineRestTemplate(OcrProperties ocrProperties) {
        OcrProperties.Engine engine = ocrProperties.getEngine();
        log.info("配置识别引擎 HTTP 客户端: url={}, 连接超时={}, 读取超时={}",
            engine.getUrl(), engine.getConnectTimeout(), engine.getReadTimeout());
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(engine.getConnectTimeout());
        factory.setReadTimeout(engine.getReadTimeout());
        return new RestTemplate(factory);
    }
}
