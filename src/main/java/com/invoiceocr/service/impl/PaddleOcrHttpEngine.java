package com.invoiceocr.service.impl;

import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceocr.config.OcrProperties;
import com.invoiceocr.exception.OcrPipelineException;
import com.invoiceocr.service.TextRecognitionEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PaddleOCR 风格的 HTTP 识别服务客户端
 *
 * <p>请求为 multipart：file、lang、use_gpu 以及可选的本地模型目录；
 * 响应为 {"regions":[{"text":"..."}]}。</p>
 *
 * @author invoice-ocr
 */
@Slf4j
@Service
public class PaddleOcrHttpEngine implements TextRecognitionEngine {

    private final RestTemplate restTemplate;
    private final OcrProperties.Engine engine;
    private final Map<String, String> modelDirs;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public PaddleOcrHttpEngine(@Qualifier("ocrEngineRestTemplate") RestTemplate restTemplate,
                               OcrProperties ocrProperties) {
        this.restTemplate = restTemplate;
        this.engine = ocrProperties.getEngine();
        this.modelDirs = validateModelDirs(engine);
    }

    @Override
    public List<String> recognizeRegions(Path image, String language, boolean useGpu) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new FileSystemResource(image));
        body.add("lang", language);
        body.add("use_gpu", String.valueOf(useGpu));
        modelDirs.forEach(body::add);
        if (modelDirs.containsKey("cls_model_dir")) {
            body.add("use_angle_cls", "true");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(engine.getUrl(), new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException e) {
            throw new OcrPipelineException("OCR engine call failed: " + e.getMessage(), e);
        }
        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new OcrPipelineException("OCR engine call failed: " + response.getStatusCode());
        }
        List<String> regions = parseRegions(response.getBody());
        log.debug("页面识别完成: image={}, regions={}", image.getFileName(), regions.size());
        return regions;
    }

    private List<String> parseRegions(String json) {
        if (StrUtil.isBlank(json)) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new OcrPipelineException("Malformed OCR engine response", e);
        }
        List<String> regions = new ArrayList<>();
        for (JsonNode region : root.path("regions")) {
            String text = region.path("text").asText("");
            if (StrUtil.isNotEmpty(text)) {
                regions.add(text);
            }
        }
        return regions;
    }

    /**
     * 启动时校验模型配置：已配置的目录必须存在；禁止下载且未启用本地模型时必须至少配置一个本地目录
     */
    static Map<String, String> validateModelDirs(OcrProperties.Engine engine) {
        Map<String, String> configured = new LinkedHashMap<>();
        putIfConfigured(configured, "det_model_dir", engine.getDetModelDir());
        putIfConfigured(configured, "rec_model_dir", engine.getRecModelDir());
        putIfConfigured(configured, "cls_model_dir", engine.getClsModelDir());

        configured.forEach((name, dir) -> {
            if (!Files.isDirectory(Paths.get(dir))) {
                throw new IllegalStateException("Configured OCR model directory does not exist: " + name + "=" + dir);
            }
        });
        if (engine.isUseLocalModels() || !configured.isEmpty()) {
            // 开启本地模型但未配置目录时，由识别服务使用其默认模型
            log.info("使用本地 OCR 模型: {}", configured.isEmpty() ? "默认模型" : configured);
            return configured;
        }
        if (engine.isDisableDownload()) {
            throw new IllegalStateException(
                "Model download is disabled but no local OCR model directory is configured");
        }
        return configured;
    }

    private static void putIfConfigured(Map<String, String> target, String name, String dir) {
        if (StrUtil.isNotBlank(dir)) {
            target.put(name, dir);
        }
    }
}
