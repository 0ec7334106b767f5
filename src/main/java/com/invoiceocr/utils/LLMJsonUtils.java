package com.invoiceocr.utils;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * LLM JSON 响应清洗工具类
 * 专门处理模型返回的非标准 JSON 格式
 *
 * @author invoice-ocr
 */
@Slf4j
public class LLMJsonUtils {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    // Markdown 代码块模式
    private static final Pattern CODE_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*([\\s\\S]*?)```");

    private LLMJsonUtils() {
    }

    /**
     * 解析 JSON 对象，失败时依次尝试：去除代码块标记、截取第一个完整的 {...}；
     * 全部失败返回空 Map，不抛异常
     *
     * @param rawResponse 模型原始响应
     * @return 解析结果，可能为空
     */
    public static Map<String, Object> parseObjectOrEmpty(String rawResponse) {
        if (rawResponse == null || rawResponse.isBlank()) {
            return Map.of();
        }
        String cleaned = rawResponse.trim();
        Map<String, Object> parsed = tryParse(cleaned);
        if (parsed != null) {
            return parsed;
        }

        // 1. 移除 Markdown 代码块标记
        Matcher codeMatcher = CODE_BLOCK_PATTERN.matcher(cleaned);
        if (codeMatcher.find()) {
            cleaned = codeMatcher.group(1).trim();
            parsed = tryParse(cleaned);
            if (parsed != null) {
                return parsed;
            }
        }

        // 2. 截取第一个括号配平的对象
        String candidate = extractFirstBalancedObject(cleaned);
        if (candidate != null) {
            parsed = tryParse(candidate);
            if (parsed != null) {
                return parsed;
            }
        }
        log.warn("无法从模型响应中解析 JSON 对象, 按空结果处理");
        return Map.of();
    }

    /**
     * 截取第一个括号配平的 JSON 对象，忽略字符串内的括号
     *
     * @return 对象文本；找不到时返回 null
     */
    public static String extractFirstBalancedObject(String text) {
        if (text == null) {
            return null;
        }
        int start = text.indexOf('{');
        while (start != -1) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < text.length(); i++) {
                char c = text.charAt(i);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                    continue;
                }
                if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return text.substring(start, i + 1);
                    }
                }
            }
            // 未闭合，从下一个左括号重试
            start = text.indexOf('{', start + 1);
        }
        return null;
    }

    private static Map<String, Object> tryParse(String json) {
        if (!json.startsWith("{")) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, MAP_TYPE);
        } catch (Exception e) {
            log.debug("JSON 解析失败: {}", e.getMessage());
            return null;
        }
    }
}
