package com.invoiceocr.mq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceocr.config.OcrProperties;
import com.invoiceocr.model.dto.OcrJobState;
import com.invoiceocr.model.enums.OcrJobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 队列任务执行结果存储，哈希 ocr:job:{jobId}，按 ocr.dispatch.job-result-ttl 过期（默认 24 小时）
 *
 * @author invoice-ocr
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "ocr.dispatch", name = "mode", havingValue = "queue")
public class RedisOcrJobStateRepository {

    private static final String JOB_KEY_PREFIX = "ocr:job:";

    private static final String F_STATUS = "status";
    private static final String F_PAGE_TEXTS = "page_texts";
    private static final String F_ERROR = "error";

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration jobResultTtl;

    public RedisOcrJobStateRepository(StringRedisTemplate stringRedisTemplate,
                                      ObjectMapper objectMapper,
                                      OcrProperties ocrProperties) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.objectMapper = objectMapper;
        this.jobResultTtl = ocrProperties.getDispatch().getJobResultTtl();
    }

    public void markPending(String jobId) {
        write(jobId, Map.of(F_STATUS, OcrJobStatus.PENDING.getValue()));
    }

    public void markSuccess(String jobId, List<String> pageTexts) {
        String json;
        try {
            json = objectMapper.writeValueAsString(pageTexts);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize page texts for job " + jobId, e);
        }
        write(jobId, Map.of(F_STATUS, OcrJobStatus.SUCCESS.getValue(), F_PAGE_TEXTS, json));
    }

    public void markFailure(String jobId, String error) {
        write(jobId, Map.of(F_STATUS, OcrJobStatus.FAILURE.getValue(), F_ERROR, error));
    }

    /**
     * 读取执行结果，未知任务视为 pending
     */
    public OcrJobState find(String jobId) {
        Map<Object, Object> entries = stringRedisTemplate.opsForHash().entries(JOB_KEY_PREFIX + jobId);
        if (entries.isEmpty()) {
            return OcrJobState.pending();
        }
        OcrJobStatus status = OcrJobStatus.fromValue((String) entries.get(F_STATUS));
        OcrJobState.OcrJobStateBuilder builder = OcrJobState.builder().status(status);
        if (status == OcrJobStatus.SUCCESS) {
            try {
                builder.pageTexts(objectMapper.readValue((String) entries.get(F_PAGE_TEXTS),
                    new TypeReference<List<String>>() {}));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Corrupted page texts for job " + jobId, e);
            }
        } else if (status == OcrJobStatus.FAILURE) {
            builder.error((String) entries.get(F_ERROR));
        }
        return builder.build();
    }

    private void write(String jobId, Map<String, String> fields) {
        String key = JOB_KEY_PREFIX + jobId;
        stringRedisTemplate.opsForHash().putAll(key, fields);
        stringRedisTemplate.expire(key, jobResultTtl);
        log.debug("更新队列任务状态: jobId={}, status={}", jobId, fields.get(F_STATUS));
    }
}
