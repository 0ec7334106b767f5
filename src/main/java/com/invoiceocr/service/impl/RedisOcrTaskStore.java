package com.invoiceocr.service.impl;

import cn.hutool.core.util.BooleanUtil;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceocr.core.OcrTaskStateMachine;
import com.invoiceocr.exception.TaskNotFoundException;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.model.enums.OcrTaskStatus;
import com.invoiceocr.service.OcrTaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 基于 Redis 的任务存储
 *
 * <pre>
 * ocr:task:{id}            哈希，任务元数据
 * ocr:task:{id}:result     字符串，结果 JSON
 * ocr:owner:{owner}:tasks  集合，用户任务索引
 * </pre>
 *
 * @author invoice-ocr
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "ocr.store", name = "type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RedisOcrTaskStore implements OcrTaskStore {

    private static final String TASK_KEY_PREFIX = "ocr:task:";
    private static final String RESULT_KEY_SUFFIX = ":result";
    private static final String OWNER_KEY_PREFIX = "ocr:owner:";
    private static final String OWNER_KEY_SUFFIX = ":tasks";

    private static final String F_TASK_ID = "task_id";
    private static final String F_USER_ID = "user_id";
    private static final String F_STATUS = "status";
    private static final String F_FILENAME = "filename";
    private static final String F_LANGUAGE = "language";
    private static final String F_USE_GPU = "use_gpu";
    private static final String F_CREATED_AT = "created_at";
    private static final String F_ERROR = "error";
    private static final String F_FAILED_AT = "failed_at";
    private static final String F_COMPLETED_AT = "completed_at";
    private static final String F_EXTERNAL_JOB_ID = "external_job_id";

    private static final long APPLIED = 1L;
    private static final long UNCHANGED = 0L;
    private static final long MISSING = -1L;

    private final StringRedisTemplate stringRedisTemplate;
    private final DefaultRedisScript<Long> ocrTaskTransitionScript;
    private final ObjectMapper objectMapper;

    @Override
    public String create(OcrTaskDO task) {
        String taskId = IdUtil.fastSimpleUUID();
        LocalDateTime now = LocalDateTime.now();

        Map<String, String> fields = new HashMap<>();
        fields.put(F_TASK_ID, taskId);
        fields.put(F_USER_ID, task.getUserId());
        fields.put(F_STATUS, OcrTaskStatus.PROCESSING.getValue());
        fields.put(F_FILENAME, task.getFilename());
        fields.put(F_LANGUAGE, task.getLanguage());
        fields.put(F_USE_GPU, String.valueOf(BooleanUtil.isTrue(task.getUseGpu())));
        fields.put(F_CREATED_AT, now.toString());

        stringRedisTemplate.opsForHash().putAll(taskKey(taskId), fields);
        stringRedisTemplate.opsForSet().add(ownerKey(task.getUserId()), taskId);

        task.setId(taskId);
        task.setStatus(OcrTaskStatus.PROCESSING);
        task.setCreateTime(now);
        log.info("创建任务: taskId={}, userId={}, filename={}", taskId, task.getUserId(), task.getFilename());
        return taskId;
    }

    @Override
    public Optional<OcrTaskDO> get(String taskId) {
        Map<Object, Object> entries = stringRedisTemplate.opsForHash().entries(taskKey(taskId));
        return entries.isEmpty() ? Optional.empty() : Optional.of(toTask(entries));
    }

    @Override
    public Optional<OcrResultDO> getResult(String taskId) {
        String json = stringRedisTemplate.opsForValue().get(resultKey(taskId));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, OcrResultDO.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupted result for task " + taskId, e);
        }
    }

    @Override
    public boolean updateStatus(String taskId, OcrTaskStatus status, String errorMessage) {
        // completed 必须经 setResult 携带结果写入
        OcrTaskStateMachine.checkTarget(status, null, errorMessage);
        return transition(taskId, status, errorMessage);
    }

    @Override
    public boolean setResult(String taskId, OcrResultDO result) {
        OcrTaskStateMachine.checkTarget(OcrTaskStatus.COMPLETED, result, null);
        String json;
        try {
            json = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result for task " + taskId, e);
        }
        return transition(taskId, OcrTaskStatus.COMPLETED, json);
    }

    @Override
    public void setExternalJobId(String taskId, String jobId) {
        String key = taskKey(taskId);
        if (!Boolean.TRUE.equals(stringRedisTemplate.hasKey(key))) {
            throw new TaskNotFoundException();
        }
        stringRedisTemplate.opsForHash().put(key, F_EXTERNAL_JOB_ID, jobId);
    }

    @Override
    public boolean delete(String taskId) {
        Object userId = stringRedisTemplate.opsForHash().get(taskKey(taskId), F_USER_ID);
        Long removed = stringRedisTemplate.delete(List.of(taskKey(taskId), resultKey(taskId)));
        if (userId != null) {
            stringRedisTemplate.opsForSet().remove(ownerKey(userId.toString()), taskId);
        }
        boolean existed = userId != null || (removed != null && removed > 0);
        if (existed) {
            log.info("删除任务: taskId={}", taskId);
        }
        return existed;
    }

    @Override
    public List<OcrTaskDO> list(String userId, OcrTaskStatus status) {
        Set<String> taskIds = stringRedisTemplate.opsForSet().members(ownerKey(userId));
        if (taskIds == null || taskIds.isEmpty()) {
            return List.of();
        }
        List<OcrTaskDO> tasks = new ArrayList<>(taskIds.size());
        for (String taskId : taskIds) {
            Map<Object, Object> entries = stringRedisTemplate.opsForHash().entries(taskKey(taskId));
            if (entries.isEmpty()) {
                // 索引中残留的已删除任务
                stringRedisTemplate.opsForSet().remove(ownerKey(userId), taskId);
                continue;
            }
            OcrTaskDO task = toTask(entries);
            if (status == null || task.getStatus() == status) {
                tasks.add(task);
            }
        }
        tasks.sort(Comparator.comparing(OcrTaskDO::getCreateTime,
            Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder())).reversed());
        return tasks;
    }

    private boolean transition(String taskId, OcrTaskStatus target, String payload) {
        Long outcome = stringRedisTemplate.execute(ocrTaskTransitionScript,
            List.of(taskKey(taskId), resultKey(taskId)),
            target.getValue(), payload, LocalDateTime.now().toString());
        if (outcome == null) {
            throw new IllegalStateException("No reply from transition script for task " + taskId);
        }
        if (outcome == APPLIED) {
            log.info("任务状态更新: taskId={}, status={}", taskId, target);
            return true;
        }
        if (outcome == UNCHANGED) {
            log.debug("重复写入相同终态, 忽略: taskId={}, status={}", taskId, target);
            return false;
        }
        if (outcome == MISSING) {
            throw new TaskNotFoundException();
        }
        OcrTaskStatus current = get(taskId).map(OcrTaskDO::getStatus).orElse(null);
        throw OcrTaskStateMachine.rejected(taskId, current, target);
    }

    private OcrTaskDO toTask(Map<Object, Object> entries) {
        String completedAt = str(entries, F_COMPLETED_AT);
        String failedAt = str(entries, F_FAILED_AT);
        String endTime = StrUtil.isNotBlank(completedAt) ? completedAt : failedAt;
        return OcrTaskDO.builder()
            .id(str(entries, F_TASK_ID))
            .userId(str(entries, F_USER_ID))
            .status(OcrTaskStatus.fromValue(str(entries, F_STATUS)).orElse(OcrTaskStatus.PROCESSING))
            .filename(str(entries, F_FILENAME))
            .language(str(entries, F_LANGUAGE))
            .useGpu(BooleanUtil.toBoolean(str(entries, F_USE_GPU)))
            .errorMessage(str(entries, F_ERROR))
            .externalJobId(str(entries, F_EXTERNAL_JOB_ID))
            .createTime(parseTime(str(entries, F_CREATED_AT)))
            .endTime(parseTime(endTime))
            .build();
    }

    private static String str(Map<Object, Object> entries, String field) {
        Object value = entries.get(field);
        return value == null ? null : value.toString();
    }

    private static LocalDateTime parseTime(String value) {
        return StrUtil.isBlank(value) ? null : LocalDateTime.parse(value);
    }

    private static String taskKey(String taskId) {
        return TASK_KEY_PREFIX + taskId;
    }

    private static String resultKey(String taskId) {
        return TASK_KEY_PREFIX + taskId + RESULT_KEY_SUFFIX;
    }

    private static String ownerKey(String userId) {
        return OWNER_KEY_PREFIX + userId + OWNER_KEY_SUFFIX;
    }
}
