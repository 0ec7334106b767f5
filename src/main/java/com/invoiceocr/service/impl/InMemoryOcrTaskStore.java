package com.invoiceocr.service.impl;

import cn.hutool.core.util.IdUtil;
import com.invoiceocr.core.OcrTaskStateMachine;
import com.invoiceocr.core.OcrTaskStateMachine.TransitionOutcome;
import com.invoiceocr.exception.TaskNotFoundException;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.model.enums.OcrTaskStatus;
import com.invoiceocr.service.OcrTaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单进程内存任务存储，每条记录在 compute 内原子修改，对外只返回副本
 *
 * @author invoice-ocr
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "ocr.store", name = "type", havingValue = "memory")
public class InMemoryOcrTaskStore implements OcrTaskStore {

    private final Map<String, TaskRecord> records = new ConcurrentHashMap<>();

    @Override
    public String create(OcrTaskDO task) {
        String taskId = IdUtil.fastSimpleUUID();
        task.setId(taskId);
        task.setStatus(OcrTaskStatus.PROCESSING);
        task.setCreateTime(LocalDateTime.now());
        records.put(taskId, new TaskRecord(task.toBuilder().build(), null));
        log.info("创建任务: taskId={}, userId={}, filename={}", taskId, task.getUserId(), task.getFilename());
        return taskId;
    }

    @Override
    public Optional<OcrTaskDO> get(String taskId) {
        TaskRecord record = records.get(taskId);
        return record == null ? Optional.empty() : Optional.of(record.task.toBuilder().build());
    }

    @Override
    public Optional<OcrResultDO> getResult(String taskId) {
        TaskRecord record = records.get(taskId);
        return record == null || record.result == null ? Optional.empty() : Optional.of(copy(record.result));
    }

    @Override
    public boolean updateStatus(String taskId, OcrTaskStatus status, String errorMessage) {
        OcrTaskStateMachine.checkTarget(status, null, errorMessage);
        return transition(taskId, status, null, errorMessage);
    }

    @Override
    public boolean setResult(String taskId, OcrResultDO result) {
        OcrTaskStateMachine.checkTarget(OcrTaskStatus.COMPLETED, result, null);
        return transition(taskId, OcrTaskStatus.COMPLETED, copy(result), null);
    }

    @Override
    public void setExternalJobId(String taskId, String jobId) {
        TaskRecord updated = records.computeIfPresent(taskId, (id, record) ->
            new TaskRecord(record.task.toBuilder().externalJobId(jobId).build(), record.result));
        if (updated == null) {
            throw new TaskNotFoundException();
        }
    }

    @Override
    public boolean delete(String taskId) {
        boolean existed = records.remove(taskId) != null;
        if (existed) {
            log.info("删除任务: taskId={}", taskId);
        }
        return existed;
    }

    @Override
    public List<OcrTaskDO> list(String userId, OcrTaskStatus status) {
        List<OcrTaskDO> tasks = new ArrayList<>();
        for (TaskRecord record : records.values()) {
            if (Objects.equals(record.task.getUserId(), userId)
                && (status == null || record.task.getStatus() == status)) {
                tasks.add(record.task.toBuilder().build());
            }
        }
        tasks.sort(Comparator.comparing(OcrTaskDO::getCreateTime).reversed());
        return tasks;
    }

    private boolean transition(String taskId, OcrTaskStatus target, OcrResultDO result, String errorMessage) {
        AtomicBoolean applied = new AtomicBoolean(false);
        TaskRecord updated = records.computeIfPresent(taskId, (id, record) -> {
            OcrTaskDO current = record.task;
            boolean samePayload = target == OcrTaskStatus.COMPLETED
                ? Objects.equals(record.result, result)
                : Objects.equals(current.getErrorMessage(), errorMessage);
            TransitionOutcome outcome = OcrTaskStateMachine.evaluate(current.getStatus(), target, samePayload);
            if (outcome == TransitionOutcome.REJECT) {
                throw OcrTaskStateMachine.rejected(taskId, current.getStatus(), target);
            }
            if (outcome == TransitionOutcome.NOOP) {
                return record;
            }
            applied.set(true);
            OcrTaskDO next = current.toBuilder()
                .status(target)
                .errorMessage(errorMessage)
                .endTime(LocalDateTime.now())
                .build();
            return new TaskRecord(next, result);
        });
        if (updated == null) {
            throw new TaskNotFoundException();
        }
        if (applied.get()) {
            log.info("任务状态更新: taskId={}, status={}", taskId, target);
        } else {
            log.debug("重复写入相同终态, 忽略: taskId={}, status={}", taskId, target);
        }
        return applied.get();
    }

    private static OcrResultDO copy(OcrResultDO result) {
        return OcrResultDO.builder()
            .detectedTexts(result.getDetectedTexts() == null ? null : new ArrayList<>(result.getDetectedTexts()))
            .allText(result.getAllText())
            .pagesProcessed(result.getPagesProcessed())
            .build();
    }

    private static final class TaskRecord {
        private final OcrTaskDO task;
        private final OcrResultDO result;

        private TaskRecord(OcrTaskDO task, OcrResultDO result) {
            this.task = task;
            this.result = result;
        }
    }
}
