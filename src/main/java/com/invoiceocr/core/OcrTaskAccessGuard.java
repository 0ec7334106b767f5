package com.invoiceocr.core;

import com.invoiceocr.exception.TaskAccessDeniedException;
import com.invoiceocr.exception.TaskNotFoundException;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.service.OcrTaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * 任务访问控制：先判断存在性，再判断归属
 *
 * @author invoice-ocr
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OcrTaskAccessGuard {

    private final OcrTaskStore ocrTaskStore;

    /**
     * 校验并返回任务
     *
     * @throws TaskNotFoundException     任务不存在
     * @throws TaskAccessDeniedException 任务不属于该用户
     */
    public OcrTaskDO checkAccess(String taskId, String userId) {
        OcrTaskDO task = ocrTaskStore.get(taskId).orElseThrow(TaskNotFoundException::new);
        if (!Objects.equals(task.getUserId(), userId)) {
            log.warn("用户 {} 尝试访问不属于自己的任务 {}", userId, taskId);
            throw new TaskAccessDeniedException();
        }
        return task;
    }
}
