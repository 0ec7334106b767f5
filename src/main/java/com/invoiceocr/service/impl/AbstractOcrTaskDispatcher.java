package com.invoiceocr.service.impl;

import com.invoiceocr.exception.TaskNotFoundException;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.model.enums.OcrTaskStatus;
import com.invoiceocr.service.FileStorageService;
import com.invoiceocr.service.OcrTaskDispatcher;
import com.invoiceocr.service.OcrTaskStore;
import lombok.extern.slf4j.Slf4j;

/**
 * 调度器公共逻辑：写入任务终态
 *
 * <p>终态只写一次，后到的写入走幂等空操作。执行期间任务被删除时，
 * 删除操作之后才写出的页面图片和导出文件由这里清理。</p>
 *
 * @author invoice-ocr
 */
@Slf4j
public abstract class AbstractOcrTaskDispatcher implements OcrTaskDispatcher {

    protected final OcrTaskStore ocrTaskStore;
    protected final FileStorageService fileStorageService;

    protected AbstractOcrTaskDispatcher(OcrTaskStore ocrTaskStore, FileStorageService fileStorageService) {
        this.ocrTaskStore = ocrTaskStore;
        this.fileStorageService = fileStorageService;
    }

    protected void completeTask(String taskId, String filename, OcrResultDO result) {
        try {
            if (ocrTaskStore.setResult(taskId, result)) {
                log.info("任务处理完成: taskId={}, pages={}", taskId, result.getPagesProcessed());
            }
        } catch (TaskNotFoundException e) {
            log.warn("任务在处理期间已被删除, 丢弃结果: taskId={}", taskId);
            fileStorageService.deleteTaskFiles(filename);
        }
    }

    protected void failTask(String taskId, String filename, String errorMessage) {
        try {
            if (ocrTaskStore.updateStatus(taskId, OcrTaskStatus.FAILED, errorMessage)) {
                log.info("任务处理失败: taskId={}, error={}", taskId, errorMessage);
            }
        } catch (TaskNotFoundException e) {
            log.warn("任务在处理期间已被删除, 丢弃错误: taskId={}", taskId);
            fileStorageService.deleteTaskFiles(filename);
        }
    }

    /**
     * 异常转为任务错误信息，保证非空
     */
    protected static String errorMessageOf(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
