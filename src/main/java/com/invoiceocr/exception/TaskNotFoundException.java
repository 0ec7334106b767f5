package com.invoiceocr.exception;

/**
 * 任务不存在（存在性检查先于归属检查）
 *
 * @author invoice-ocr
 */
public class TaskNotFoundException extends NotFoundException {

    public TaskNotFoundException() {
        super("TASK_NOT_FOUND", "Task not found");
    }
}
