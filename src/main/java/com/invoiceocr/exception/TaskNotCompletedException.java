package com.invoiceocr.exception;

import org.springframework.http.HttpStatus;

/**
 * 任务尚未完成，无法抽取
 *
 * @author invoice-ocr
 */
public class TaskNotCompletedException extends ApiException {

    public TaskNotCompletedException() {
        super(HttpStatus.BAD_REQUEST, "TASK_NOT_COMPLETED", "Task not completed yet");
    }
}
