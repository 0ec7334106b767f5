package com.invoiceocr.service.impl;

import com.invoiceocr.core.OcrPipeline;
import com.invoiceocr.model.dto.OcrPipelineInput;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.service.FileStorageService;
import com.invoiceocr.service.OcrTaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * 进程内调度：每个任务一个线程，依次执行转换、识别、汇总
 *
 * @author invoice-ocr
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "ocr.dispatch", name = "mode", havingValue = "inline", matchIfMissing = true)
public class InlineOcrTaskDispatcher extends AbstractOcrTaskDispatcher {

    private final OcrPipeline ocrPipeline;
    private final TaskExecutor taskExecutor;

    public InlineOcrTaskDispatcher(OcrTaskStore ocrTaskStore,
                                   FileStorageService fileStorageService,
                                   OcrPipeline ocrPipeline,
                                   @Qualifier("ocrPipelineExecutor") TaskExecutor taskExecutor) {
        super(ocrTaskStore, fileStorageService);
        this.ocrPipeline = ocrPipeline;
        this.taskExecutor = taskExecutor;
    }

    @Override
    public void submit(OcrTaskDO task, OcrPipelineInput input) {
        taskExecutor.execute(() -> process(input));
        log.info("任务已提交到本地执行: taskId={}", task.getId());
    }

    @Override
    public void reconcile(OcrTaskDO task) {
        // 本地执行由工作线程自行写入终态
    }

    private void process(OcrPipelineInput input) {
        String taskId = input.getTaskId();
        log.info("开始处理任务: taskId={}, filename={}, language={}", taskId, input.getFilename(), input.getLanguage());
        OcrResultDO result;
        try {
            result = ocrPipeline.run(input);
        } catch (Exception e) {
            log.error("任务处理异常: taskId={}", taskId, e);
            failTask(taskId, input.getFilename(), errorMessageOf(e));
            return;
        }
        completeTask(taskId, input.getFilename(), result);
    }
}
