package com.invoiceocr.service.impl;

import cn.hutool.core.util.StrUtil;
import com.invoiceocr.config.OcrProperties;
import com.invoiceocr.core.OcrPipeline;
import com.invoiceocr.model.dto.OcrJobMessage;
import com.invoiceocr.model.dto.OcrJobState;
import com.invoiceocr.model.dto.OcrPipelineInput;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.model.enums.OcrTaskStatus;
import com.invoiceocr.service.FileStorageService;
import com.invoiceocr.service.OcrJobQueue;
import com.invoiceocr.service.OcrTaskStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 委托调度：投递到外部队列，由读取路径轮询并同步结果
 *
 * @author invoice-ocr
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "ocr.dispatch", name = "mode", havingValue = "queue")
public class QueueOcrTaskDispatcher extends AbstractOcrTaskDispatcher {

    private final OcrJobQueue ocrJobQueue;
    private final OcrPipeline ocrPipeline;
    private final Duration jobResultTtl;

    public QueueOcrTaskDispatcher(OcrTaskStore ocrTaskStore,
                                  FileStorageService fileStorageService,
                                  OcrJobQueue ocrJobQueue,
                                  OcrPipeline ocrPipeline,
                                  OcrProperties ocrProperties) {
        super(ocrTaskStore, fileStorageService);
        this.ocrJobQueue = ocrJobQueue;
        this.ocrPipeline = ocrPipeline;
        this.jobResultTtl = ocrProperties.getDispatch().getJobResultTtl();
    }

    @Override
    public void submit(OcrTaskDO task, OcrPipelineInput input) {
        OcrJobMessage message = OcrJobMessage.builder()
            .taskId(task.getId())
            .filename(input.getFilename())
            .extension(input.getExtension())
            .language(input.getLanguage())
            .useGpu(input.isUseGpu())
            .build();
        String jobId = ocrJobQueue.submit(message);
        ocrTaskStore.setExternalJobId(task.getId(), jobId);
        log.info("任务已投递到队列: taskId={}, jobId={}", task.getId(), jobId);
    }

    @Override
    public void reconcile(OcrTaskDO task) {
        if (task.getStatus() != OcrTaskStatus.PROCESSING || StrUtil.isBlank(task.getExternalJobId())) {
            return;
        }
        OcrJobState state;
        try {
            state = ocrJobQueue.poll(task.getExternalJobId());
        } catch (Exception e) {
            log.warn("查询队列任务失败, 保持当前状态: taskId={}, jobId={}, 原因: {}",
                task.getId(), task.getExternalJobId(), e.getMessage());
            return;
        }

        switch (state.getStatus()) {
            case SUCCESS -> {
                List<String> pageTexts = state.getPageTexts() == null ? List.of() : state.getPageTexts();
                OcrResultDO result = ocrPipeline.assemble(task.getFilename(), pageTexts);
                completeTask(task.getId(), task.getFilename(), result);
            }
            case FAILURE -> failTask(task.getId(), task.getFilename(),
                StrUtil.blankToDefault(state.getError(), "OCR job failed"));
            default -> {
                if (isExpired(task)) {
                    // 执行记录已过期或消息丢失，不会再有结果
                    log.warn("队列任务超过结果保留时长仍无结果: taskId={}, jobId={}", task.getId(), task.getExternalJobId());
                    failTask(task.getId(), task.getFilename(), "Job result expired");
                } else {
                    log.debug("队列任务仍在执行: taskId={}, jobId={}", task.getId(), task.getExternalJobId());
                }
            }
        }
    }

    private boolean isExpired(OcrTaskDO task) {
        return task.getCreateTime() != null
            && task.getCreateTime().plus(jobResultTtl).isBefore(LocalDateTime.now());
    }
}
