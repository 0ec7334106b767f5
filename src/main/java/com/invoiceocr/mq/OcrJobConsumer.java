package com.invoiceocr.mq;

import cn.hutool.core.util.BooleanUtil;
import com.invoiceocr.config.RabbitMQConfig;
import com.invoiceocr.core.OcrPipeline;
import com.invoiceocr.model.dto.OcrJobMessage;
import com.invoiceocr.model.dto.OcrPipelineInput;
import com.invoiceocr.service.FileStorageService;
import com.invoiceocr.service.OcrTaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * OCR 任务消费者
 * 流程: 转换 → 逐页识别 → 记录执行结果（任务终态由读取路径同步）
 * 执行结束时任务已被删除，则清理本次写出的页面图片
 *
 * @author invoice-ocr
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "ocr.dispatch", name = "mode", havingValue = "queue")
@RequiredArgsConstructor
public class OcrJobConsumer {

    private final OcrPipeline ocrPipeline;
    private final RedisOcrJobStateRepository jobStateRepository;
    private final OcrTaskStore ocrTaskStore;
    private final FileStorageService fileStorageService;

    @RabbitListener(queues = RabbitMQConfig.OCR_TASK_QUEUE)
    public void process(OcrJobMessage message) {
        log.info("收到OCR任务消息: jobId={}, taskId={}", message.getJobId(), message.getTaskId());
        OcrPipelineInput input = OcrPipelineInput.builder()
            .taskId(message.getTaskId())
            .filename(message.getFilename())
            .extension(message.getExtension())
            .language(message.getLanguage())
            .useGpu(BooleanUtil.isTrue(message.getUseGpu()))
            .build();
        List<String> pageTexts;
        try {
            pageTexts = ocrPipeline.recognize(input);
        } catch (Exception e) {
            log.error("OCR任务执行失败: jobId={}, taskId={}", message.getJobId(), message.getTaskId(), e);
            String error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            jobStateRepository.markFailure(message.getJobId(), error);
            discardIfDeleted(message);
            return;
        }
        jobStateRepository.markSuccess(message.getJobId(), pageTexts);
        log.info("OCR任务执行完成: jobId={}, pages={}", message.getJobId(), pageTexts.size());
        discardIfDeleted(message);
    }

    private void discardIfDeleted(OcrJobMessage message) {
        if (ocrTaskStore.get(message.getTaskId()).isEmpty()) {
            log.warn("任务在执行期间已被删除, 清理文件: taskId={}", message.getTaskId());
            fileStorageService.deleteTaskFiles(message.getFilename());
        }
    }
}
