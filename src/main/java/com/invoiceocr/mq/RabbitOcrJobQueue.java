package com.invoiceocr.mq;

import cn.hutool.core.util.IdUtil;
import com.invoiceocr.config.RabbitMQConfig;
import com.invoiceocr.model.dto.OcrJobMessage;
import com.invoiceocr.model.dto.OcrJobState;
import com.invoiceocr.service.OcrJobQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * OCR 任务生产者，执行结果由 {@link RedisOcrJobStateRepository} 记录
 *
 * @author invoice-ocr
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "ocr.dispatch", name = "mode", havingValue = "queue")
@RequiredArgsConstructor
public class RabbitOcrJobQueue implements OcrJobQueue {

    private final RabbitTemplate rabbitTemplate;
    private final RedisOcrJobStateRepository jobStateRepository;

    @Override
    public String submit(OcrJobMessage message) {
        String jobId = IdUtil.fastSimpleUUID();
        message.setJobId(jobId);
        jobStateRepository.markPending(jobId);
        rabbitTemplate.convertAndSend(RabbitMQConfig.OCR_TASK_QUEUE, message);
        log.info("发送OCR任务到队列: jobId={}, taskId={}", jobId, message.getTaskId());
        return jobId;
    }

    @Override
    public OcrJobState poll(String jobId) {
        return jobStateRepository.find(jobId);
    }
}
