package com.invoiceocr.config;

import org.springframework.amqp.core.Queue;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 配置类，仅在委托调度模式下启用
 *
 * @author invoice-ocr
 */
@Configuration
@EnableRabbit
@ConditionalOnProperty(prefix = "ocr.dispatch", name = "mode", havingValue = "queue")
public class RabbitMQConfig {

    /**
     * OCR 任务队列
     */
    public static final String OCR_TASK_QUEUE = "ocr.task.processing";

    @Bean
    public Queue ocrTaskQueue() {
        return new Queue(OCR_TASK_QUEUE, true);
    }

    /**
     * 消息转换器 - 使用JSON格式
     */
    @Bean
    public MessageConverter messageConverter() {
        return new Jackson2JsonMessageConverter();
    }
}
