package com.invoiceocr.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

/**
 * 本地调度线程配置：每个任务一个新线程，不设上限
 *
 * @author invoice-ocr
 */
@Configuration
public class PipelineExecutorConfig {

    @Bean("ocrPipelineExecutor")
    public TaskExecutor ocrPipelineExecutor() {
        return new SimpleAsyncTaskExecutor("ocr-pipeline-");
    }
}
