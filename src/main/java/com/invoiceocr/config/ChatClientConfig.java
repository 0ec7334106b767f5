package com.invoiceocr.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 发票字段抽取 ChatClient 配置
 *
 * @author invoice-ocr
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ChatClientConfig {

    private final OpenAiChatModel openAiChatModel;

    /**
     * 抽取专用 ChatClient，温度固定为 0
     */
    @Bean("invoiceChatClient")
    public ChatClient invoiceChatClient() {
        log.info("初始化发票字段抽取 ChatClient");
        return ChatClient.builder(openAiChatModel)
            .defaultOptions(OpenAiChatOptions.builder()
                .temperature(0.0)
                .build())
            .defaultSystem("You are an information extraction assistant. Always answer with a single JSON object.")
            .build();
    }
}
