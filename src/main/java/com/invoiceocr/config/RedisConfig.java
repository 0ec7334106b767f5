package com.invoiceocr.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.DefaultRedisScript;

/**
 * Redis 相关配置
 *
 * <p>StringRedisTemplate 由 Spring Boot 自动配置，这里只提供任务终态迁移脚本。</p>
 *
 * @author invoice-ocr
 */
@Configuration
public class RedisConfig {

    /**
     * 任务终态迁移 Lua 脚本，保证状态、错误信息与结果整体写入
     */
    @Bean
    public DefaultRedisScript<Long> ocrTaskTransitionScript() {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource("lua/ocr_task_transition.lua"));
        script.setResultType(Long.class);
        return script;
    }
}
