package com.invoiceocr.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceocr.config.RedisConfig;
import com.invoiceocr.core.OcrResultAggregator;
import com.invoiceocr.exception.IllegalTaskStateException;
import com.invoiceocr.exception.TaskNotFoundException;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.model.enums.OcrTaskStatus;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 在真实 Redis 上执行任务终态迁移脚本
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisOcrTaskStoreScriptTest {

    @Container
    static final GenericContainer<?> REDIS = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
        .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    private RedisOcrTaskStore store;
    private String taskId;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
            new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        redisTemplate.execute((RedisCallback<Object>) connection -> {
            connection.serverCommands().flushDb();
            return null;
        });
        store = new RedisOcrTaskStore(redisTemplate, new RedisConfig().ocrTaskTransitionScript(), new ObjectMapper());
        taskId = store.create(OcrTaskDO.builder()
            .userId("alice")
            .filename("inv_1_abcdef12.pdf")
            .language("en")
            .useGpu(false)
            .build());
    }

    @Test
    void setResult_shouldTreatIdenticalRewriteAsNoop() {
        assertTrue(store.setResult(taskId, OcrResultAggregator.aggregate(List.of("a", "b"))));

        assertFalse(store.setResult(taskId, OcrResultAggregator.aggregate(List.of("a", "b"))));
        assertEquals("a\nb", store.getResult(taskId).orElseThrow().getAllText());
        assertEquals(OcrTaskStatus.COMPLETED, store.get(taskId).orElseThrow().getStatus());
    }

    @Test
    void setResult_shouldRejectDifferentPayloadOnCompletedTask() {
        store.setResult(taskId, OcrResultAggregator.aggregate(List.of("a")));

        assertThrows(IllegalTaskStateException.class,
            () -> store.setResult(taskId, OcrResultAggregator.aggregate(List.of("other"))));
        assertEquals("a", store.getResult(taskId).orElseThrow().getAllText());
    }

    @Test
    void updateStatus_shouldRejectOppositeTerminalStatus() {
        store.setResult(taskId, OcrResultAggregator.aggregate(List.of("a")));

        assertThrows(IllegalTaskStateException.class,
            () -> store.updateStatus(taskId, OcrTaskStatus.FAILED, "late failure"));

        OcrTaskDO task = store.get(taskId).orElseThrow();
        assertEquals(OcrTaskStatus.COMPLETED, task.getStatus());
        assertNull(task.getErrorMessage());
    }

    @Test
    void setResult_shouldRejectFailedTask() {
        store.updateStatus(taskId, OcrTaskStatus.FAILED, "engine down");

        assertThrows(IllegalTaskStateException.class,
            () -> store.setResult(taskId, OcrResultAggregator.aggregate(List.of("a"))));
        assertTrue(store.getResult(taskId).isEmpty());
    }

    @Test
    void updateStatus_shouldTreatIdenticalFailureAsNoopAndRejectDifferentError() {
        assertTrue(store.updateStatus(taskId, OcrTaskStatus.FAILED, "engine down"));

        assertFalse(store.updateStatus(taskId, OcrTaskStatus.FAILED, "engine down"));
        assertThrows(IllegalTaskStateException.class,
            () -> store.updateStatus(taskId, OcrTaskStatus.FAILED, "another error"));
        assertEquals("engine down", store.get(taskId).orElseThrow().getErrorMessage());
    }

    @Test
    void updateStatus_shouldClearStaleResultWhenFailing() {
        redisTemplate.opsForValue().set("ocr:task:" + taskId + ":result", "{\"allText\":\"stale\"}");

        store.updateStatus(taskId, OcrTaskStatus.FAILED, "engine down");

        assertFalse(Boolean.TRUE.equals(redisTemplate.hasKey("ocr:task:" + taskId + ":result")));
        OcrTaskDO task = store.get(taskId).orElseThrow();
        assertEquals(OcrTaskStatus.FAILED, task.getStatus());
        assertEquals("engine down", task.getErrorMessage());
        assertTrue(task.getEndTime() != null);
    }

    @Test
    void transitions_shouldReportMissingTask() {
        assertThrows(TaskNotFoundException.class,
            () -> store.updateStatus("missing", OcrTaskStatus.FAILED, "engine down"));
        assertThrows(TaskNotFoundException.class,
            () -> store.setResult("missing", OcrResultAggregator.aggregate(List.of("a"))));
        assertFalse(Boolean.TRUE.equals(redisTemplate.hasKey("ocr:task:missing")));
    }

    @Test
    void delete_shouldRemoveMetadataResultAndIndex() {
        store.setResult(taskId, OcrResultAggregator.aggregate(List.of("a")));

        assertTrue(store.delete(taskId));

        assertTrue(store.get(taskId).isEmpty());
        assertTrue(store.getResult(taskId).isEmpty());
        assertTrue(store.list("alice", null).isEmpty());
        assertThrows(TaskNotFoundException.class,
            () -> store.setResult(taskId, OcrResultAggregator.aggregate(List.of("a"))));
    }
}
