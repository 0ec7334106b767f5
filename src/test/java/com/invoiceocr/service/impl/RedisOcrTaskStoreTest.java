package com.invoiceocr.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceocr.core.OcrResultAggregator;
import com.invoiceocr.exception.IllegalTaskStateException;
import com.invoiceocr.exception.TaskNotFoundException;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.model.enums.OcrTaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisOcrTaskStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private HashOperations<String, Object, Object> hashOperations;
    @Mock
    private SetOperations<String, String> setOperations;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DefaultRedisScript<Long> script = new DefaultRedisScript<>("return 1", Long.class);

    private RedisOcrTaskStore store;

    @BeforeEach
    void setUp() {
        store = new RedisOcrTaskStore(redisTemplate, script, objectMapper);
    }

    @Test
    @SuppressWarnings("unchecked")
    void create_shouldWriteHashAndOwnerIndex() {
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        when(redisTemplate.opsForSet()).thenReturn(setOperations);

        OcrTaskDO task = OcrTaskDO.builder().userId("alice").filename("a.png").language("en").useGpu(true).build();
        String taskId = store.create(task);

        ArgumentCaptor<Map<String, String>> fields = ArgumentCaptor.forClass(Map.class);
        verify(hashOperations).putAll(eq("ocr:task:" + taskId), fields.capture());
        verify(setOperations).add("ocr:owner:alice:tasks", taskId);
        assertEquals("processing", fields.getValue().get("status"));
        assertEquals("alice", fields.getValue().get("user_id"));
        assertEquals("true", fields.getValue().get("use_gpu"));
        assertEquals(OcrTaskStatus.PROCESSING, task.getStatus());
    }

    @Test
    void get_shouldMapHashFields() {
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        when(hashOperations.entries("ocr:task:t1")).thenReturn(hash("t1", "alice", "failed", "2026-10-12T10:00:00"));

        OcrTaskDO task = store.get("t1").orElseThrow();

        assertEquals("alice", task.getUserId());
        assertEquals(OcrTaskStatus.FAILED, task.getStatus());
        assertEquals("boom", task.getErrorMessage());
        assertEquals("2026-10-12T10:05", task.getEndTime().toString());
    }

    @Test
    void get_shouldBeEmptyForMissingHash() {
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        when(hashOperations.entries("ocr:task:nope")).thenReturn(Map.of());

        assertTrue(store.get("nope").isEmpty());
    }

    @Test
    void setResult_shouldRunTransitionScriptWithSerializedResult() throws Exception {
        OcrResultDO result = OcrResultAggregator.aggregate(List.of("p1"));
        when(redisTemplate.execute(eq(script), anyList(), any(), any(), any())).thenReturn(1L);

        assertTrue(store.setResult("t1", result));

        verify(redisTemplate).execute(eq(script), eq(List.of("ocr:task:t1", "ocr:task:t1:result")),
            eq("completed"), eq(objectMapper.writeValueAsString(result)), anyString());
    }

    @Test
    void updateStatus_shouldMapScriptReplies() {
        when(redisTemplate.execute(eq(script), anyList(), any(), any(), any())).thenReturn(0L, -1L);

        assertFalse(store.updateStatus("t1", OcrTaskStatus.FAILED, "boom"));
        assertThrows(TaskNotFoundException.class, () -> store.updateStatus("t1", OcrTaskStatus.FAILED, "boom"));
    }

    @Test
    void updateStatus_shouldRejectIllegalTransition() {
        when(redisTemplate.execute(eq(script), anyList(), any(), any(), any())).thenReturn(-2L);
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        when(hashOperations.entries("ocr:task:t1")).thenReturn(hash("t1", "alice", "completed", "2026-10-12T10:00:00"));

        assertThrows(IllegalTaskStateException.class,
            () -> store.updateStatus("t1", OcrTaskStatus.FAILED, "late"));
    }

    @Test
    void updateStatus_shouldNotTouchRedisForInvalidTarget() {
        assertThrows(IllegalTaskStateException.class,
            () -> store.updateStatus("t1", OcrTaskStatus.COMPLETED, null));
        verify(redisTemplate, never()).execute(eq(script), anyList(), any(), any(), any());
    }

    @Test
    void getResult_shouldDeserializeBlob() throws Exception {
        OcrResultDO result = OcrResultAggregator.aggregate(List.of("a", "b"));
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("ocr:task:t1:result")).thenReturn(objectMapper.writeValueAsString(result));

        Optional<OcrResultDO> loaded = store.getResult("t1");

        assertEquals(result, loaded.orElseThrow());
    }

    @Test
    void delete_shouldRemoveBothKeysAndIndexEntry() {
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(hashOperations.get("ocr:task:t1", "user_id")).thenReturn("alice");
        when(redisTemplate.delete(List.of("ocr:task:t1", "ocr:task:t1:result"))).thenReturn(2L);

        assertTrue(store.delete("t1"));

        verify(setOperations).remove("ocr:owner:alice:tasks", "t1");
    }

    @Test
    void list_shouldFilterSortAndDropStaleIndexEntries() {
        when(redisTemplate.opsForHash()).thenReturn(hashOperations);
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("ocr:owner:alice:tasks"))
            .thenReturn(new LinkedHashSet<>(List.of("old", "new", "gone")));
        when(hashOperations.entries("ocr:task:old")).thenReturn(hash("old", "alice", "completed", "2026-10-12T09:00:00"));
        when(hashOperations.entries("ocr:task:new")).thenReturn(hash("new", "alice", "completed", "2026-10-12T11:00:00"));
        when(hashOperations.entries("ocr:task:gone")).thenReturn(Map.of());

        List<OcrTaskDO> tasks = store.list("alice", OcrTaskStatus.COMPLETED);

        assertEquals(List.of("new", "old"), tasks.stream().map(OcrTaskDO::getId).toList());
        verify(setOperations).remove("ocr:owner:alice:tasks", "gone");
    }

    private static Map<Object, Object> hash(String id, String userId, String status, String createdAt) {
        Map<Object, Object> hash = new HashMap<>();
        hash.put("task_id", id);
        hash.put("user_id", userId);
        hash.put("status", status);
        hash.put("filename", id + ".png");
        hash.put("language", "en");
        hash.put("use_gpu", "false");
        hash.put("created_at", createdAt);
        if ("failed".equals(status)) {
            hash.put("error", "boom");
            hash.put("failed_at", "2026-10-12T10:05:00");
        }
        if ("completed".equals(status)) {
            hash.put("completed_at", "2026-10-12T10:05:00");
        }
        return hash;
    }
}
