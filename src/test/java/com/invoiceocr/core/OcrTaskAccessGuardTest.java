package com.invoiceocr.core;

import com.invoiceocr.exception.TaskAccessDeniedException;
import com.invoiceocr.exception.TaskNotFoundException;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.service.impl.InMemoryOcrTaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OcrTaskAccessGuardTest {

    private InMemoryOcrTaskStore store;
    private OcrTaskAccessGuard guard;
    private String taskId;

    @BeforeEach
    void setUp() {
        store = new InMemoryOcrTaskStore();
        guard = new OcrTaskAccessGuard(store);
        taskId = store.create(OcrTaskDO.builder().userId("alice").filename("a_1_abcdef12.png").language("en").build());
    }

    @Test
    void checkAccess_shouldReturnTaskForOwner() {
        assertEquals(taskId, guard.checkAccess(taskId, "alice").getId());
    }

    @Test
    void checkAccess_shouldDenyOtherPrincipal() {
        assertThrows(TaskAccessDeniedException.class, () -> guard.checkAccess(taskId, "bob"));
    }

    @Test
    void checkAccess_shouldReportMissingBeforeOwnership() {
        assertThrows(TaskNotFoundException.class, () -> guard.checkAccess("does-not-exist", "bob"));
    }
}
