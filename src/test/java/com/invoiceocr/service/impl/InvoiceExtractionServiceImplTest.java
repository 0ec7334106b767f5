package com.invoiceocr.service.impl;

import com.invoiceocr.core.OcrResultAggregator;
import com.invoiceocr.core.OcrTaskAccessGuard;
import com.invoiceocr.exception.InvoiceExtractionException;
import com.invoiceocr.exception.TaskAccessDeniedException;
import com.invoiceocr.exception.TaskNotCompletedException;
import com.invoiceocr.model.dto.InvoiceExtractRequest;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.model.enums.OcrTaskStatus;
import com.invoiceocr.model.vo.InvoiceExtractVO;
import com.invoiceocr.model.vo.InvoiceFieldsVO;
import com.invoiceocr.service.InvoiceFieldExtractor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import top.continew.starter.core.exception.BusinessException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InvoiceExtractionServiceImplTest {

    @Mock
    private InvoiceFieldExtractor extractor;

    private InMemoryOcrTaskStore store;
    private InvoiceExtractionServiceImpl service;

    @BeforeEach
    void setUp() {
        store = new InMemoryOcrTaskStore();
        service = new InvoiceExtractionServiceImpl(new OcrTaskAccessGuard(store), store, extractor);
    }

    @Test
    void extract_shouldReturnOneEntryPerPageEvenWhenOnePageFails() {
        String taskId = completedTask(List.of("page one", "page two", "page three"));
        when(extractor.extract("page one")).thenReturn(InvoiceFieldsVO.builder().invoiceNumber("INV-1").build());
        when(extractor.extract("page two")).thenThrow(new InvoiceExtractionException("Read timed out"));
        when(extractor.extract("page three")).thenReturn(InvoiceFieldsVO.builder().totalAmount("99.00").build());

        InvoiceExtractVO extracted = service.extract(request(taskId, null), "alice");

        assertEquals(3, extracted.getTotalPages());
        List<InvoiceFieldsVO> pages = extracted.getInvoiceData();
        assertEquals(List.of(1, 2, 3), pages.stream().map(InvoiceFieldsVO::getPageNumber).toList());
        assertEquals("INV-1", pages.get(0).getInvoiceNumber());
        assertNull(pages.get(0).getError());
        assertEquals("Read timed out", pages.get(1).getError());
        assertEquals("", pages.get(1).getInvoiceNumber());
        assertEquals("99.00", pages.get(2).getTotalAmount());
    }

    @Test
    void extract_shouldExtractOnlyRequestedPage() {
        String taskId = completedTask(List.of("page one", "page two"));
        when(extractor.extract("page two")).thenReturn(InvoiceFieldsVO.builder().vendorName("ACME").build());

        InvoiceExtractVO extracted = service.extract(request(taskId, 2), "alice");

        assertEquals(1, extracted.getInvoiceData().size());
        assertEquals(2, extracted.getInvoiceData().get(0).getPageNumber());
        assertEquals("ACME", extracted.getInvoiceData().get(0).getVendorName());
        assertEquals(2, extracted.getTotalPages());
    }

    @Test
    void extract_shouldRejectPageOutOfRange() {
        String taskId = completedTask(List.of("only page"));

        BusinessException e = assertThrows(BusinessException.class,
            () -> service.extract(request(taskId, 2), "alice"));

        assertEquals("Page number out of range", e.getMessage());
        verifyNoInteractions(extractor);
    }

    @Test
    void extract_shouldRefuseProcessingTaskWithoutCallingBackend() {
        String taskId = store.create(OcrTaskDO.builder().userId("alice").filename("a.pdf").language("en").build());

        TaskNotCompletedException e = assertThrows(TaskNotCompletedException.class,
            () -> service.extract(request(taskId, null), "alice"));

        assertEquals("Task not completed yet", e.getMessage());
        verifyNoInteractions(extractor);
    }

    @Test
    void extract_shouldNotChangeTaskStatus() {
        String taskId = completedTask(List.of("p"));
        when(extractor.extract("p")).thenThrow(new InvoiceExtractionException("Extraction backend credentials are not configured"));

        service.extract(request(taskId, null), "alice");

        assertEquals(OcrTaskStatus.COMPLETED, store.get(taskId).orElseThrow().getStatus());
    }

    @Test
    void extract_shouldEnforceOwnership() {
        String taskId = completedTask(List.of("p"));

        assertThrows(TaskAccessDeniedException.class, () -> service.extract(request(taskId, null), "bob"));
        verifyNoInteractions(extractor);
    }

    private String completedTask(List<String> pages) {
        String taskId = store.create(OcrTaskDO.builder().userId("alice").filename("a.pdf").language("en").build());
        store.setResult(taskId, OcrResultAggregator.aggregate(pages));
        return taskId;
    }

    private static InvoiceExtractRequest request(String taskId, Integer pageNumber) {
        InvoiceExtractRequest request = new InvoiceExtractRequest();
        request.setTaskId(taskId);
        request.setPageNumber(pageNumber);
        return request;
    }
}
