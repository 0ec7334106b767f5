package com.invoiceocr.service.impl;

import com.invoiceocr.core.OcrTaskAccessGuard;
import com.invoiceocr.exception.NotFoundException;
import com.invoiceocr.exception.TaskNotCompletedException;
import com.invoiceocr.model.dto.InvoiceExtractRequest;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.model.enums.OcrTaskStatus;
import com.invoiceocr.model.vo.InvoiceExtractVO;
import com.invoiceocr.model.vo.InvoiceFieldsVO;
import com.invoiceocr.service.InvoiceExtractionService;
import com.invoiceocr.service.InvoiceFieldExtractor;
import com.invoiceocr.service.OcrTaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 发票字段抽取服务实现
 *
 * <p>逐页独立抽取，某页失败只在该页标记错误，不影响其他页。</p>
 *
 * @author invoice-ocr
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InvoiceExtractionServiceImpl implements InvoiceExtractionService {

    private final OcrTaskAccessGuard accessGuard;
    private final OcrTaskStore ocrTaskStore;
    private final InvoiceFieldExtractor invoiceFieldExtractor;

    @Override
    public InvoiceExtractVO extract(InvoiceExtractRequest request, String userId) {
        String taskId = request.getTaskId();
        OcrTaskDO task = accessGuard.checkAccess(taskId, userId);
        if (task.getStatus() != OcrTaskStatus.COMPLETED) {
            throw new TaskNotCompletedException();
        }
        OcrResultDO result = ocrTaskStore.getResult(taskId)
            .orElseThrow(() -> new NotFoundException("RESULTS_NOT_FOUND", "Results not found"));
        List<String> pages = result.getDetectedTexts() == null ? List.of() : result.getDetectedTexts();

        List<InvoiceFieldsVO> invoiceData = new ArrayList<>();
        Integer pageNumber = request.getPageNumber();
        if (pageNumber != null) {
            if (pageNumber < 1 || pageNumber > pages.size()) {
                throw new BusinessException("Page number out of range");
            }
            invoiceData.add(extractPage(taskId, pageNumber, pages.get(pageNumber - 1)));
        } else {
            for (int i = 0; i < pages.size(); i++) {
                invoiceData.add(extractPage(taskId, i + 1, pages.get(i)));
            }
        }

        long failed = invoiceData.stream().filter(fields -> fields.getError() != null).count();
        log.info("发票字段抽取完成: taskId={}, pages={}, failed={}", taskId, invoiceData.size(), failed);
        return InvoiceExtractVO.builder()
            .taskId(taskId)
            .invoiceData(invoiceData)
            .totalPages(pages.size())
            .extractionTime(LocalDateTime.now())
            .build();
    }

    private InvoiceFieldsVO extractPage(String taskId, int pageNumber, String pageText) {
        try {
            InvoiceFieldsVO fields = invoiceFieldExtractor.extract(pageText);
            fields.setPageNumber(pageNumber);
            return fields;
        } catch (Exception e) {
            log.warn("页面字段抽取失败: taskId={}, page={}, 原因: {}", taskId, pageNumber, e.getMessage());
            return InvoiceFieldsVO.failed(pageNumber, e.getMessage() == null ? "Extraction failed" : e.getMessage());
        }
    }
}
