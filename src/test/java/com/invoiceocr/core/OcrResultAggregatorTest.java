package com.invoiceocr.core;

import com.invoiceocr.model.entity.OcrResultDO;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OcrResultAggregatorTest {

    @Test
    void aggregate_shouldJoinPagesInOrder() {
        OcrResultDO result = OcrResultAggregator.aggregate(List.of("Invoice 001\nTotal 10", "Page two"));

        assertEquals(2, result.getPagesProcessed());
        assertEquals("Invoice 001\nTotal 10\nPage two", result.getAllText());
        assertEquals(List.of("Invoice 001\nTotal 10", "Page two"), result.getDetectedTexts());
    }

    @Test
    void aggregate_shouldKeepEmptyPagesSoPageNumbersLineUp() {
        OcrResultDO result = OcrResultAggregator.aggregate(Arrays.asList("first", null, ""));

        assertEquals(3, result.getPagesProcessed());
        assertEquals(List.of("first", "", ""), result.getDetectedTexts());
        assertEquals("first\n\n", result.getAllText());
    }

    @Test
    void aggregate_shouldHandleNoPages() {
        OcrResultDO result = OcrResultAggregator.aggregate(List.of());

        assertEquals(0, result.getPagesProcessed());
        assertEquals("", result.getAllText());
    }
}
