package com.invoiceocr.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.invoiceocr.exception.OcrPipelineException;
import com.invoiceocr.model.dto.OcrPipelineInput;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.service.DocumentConverter;
import com.invoiceocr.service.FileStorageService;
import com.invoiceocr.service.TextRecognitionEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OcrPipelineTest {

    private static final String FILENAME = "invoice_1700000000_abcdef12.pdf";

    @Mock
    private DocumentConverter documentConverter;
    @Mock
    private TextRecognitionEngine textRecognitionEngine;
    @Mock
    private FileStorageService fileStorageService;

    private OcrPipeline pipeline;
    private OcrPipelineInput input;

    @BeforeEach
    void setUp() {
        pipeline = new OcrPipeline(documentConverter, textRecognitionEngine, fileStorageService, new ObjectMapper());
        input = OcrPipelineInput.builder()
            .taskId("t1")
            .filename(FILENAME)
            .extension("pdf")
            .language("en")
            .build();
        when(fileStorageService.resolveUpload(FILENAME)).thenReturn(Path.of("uploads", FILENAME));
    }

    @Test
    void run_shouldProduceOnePageTextPerConvertedImage() {
        Path page1 = Path.of("outputs", "invoice_1700000000_abcdef12_page_1.png");
        Path page2 = Path.of("outputs", "invoice_1700000000_abcdef12_page_2.png");
        when(documentConverter.convert(any(), eq("pdf"))).thenReturn(List.of(page1, page2));
        when(textRecognitionEngine.recognizeRegions(page1, "en", false)).thenReturn(List.of("INVOICE", "No. 42"));
        when(textRecognitionEngine.recognizeRegions(page2, "en", false)).thenReturn(List.of());

        OcrResultDO result = pipeline.run(input);

        assertEquals(2, result.getPagesProcessed());
        assertEquals(List.of("INVOICE\nNo. 42", ""), result.getDetectedTexts());
        assertEquals("INVOICE\nNo. 42\n", result.getAllText());
        verify(fileStorageService).writeOutput("invoice_1700000000_abcdef12.txt",
            "INVOICE\nNo. 42\n".getBytes(StandardCharsets.UTF_8));
        verify(fileStorageService).writeOutput(eq("invoice_1700000000_abcdef12.json"), any());
    }

    @Test
    void recognize_shouldFailWhenNothingWasConverted() {
        when(documentConverter.convert(any(), eq("pdf"))).thenReturn(List.of());

        OcrPipelineException e = assertThrows(OcrPipelineException.class, () -> pipeline.recognize(input));

        assertEquals("No pages could be converted from the uploaded file", e.getMessage());
        verify(textRecognitionEngine, never()).recognizeRegions(any(), anyString(), anyBoolean());
    }

    @Test
    void run_shouldNotFailWhenExportFails() {
        Path page = Path.of("outputs", "p.png");
        when(documentConverter.convert(any(), eq("pdf"))).thenReturn(List.of(page));
        when(textRecognitionEngine.recognizeRegions(page, "en", false)).thenReturn(List.of("text"));
        doThrow(new RuntimeException("disk full")).when(fileStorageService).writeOutput(anyString(), any());

        OcrResultDO result = pipeline.run(input);

        assertArrayEquals(new String[]{"text"}, result.getDetectedTexts().toArray());
    }
}
