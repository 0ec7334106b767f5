package com.invoiceocr.controller;

import cn.dev33.satoken.stp.StpUtil;
import com.invoiceocr.exception.GlobalExceptionHandler;
import com.invoiceocr.exception.TaskAccessDeniedException;
import com.invoiceocr.exception.TaskNotFoundException;
import com.invoiceocr.exception.UnsupportedMediaException;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.model.vo.OcrResultVO;
import com.invoiceocr.model.vo.OcrSubmitVO;
import com.invoiceocr.service.OcrTaskService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.MockedStatic;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class OcrControllerTest {

    @Mock
    private OcrTaskService ocrTaskService;

    private MockedStatic<StpUtil> stpUtil;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        stpUtil = mockStatic(StpUtil.class);
        stpUtil.when(StpUtil::getLoginIdAsString).thenReturn("alice");
        mockMvc = MockMvcBuilders.standaloneSetup(new OcrController(ocrTaskService))
            .setControllerAdvice(new GlobalExceptionHandler())
            .build();
    }

    @AfterEach
    void tearDown() {
        stpUtil.close();
    }

    @Test
    void process_shouldAcceptUploadWith202() throws Exception {
        OcrSubmitVO submitted = OcrSubmitVO.builder()
            .taskId("t1")
            .status("processing")
            .message("File uploaded successfully. Processing started.")
            .taskStatusUrl("/api/v1/ocr/status/t1")
            .build();
        when(ocrTaskService.submit(any(), eq("ch"), eq(true), eq("alice"))).thenReturn(submitted);

        mockMvc.perform(multipart("/api/v1/ocr/process")
                .file(new MockMultipartFile("file", "invoice.pdf", "application/pdf", new byte[]{1}))
                .param("language", "ch")
                .param("use_gpu", "true"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.taskId").value("t1"))
            .andExpect(jsonPath("$.data.taskStatusUrl").value("/api/v1/ocr/status/t1"));
    }

    @Test
    void process_shouldMapUnsupportedTypeTo400() throws Exception {
        when(ocrTaskService.submit(any(), eq("en"), eq(false), eq("alice")))
            .thenThrow(UnsupportedMediaException.invalidType(List.of("png", "pdf")));

        mockMvc.perform(multipart("/api/v1/ocr/process")
                .file(new MockMultipartFile("file", "notes.txt", "text/plain", new byte[]{1})))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.errorCode").value("INVALID_FILE_TYPE"));
    }

    @Test
    void status_shouldMapMissingAndForeignTasks() throws Exception {
        when(ocrTaskService.getStatus("missing", "alice")).thenThrow(new TaskNotFoundException());
        when(ocrTaskService.getStatus("foreign", "alice")).thenThrow(new TaskAccessDeniedException());

        mockMvc.perform(get("/api/v1/ocr/status/missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("TASK_NOT_FOUND"));
        mockMvc.perform(get("/api/v1/ocr/status/foreign"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.message").value("Access denied"));
    }

    @Test
    void result_shouldUseStatusCodePerTaskState() throws Exception {
        when(ocrTaskService.getResult("done", "alice")).thenReturn(OcrResultVO.builder()
            .taskId("done")
            .status("completed")
            .results(OcrResultDO.builder().detectedTexts(List.of("hello")).allText("hello").pagesProcessed(1).build())
            .build());
        when(ocrTaskService.getResult("busy", "alice")).thenReturn(OcrResultVO.builder()
            .taskId("busy")
            .status("processing")
            .build());
        when(ocrTaskService.getResult("broken", "alice")).thenReturn(OcrResultVO.builder()
            .taskId("broken")
            .status("failed")
            .errorMessage("engine down")
            .build());

        mockMvc.perform(get("/api/v1/ocr/result/done"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.results.allText").value("hello"));
        mockMvc.perform(get("/api/v1/ocr/result/busy"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.message").value("Task is still processing"));
        mockMvc.perform(get("/api/v1/ocr/result/broken"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.errorCode").value("PROCESSING_FAILED"))
            .andExpect(jsonPath("$.message").value("OCR processing failed: engine down"));

        verify(ocrTaskService).getResult("broken", "alice");
    }
}
