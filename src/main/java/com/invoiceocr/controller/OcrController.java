package com.invoiceocr.controller;

import cn.dev33.satoken.stp.StpUtil;
import cn.hutool.core.util.BooleanUtil;
import com.invoiceocr.model.enums.OcrTaskStatus;
import com.invoiceocr.model.vo.ApiResponse;
import com.invoiceocr.model.vo.OcrResultVO;
import com.invoiceocr.model.vo.OcrSubmitVO;
import com.invoiceocr.model.vo.OcrTaskStatusVO;
import com.invoiceocr.service.OcrTaskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDateTime;

/**
 * OCR 任务控制器
 *
 * @author invoice-ocr
 * @since 2026-10-12
 */
@Slf4j
@Tag(name = "OCR 任务", description = "上传文件、查询状态与识别结果")
@RestController
@RequestMapping("/api/v1/ocr")
@RequiredArgsConstructor
public class OcrController {

    private final OcrTaskService ocrTaskService;

    /**
     * 上传文件并创建识别任务，立即返回 202
     */
    @Operation(summary = "提交识别任务", description = "支持 PNG、JPG、PDF、BMP、TIFF、WEBP，最大 50MB")
    @PostMapping("/process")
    public ResponseEntity<ApiResponse<OcrSubmitVO>> process(
            @Parameter(description = "待识别文件") @RequestPart(value = "file", required = false) MultipartFile file,
            @Parameter(description = "识别语言") @RequestParam(value = "language", defaultValue = "en") String language,
            @Parameter(description = "是否使用 GPU") @RequestParam(value = "use_gpu", defaultValue = "false") String useGpu) {
        String userId = StpUtil.getLoginIdAsString();
        OcrSubmitVO submitted = ocrTaskService.submit(file, language, BooleanUtil.toBoolean(useGpu), userId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.ok(submitted, submitted.getMessage()));
    }

    @Operation(summary = "查询任务状态")
    @GetMapping("/status/{taskId}")
    public ApiResponse<OcrTaskStatusVO> status(@Parameter(description = "任务ID") @PathVariable String taskId) {
        return ApiResponse.ok(ocrTaskService.getStatus(taskId, StpUtil.getLoginIdAsString()));
    }

    /**
     * 已完成返回 200；处理中返回 202；失败返回 500 并带上错误信息
     */
    @Operation(summary = "获取识别结果")
    @GetMapping("/result/{taskId}")
    public ResponseEntity<ApiResponse<OcrResultVO>> result(@Parameter(description = "任务ID") @PathVariable String taskId) {
        OcrResultVO result = ocrTaskService.getResult(taskId, StpUtil.getLoginIdAsString());
        OcrTaskStatus status = OcrTaskStatus.fromValue(result.getStatus()).orElse(OcrTaskStatus.PROCESSING);
        return switch (status) {
            case COMPLETED -> ResponseEntity.ok(ApiResponse.ok(result));
            case FAILED -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.<OcrResultVO>builder()
                    .success(false)
                    .message("OCR processing failed: " + result.getErrorMessage())
                    .errorCode("PROCESSING_FAILED")
                    .data(result)
                    .timestamp(LocalDateTime.now())
                    .build());
            default -> ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.ok(result, "Task is still processing"));
        };
    }
}
