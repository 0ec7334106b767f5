package com.invoiceocr.controller;

import cn.dev33.satoken.stp.StpUtil;
import com.invoiceocr.model.dto.TaskQueryDTO;
import com.invoiceocr.model.vo.ApiResponse;
import com.invoiceocr.model.vo.DerivedFileVO;
import com.invoiceocr.model.vo.OcrTaskVO;
import com.invoiceocr.model.vo.PageResultVO;
import com.invoiceocr.service.OcrTaskService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * 任务管理控制器：列表、删除、派生文件下载
 *
 * @author invoice-ocr
 */
@Tag(name = "任务管理", description = "任务列表、删除与派生文件下载")
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class TaskController {

    private final OcrTaskService ocrTaskService;

    @Operation(summary = "分页查询任务列表", description = "仅返回当前用户的任务，按创建时间倒序")
    @GetMapping("/tasks")
    public ApiResponse<PageResultVO<OcrTaskVO>> listTasks(TaskQueryDTO query) {
        return ApiResponse.ok(ocrTaskService.listTasks(StpUtil.getLoginIdAsString(), query));
    }

    @Operation(summary = "删除任务", description = "同时删除识别结果、上传文件和派生文件")
    @DeleteMapping("/tasks/{taskId}")
    public ApiResponse<Void> deleteTask(@Parameter(description = "任务ID") @PathVariable String taskId) {
        ocrTaskService.deleteTask(taskId, StpUtil.getLoginIdAsString());
        return ApiResponse.ok(null, "Task deleted successfully");
    }

    @Operation(summary = "下载派生文件", description = "txt / json / 页面图片")
    @GetMapping("/files/{taskId}/download/{filename}")
    public ResponseEntity<ByteArrayResource> download(
            @Parameter(description = "任务ID") @PathVariable String taskId,
            @Parameter(description = "文件名") @PathVariable String filename) {
        DerivedFileVO file = ocrTaskService.getDerivedFile(taskId, filename, StpUtil.getLoginIdAsString());
        String encodedFilename = UriUtils.encode(file.getFilename(), StandardCharsets.UTF_8)
                .replaceAll("\\+", "%20");
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(file.getContentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + encodedFilename + "\"")
                .contentLength(file.getData().length)
                .cacheControl(CacheControl.noCache().mustRevalidate())
                .body(new ByteArrayResource(file.getData()));
    }
}
