package com.invoiceocr.service.impl;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.BooleanUtil;
import cn.hutool.core.util.StrUtil;
import com.invoiceocr.config.OcrProperties;
import com.invoiceocr.core.OcrTaskAccessGuard;
import com.invoiceocr.exception.NotFoundException;
import com.invoiceocr.exception.UnsupportedMediaException;
import com.invoiceocr.model.dto.OcrPipelineInput;
import com.invoiceocr.model.dto.TaskQueryDTO;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.model.enums.OcrTaskStatus;
import com.invoiceocr.model.vo.DerivedFileVO;
import com.invoiceocr.model.vo.OcrResultVO;
import com.invoiceocr.model.vo.OcrSubmitVO;
import com.invoiceocr.model.vo.OcrTaskStatusVO;
import com.invoiceocr.model.vo.OcrTaskVO;
import com.invoiceocr.model.vo.PageResultVO;
import com.invoiceocr.service.FileStorageService;
import com.invoiceocr.service.OcrTaskDispatcher;
import com.invoiceocr.service.OcrTaskService;
import com.invoiceocr.service.OcrTaskStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import top.continew.starter.core.exception.BusinessException;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * OCR 任务服务实现
 *
 * @author invoice-ocr
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OcrTaskServiceImpl implements OcrTaskService {

    private static final String DEFAULT_LANGUAGE = "en";

    private final OcrTaskStore ocrTaskStore;
    private final OcrTaskDispatcher ocrTaskDispatcher;
    private final OcrTaskAccessGuard accessGuard;
    private final FileStorageService fileStorageService;
    private final OcrProperties ocrProperties;

    @Override
    public OcrSubmitVO submit(MultipartFile file, String language, Boolean useGpu, String userId) {
        // 1. 校验上传（全部通过前不创建任务）
        if (file == null) {
            throw new BusinessException("No file provided");
        }
        if (StrUtil.isBlank(file.getOriginalFilename())) {
            throw new BusinessException("No file selected");
        }
        String lang = StrUtil.blankToDefault(language, DEFAULT_LANGUAGE).trim();
        if (!ocrProperties.getLanguages().contains(lang)) {
            throw new BusinessException("Unsupported language. Allowed: "
                + String.join(", ", ocrProperties.getLanguages()));
        }
        OcrProperties.Storage storage = ocrProperties.getStorage();
        String extension = FileUtil.extName(file.getOriginalFilename()).toLowerCase(Locale.ROOT);
        if (!storage.getAllowedExtensions().contains(extension)) {
            throw UnsupportedMediaException.invalidType(storage.getAllowedExtensions());
        }
        if (file.getSize() > storage.getMaxFileSize().toBytes()) {
            throw UnsupportedMediaException.tooLarge(storage.getMaxFileSize().toMegabytes());
        }

        // 2. 保存文件并创建任务
        String filename = fileStorageService.storeUpload(file);
        OcrTaskDO task = OcrTaskDO.builder()
            .userId(userId)
            .filename(filename)
            .language(lang)
            .useGpu(BooleanUtil.isTrue(useGpu))
            .build();
        String taskId = ocrTaskStore.create(task);

        // 3. 调度；调度本身失败则立即置为 failed
        OcrPipelineInput input = OcrPipelineInput.builder()
            .taskId(taskId)
            .filename(filename)
            .extension(extension)
            .language(lang)
            .useGpu(BooleanUtil.isTrue(useGpu))
            .build();
        try {
            ocrTaskDispatcher.submit(task, input);
        } catch (Exception e) {
            log.error("任务调度失败: taskId={}", taskId, e);
            ocrTaskStore.updateStatus(taskId, OcrTaskStatus.FAILED, "Failed to start processing: " + e.getMessage());
        }

        log.info("OCR任务已受理: taskId={}, userId={}, filename={}, language={}", taskId, userId, filename, lang);
        return OcrSubmitVO.builder()
            .taskId(taskId)
            .status(OcrTaskStatus.PROCESSING.getValue())
            .message("File uploaded successfully. Processing started.")
            .taskStatusUrl("/api/v1/ocr/status/" + taskId)
            .build();
    }

    @Override
    public OcrTaskStatusVO getStatus(String taskId, String userId) {
        OcrTaskDO task = reconciled(accessGuard.checkAccess(taskId, userId));
        return OcrTaskStatusVO.builder()
            .taskId(task.getId())
            .status(task.getStatus().getValue())
            .createTime(task.getCreateTime())
            .endTime(task.getEndTime())
            .errorMessage(task.getErrorMessage())
            .build();
    }

    @Override
    public OcrResultVO getResult(String taskId, String userId) {
        OcrTaskDO task = reconciled(accessGuard.checkAccess(taskId, userId));
        OcrResultVO.OcrResultVOBuilder builder = OcrResultVO.builder()
            .taskId(task.getId())
            .status(task.getStatus().getValue());
        switch (task.getStatus()) {
            case COMPLETED -> {
                OcrResultDO result = ocrTaskStore.getResult(taskId)
                    .orElseThrow(() -> new NotFoundException("RESULTS_NOT_FOUND", "Results not found"));
                builder.results(result);
            }
            case FAILED -> builder.errorMessage(task.getErrorMessage());
            default -> {
                // 处理中，无结果
            }
        }
        return builder.build();
    }

    @Override
    public PageResultVO<OcrTaskVO> listTasks(String userId, TaskQueryDTO query) {
        OcrProperties.Pagination pagination = ocrProperties.getPagination();
        int page = query.getPage() == null || query.getPage() < 1 ? 1 : query.getPage();
        int perPage = query.getPerPage() == null || query.getPerPage() < 1
            ? pagination.getDefaultPageSize()
            : Math.min(query.getPerPage(), pagination.getMaxPageSize());

        OcrTaskStatus status = null;
        if (StrUtil.isNotBlank(query.getStatus())) {
            status = OcrTaskStatus.fromValue(query.getStatus().trim())
                .orElseThrow(() -> new BusinessException("Status must be one of: processing, completed, failed"));
        }

        List<OcrTaskDO> tasks = ocrTaskStore.list(userId, status);
        int total = tasks.size();
        int pages = total == 0 ? 0 : (total + perPage - 1) / perPage;
        int from = Math.min((page - 1) * perPage, total);
        int to = Math.min(from + perPage, total);

        List<OcrTaskVO> items = tasks.subList(from, to).stream()
            .map(task -> OcrTaskVO.builder()
                .taskId(task.getId())
                .status(task.getStatus().getValue())
                .filename(task.getFilename())
                .language(task.getLanguage())
                .createTime(task.getCreateTime())
                .build())
            .toList();

        return PageResultVO.<OcrTaskVO>builder()
            .items(items)
            .page(page)
            .perPage(perPage)
            .total(total)
            .pages(pages)
            .hasNext(page < pages)
            .hasPrev(page > 1)
            .build();
    }

    @Override
    public void deleteTask(String taskId, String userId) {
        OcrTaskDO task = accessGuard.checkAccess(taskId, userId);
        ocrTaskStore.delete(taskId);
        fileStorageService.deleteTaskFiles(task.getFilename());
        log.info("任务已删除: taskId={}, userId={}", taskId, userId);
    }

    @Override
    public DerivedFileVO getDerivedFile(String taskId, String filename, String userId) {
        OcrTaskDO task = accessGuard.checkAccess(taskId, userId);
        String baseName = FileUtil.mainName(task.getFilename());
        Pattern derived = Pattern.compile(Pattern.quote(baseName) + "(\\.txt|\\.json|\\.png|_page_\\d+\\.png)");
        if (filename == null || !derived.matcher(filename).matches()) {
            throw new NotFoundException("FILE_NOT_FOUND", "File not found");
        }
        return DerivedFileVO.builder()
            .filename(filename)
            .contentType(contentTypeOf(filename))
            .data(fileStorageService.readOutput(filename))
            .build();
    }

    private OcrTaskDO reconciled(OcrTaskDO task) {
        if (task.getStatus().isTerminal()) {
            return task;
        }
        ocrTaskDispatcher.reconcile(task);
        return accessGuard.checkAccess(task.getId(), task.getUserId());
    }

    private static String contentTypeOf(String filename) {
        String extension = FileUtil.extName(filename);
        return switch (extension) {
            case "txt" -> "text/plain;charset=UTF-8";
            case "json" -> MediaType.APPLICATION_JSON_VALUE;
            case "png" -> MediaType.IMAGE_PNG_VALUE;
            default -> MediaType.APPLICATION_OCTET_STREAM_VALUE;
        };
    }
}
