package com.invoiceocr.service;

import com.invoiceocr.model.dto.TaskQueryDTO;
import com.invoiceocr.model.vo.DerivedFileVO;
import com.invoiceocr.model.vo.OcrResultVO;
import com.invoiceocr.model.vo.OcrSubmitVO;
import com.invoiceocr.model.vo.OcrTaskStatusVO;
import com.invoiceocr.model.vo.OcrTaskVO;
import com.invoiceocr.model.vo.PageResultVO;
import org.springframework.web.multipart.MultipartFile;

/**
 * OCR 任务服务
 *
 * @author invoice-ocr
 */
public interface OcrTaskService {

    /**
     * 校验上传并创建任务，立即返回 processing
     */
    OcrSubmitVO submit(MultipartFile file, String language, Boolean useGpu, String userId);

    OcrTaskStatusVO getStatus(String taskId, String userId);

    OcrResultVO getResult(String taskId, String userId);

    PageResultVO<OcrTaskVO> listTasks(String userId, TaskQueryDTO query);

    void deleteTask(String taskId, String userId);

    /**
     * 下载任务的派生文件
     */
    DerivedFileVO getDerivedFile(String taskId, String filename, String userId);
}
