package com.invoiceocr.service;

import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.model.entity.OcrTaskDO;
import com.invoiceocr.model.enums.OcrTaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * OCR 任务状态存储
 *
 * <p>状态、错误信息与结果作为一个整体原子写入；终态写入以 processing 为前提做比较交换，
 * 重复写入相同终态和内容为空操作，其余写入终态任务的请求抛出
 * {@link com.invoiceocr.exception.IllegalTaskStateException}。</p>
 *
 * @author invoice-ocr
 */
public interface OcrTaskStore {

    /**
     * 创建任务，生成ID并置为 processing
     *
     * @return 任务ID
     */
    String create(OcrTaskDO task);

    Optional<OcrTaskDO> get(String taskId);

    Optional<OcrResultDO> getResult(String taskId);

    /**
     * 写入状态（目标只能是 completed 或 failed）
     *
     * @return 是否实际写入；重复写入相同终态时返回 false
     */
    boolean updateStatus(String taskId, OcrTaskStatus status, String errorMessage);

    /**
     * 同时写入结果与 completed 状态
     *
     * @return 是否实际写入
     */
    boolean setResult(String taskId, OcrResultDO result);

    void setExternalJobId(String taskId, String jobId);

    /**
     * 删除任务元数据与结果
     *
     * @return 任务是否存在
     */
    boolean delete(String taskId);

    /**
     * 查询用户的任务，按创建时间倒序
     *
     * @param status 为空表示不过滤
     */
    List<OcrTaskDO> list(String userId, OcrTaskStatus status);
}
