package com.invoiceocr.core;

import cn.hutool.core.util.StrUtil;
import com.invoiceocr.exception.IllegalTaskStateException;
import com.invoiceocr.model.entity.OcrResultDO;
import com.invoiceocr.model.enums.OcrTaskStatus;

/**
 * 任务状态迁移规则
 *
 * <p>processing 只能迁移到 completed 或 failed；终态不可再变，
 * 以相同状态和相同内容重复写入视为幂等的空操作。</p>
 *
 * @author invoice-ocr
 */
public final class OcrTaskStateMachine {

    /**
     * 迁移判定结果
     */
    public enum TransitionOutcome {
        /**
         * 允许迁移并写入
         */
        APPLY,
        /**
         * 重复写入相同终态，不做任何修改
         */
        NOOP,
        /**
         * 非法迁移
         */
        REJECT
    }

    private OcrTaskStateMachine() {
    }

    /**
     * 校验目标状态与其携带内容是否匹配
     *
     * @throws IllegalTaskStateException 目标为 processing，completed 缺少结果，或 failed 缺少错误信息
     */
    public static void checkTarget(OcrTaskStatus target, OcrResultDO result, String errorMessage) {
        if (target == null || target == OcrTaskStatus.PROCESSING) {
            throw new IllegalTaskStateException("Cannot transition a task to status: " + target);
        }
        if (target == OcrTaskStatus.COMPLETED && result == null) {
            throw new IllegalTaskStateException("A completed task requires a result");
        }
        if (target == OcrTaskStatus.FAILED && StrUtil.isBlank(errorMessage)) {
            throw new IllegalTaskStateException("A failed task requires an error message");
        }
    }

    /**
     * 判定从 current 迁移到 target 的结果
     *
     * @param samePayload 终态下写入内容是否与已有内容一致
     */
    public static TransitionOutcome evaluate(OcrTaskStatus current, OcrTaskStatus target, boolean samePayload) {
        if (current == OcrTaskStatus.PROCESSING) {
            return TransitionOutcome.APPLY;
        }
        if (current == target && samePayload) {
            return TransitionOutcome.NOOP;
        }
        return TransitionOutcome.REJECT;
    }

    public static IllegalTaskStateException rejected(String taskId, OcrTaskStatus current, OcrTaskStatus target) {
        return new IllegalTaskStateException(
            "Illegal transition for task " + taskId + ": " + current + " -> " + target);
    }
}
