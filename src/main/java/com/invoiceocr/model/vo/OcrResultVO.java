package com.invoiceocr.model.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.invoiceocr.model.entity.OcrResultDO;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * OCR 结果 VO
 *
 * @author invoice-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "OCR 结果")
public class OcrResultVO {

    @Schema(description = "任务ID")
    private String taskId;

    @Schema(description = "状态")
    private String status;

    @Schema(description = "识别结果（仅 completed）")
    private OcrResultDO results;

    @Schema(description = "错误信息（仅 failed）")
    private String errorMessage;
}
