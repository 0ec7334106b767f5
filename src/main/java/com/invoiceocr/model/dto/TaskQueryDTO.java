package com.invoiceocr.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

/**
 * 任务列表查询参数
 *
 * @author invoice-ocr
 */
@Data
@Schema(description = "任务列表查询参数")
public class TaskQueryDTO {

    @Schema(description = "页码", example = "1")
    private Integer page = 1;

    @Schema(description = "每页数量", example = "20")
    private Integer perPage;

    @Schema(description = "状态过滤: processing / completed / failed")
    private String status;
}
