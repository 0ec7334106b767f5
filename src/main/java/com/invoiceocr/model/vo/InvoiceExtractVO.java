package com.invoiceocr.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 发票字段抽取响应 VO
 *
 * @author invoice-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "发票字段抽取响应")
public class InvoiceExtractVO {

    @Schema(description = "任务ID")
    private String taskId;

    @Schema(description = "逐页抽取结果")
    private List<InvoiceFieldsVO> invoiceData;

    @Schema(description = "任务总页数")
    private Integer totalPages;

    @Schema(description = "抽取完成时间")
    private LocalDateTime extractionTime;
}
