package com.invoiceocr.model.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单页发票字段 VO
 *
 * <p>所有字段缺失时为空字符串；抽取失败的页带 error 标记。</p>
 *
 * @author invoice-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "单页发票字段")
public class InvoiceFieldsVO {

    @Builder.Default
    @Schema(description = "发票号码")
    private String invoiceNumber = "";

    @Builder.Default
    @Schema(description = "开票日期")
    private String invoiceDate = "";

    @Builder.Default
    @Schema(description = "销售方名称")
    private String vendorName = "";

    @Builder.Default
    @Schema(description = "购买方名称")
    private String customerName = "";

    @Builder.Default
    @Schema(description = "价税合计")
    private String totalAmount = "";

    @Builder.Default
    @Schema(description = "税额")
    private String taxAmount = "";

    @Schema(description = "页码（从1开始）")
    private Integer pageNumber;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "抽取失败原因")
    private String error;

    /**
     * 抽取失败页：空字段 + 错误标记
     */
    public static InvoiceFieldsVO failed(int pageNumber, String error) {
        return InvoiceFieldsVO.builder()
            .pageNumber(pageNumber)
            .error(error)
            .build();
    }
}
