package com.invoiceocr.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 分页结果 VO
 *
 * @author invoice-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "分页结果")
public class PageResultVO<T> {

    @Schema(description = "当前页数据")
    private List<T> items;

    @Schema(description = "页码")
    private int page;

    @Schema(description = "每页数量")
    private int perPage;

    @Schema(description = "总数")
    private long total;

    @Schema(description = "总页数")
    private int pages;

    @Schema(description = "是否有下一页")
    private boolean hasNext;

    @Schema(description = "是否有上一页")
    private boolean hasPrev;
}
