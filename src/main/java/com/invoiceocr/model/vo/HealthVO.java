package com.invoiceocr.model.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 健康检查 VO
 *
 * @author invoice-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "健康检查")
public class HealthVO {

    @Schema(description = "服务状态")
    private String status;

    @Schema(description = "版本")
    private String version;

    @Schema(description = "运行时长(秒)")
    private Long uptime;

    @Schema(description = "依赖服务状态")
    private Map<String, String> services;
}
