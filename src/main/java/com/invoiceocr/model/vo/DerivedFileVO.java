package com.invoiceocr.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 派生文件下载 VO
 *
 * @author invoice-ocr
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DerivedFileVO {

    private String filename;

    private String contentType;

    private byte[] data;
}
