package com.invoiceocr.service;

import java.nio.file.Path;
import java.util.List;

/**
 * 文档转页面图片
 *
 * @author invoice-ocr
 */
public interface DocumentConverter {

    /**
     * 转换为有序的页面图片
     *
     * @param source    上传文件
     * @param extension 声明的扩展名（小写，不含点）
     * @return 页面图片路径；不支持的类型返回空列表
     */
    List<Path> convert(Path source, String extension);
}
