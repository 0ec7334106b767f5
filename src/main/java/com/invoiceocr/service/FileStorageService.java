package com.invoiceocr.service;

import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;

/**
 * 文件存储服务
 *
 * @author invoice-ocr
 */
public interface FileStorageService {

    /**
     * 保存上传文件
     *
     * @return 生成的存储文件名（不含目录）
     */
    String storeUpload(MultipartFile file);

    Path resolveUpload(String filename);

    Path resolveOutput(String filename);

    /**
     * 写入派生文件到输出目录
     */
    void writeOutput(String filename, byte[] data);

    /**
     * 读取派生文件
     */
    byte[] readOutput(String filename);

    /**
     * 删除上传文件及其全部派生文件
     */
    void deleteTaskFiles(String filename);
}
