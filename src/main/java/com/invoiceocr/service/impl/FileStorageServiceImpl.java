package com.invoiceocr.service.impl;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.io.IORuntimeException;
import cn.hutool.core.util.IdUtil;
import cn.hutool.core.util.StrUtil;
import com.invoiceocr.config.OcrProperties;
import com.invoiceocr.exception.NotFoundException;
import com.invoiceocr.service.FileStorageService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import top.continew.starter.core.exception.BusinessException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 文件存储服务实现 - 本地目录
 *
 * @author invoice-ocr
 */
@Slf4j
@Service
public class FileStorageServiceImpl implements FileStorageService {

    private final Path uploadRoot;
    private final Path outputRoot;

    public FileStorageServiceImpl(OcrProperties ocrProperties) {
        this.uploadRoot = Paths.get(ocrProperties.getStorage().getUploadFolder()).toAbsolutePath().normalize();
        this.outputRoot = Paths.get(ocrProperties.getStorage().getOutputFolder()).toAbsolutePath().normalize();
    }

    @Override
    public String storeUpload(MultipartFile file) {
        String originalFilename = file.getOriginalFilename();
        if (StrUtil.isBlank(originalFilename)) {
            throw new BusinessException("No file selected");
        }
        String extension = FileUtil.extName(originalFilename);
        if (StrUtil.isBlank(extension) || !extension.matches("^[a-zA-Z0-9]+$")) {
            throw new BusinessException("无效的文件扩展名");
        }

        // {安全名}_{秒级时间戳}_{8位随机}.{扩展名}
        String filename = safeBaseName(FileUtil.mainName(originalFilename))
            + "_" + Instant.now().getEpochSecond()
            + "_" + IdUtil.fastSimpleUUID().substring(0, 8)
            + "." + extension.toLowerCase();

        try (InputStream in = file.getInputStream()) {
            Files.createDirectories(uploadRoot);
            Files.copy(in, uploadRoot.resolve(filename), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.error("文件上传失败: originalName={}", originalFilename, e);
            throw new IORuntimeException(e);
        }
        log.info("文件上传成功: originalName={}, storedName={}, size={}", originalFilename, filename, file.getSize());
        return filename;
    }

    @Override
    public Path resolveUpload(String filename) {
        return resolveInside(uploadRoot, filename);
    }

    @Override
    public Path resolveOutput(String filename) {
        return resolveInside(outputRoot, filename);
    }

    @Override
    public void writeOutput(String filename, byte[] data) {
        Path target = resolveOutput(filename);
        try {
            Files.createDirectories(outputRoot);
            Files.write(target, data);
        } catch (IOException e) {
            throw new IORuntimeException(e);
        }
        log.debug("派生文件写入成功: filename={}, size={}", filename, data.length);
    }

    @Override
    public byte[] readOutput(String filename) {
        Path filePath = resolveOutput(filename);
        if (!Files.isRegularFile(filePath)) {
            throw new NotFoundException("FILE_NOT_FOUND", "File not found");
        }
        try {
            return Files.readAllBytes(filePath);
        } catch (IOException e) {
            log.error("文件读取失败: filename={}", filename, e);
            throw new IORuntimeException(e);
        }
    }

    @Override
    public void deleteTaskFiles(String filename) {
        String baseName = FileUtil.mainName(filename);
        List<Path> targets = new ArrayList<>();
        targets.add(resolveUpload(filename));
        targets.add(resolveOutput(baseName + ".txt"));
        targets.add(resolveOutput(baseName + ".json"));
        targets.add(resolveOutput(baseName + ".png"));
        if (Files.isDirectory(outputRoot)) {
            try (DirectoryStream<Path> pages = Files.newDirectoryStream(outputRoot, baseName + "_page_*.png")) {
                pages.forEach(targets::add);
            } catch (IOException e) {
                log.warn("遍历页面图片失败: baseName={}, 原因: {}", baseName, e.getMessage());
            }
        }

        for (Path target : targets) {
            try {
                if (Files.deleteIfExists(target)) {
                    log.debug("文件删除成功: {}", target.getFileName());
                }
            } catch (IOException e) {
                log.warn("文件删除失败: {}, 原因: {}", target.getFileName(), e.getMessage());
            }
        }
    }

    /**
     * 防止路径遍历，确保文件位于指定目录内
     */
    private Path resolveInside(Path root, String filename) {
        if (StrUtil.isBlank(filename)) {
            throw new BusinessException("文件名不能为空");
        }
        if (filename.contains("..") || filename.contains("/") || filename.contains("\\")) {
            throw new BusinessException("无效的文件路径");
        }
        Path filePath = root.resolve(filename).normalize();
        if (!filePath.startsWith(root)) {
            throw new BusinessException("文件路径超出允许范围");
        }
        return filePath;
    }

    /**
     * 仅保留字母、数字、点、下划线和连字符
     */
    static String safeBaseName(String name) {
        String safe = StrUtil.blankToDefault(name, "upload")
            .replaceAll("[^A-Za-z0-9._-]", "_")
            .replaceAll("^[._]+", "");
        return StrUtil.isBlank(safe) ? "upload" : safe;
    }
}
