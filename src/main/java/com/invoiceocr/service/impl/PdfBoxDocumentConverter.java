package com.invoiceocr.service.impl;

import cn.hutool.core.io.FileUtil;
import com.invoiceocr.exception.OcrPipelineException;
import com.invoiceocr.service.DocumentConverter;
import com.invoiceocr.service.FileStorageService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 文档转换：PDF 按 2 倍缩放逐页渲染，其他图片统一转为 PNG
 *
 * @author invoice-ocr
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PdfBoxDocumentConverter implements DocumentConverter {

    private static final float PDF_RENDER_SCALE = 2.0f;

    private static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "bmp", "tif", "tiff", "webp");

    private final FileStorageService fileStorageService;

    @Override
    public List<Path> convert(Path source, String extension) {
        String ext = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        String baseName = FileUtil.mainName(source.getFileName().toString());
        try {
            if ("png".equals(ext)) {
                return List.of(source);
            }
            if ("pdf".equals(ext)) {
                return renderPdf(source, baseName);
            }
            if (IMAGE_EXTENSIONS.contains(ext)) {
                return List.of(reencode(source, baseName));
            }
        } catch (IOException e) {
            throw new OcrPipelineException("Failed to convert document: " + e.getMessage(), e);
        }
        log.warn("不支持转换的文件类型: filename={}, extension={}", source.getFileName(), ext);
        return List.of();
    }

    private List<Path> renderPdf(Path source, String baseName) throws IOException {
        List<Path> pages = new ArrayList<>();
        try (PDDocument document = Loader.loadPDF(source.toFile())) {
            PDFRenderer renderer = new PDFRenderer(document);
            for (int i = 0; i < document.getNumberOfPages(); i++) {
                BufferedImage image = renderer.renderImage(i, PDF_RENDER_SCALE, ImageType.RGB);
                Path page = fileStorageService.resolveOutput(baseName + "_page_" + (i + 1) + ".png");
                writePng(image, page);
                pages.add(page);
            }
        }
        log.debug("PDF 渲染完成: filename={}, pages={}", source.getFileName(), pages.size());
        return pages;
    }

    private Path reencode(Path source, String baseName) throws IOException {
        BufferedImage image = ImageIO.read(source.toFile());
        if (image == null) {
            throw new OcrPipelineException("Unable to decode image: " + source.getFileName());
        }
        Path target = fileStorageService.resolveOutput(baseName + ".png");
        writePng(image, target);
        return target;
    }

    private static void writePng(BufferedImage image, Path target) throws IOException {
        FileUtil.mkParentDirs(target.toFile());
        if (!ImageIO.write(image, "png", target.toFile())) {
            throw new IOException("No PNG writer available");
        }
    }
}
