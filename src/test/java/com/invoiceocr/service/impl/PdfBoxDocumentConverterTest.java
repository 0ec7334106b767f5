package com.invoiceocr.service.impl;

import com.invoiceocr.config.OcrProperties;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PdfBoxDocumentConverterTest {

    @TempDir
    Path tempDir;

    private Path uploads;
    private PdfBoxDocumentConverter converter;

    @BeforeEach
    void setUp() throws IOException {
        uploads = Files.createDirectories(tempDir.resolve("uploads"));
        OcrProperties properties = new OcrProperties();
        properties.getStorage().setUploadFolder(uploads.toString());
        properties.getStorage().setOutputFolder(tempDir.resolve("outputs").toString());
        converter = new PdfBoxDocumentConverter(new FileStorageServiceImpl(properties));
    }

    @Test
    void convert_shouldRenderEveryPdfPageInOrder() throws IOException {
        Path pdf = uploads.resolve("invoice_1700000000_abcdef12.pdf");
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            document.addPage(new PDPage());
            document.save(pdf.toFile());
        }

        List<Path> pages = converter.convert(pdf, "pdf");

        assertEquals(2, pages.size());
        assertEquals("invoice_1700000000_abcdef12_page_1.png", pages.get(0).getFileName().toString());
        assertEquals("invoice_1700000000_abcdef12_page_2.png", pages.get(1).getFileName().toString());
        BufferedImage first = ImageIO.read(pages.get(0).toFile());
        assertNotNull(first);
        // 612pt 宽的 Letter 页面按 2 倍渲染
        assertEquals(1224, first.getWidth());
    }

    @Test
    void convert_shouldPassPngThrough() throws IOException {
        Path png = uploads.resolve("scan.png");
        ImageIO.write(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB), "png", png.toFile());

        assertEquals(List.of(png), converter.convert(png, "png"));
    }

    @Test
    void convert_shouldReencodeOtherImagesToPng() throws IOException {
        Path bmp = uploads.resolve("scan_1_abcdef12.bmp");
        ImageIO.write(new BufferedImage(4, 4, BufferedImage.TYPE_INT_RGB), "bmp", bmp.toFile());

        List<Path> pages = converter.convert(bmp, "bmp");

        assertEquals(1, pages.size());
        assertEquals("scan_1_abcdef12.png", pages.get(0).getFileName().toString());
        assertNotNull(ImageIO.read(pages.get(0).toFile()));
    }

    @Test
    void convert_shouldYieldNothingForUnknownType() throws IOException {
        Path txt = Files.writeString(uploads.resolve("notes.txt"), "hello");

        assertTrue(converter.convert(txt, "txt").isEmpty());
    }
}
