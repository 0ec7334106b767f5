package com.invoiceocr.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * OCR 服务配置
 *
 * @author invoice-ocr
 * @since 2026-10-12
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "ocr")
public class OcrProperties {

    /**
     * 服务版本（健康检查展示）
     */
    private String version = "1.0.0";

    /**
     * 支持的识别语言
     */
    private List<String> languages = List.of("en", "ch", "fr", "german", "korean", "japan");

    private Storage storage = new Storage();

    private Dispatch dispatch = new Dispatch();

    private Store store = new Store();

    private Engine engine = new Engine();

    private Extraction extraction = new Extraction();

    private Auth auth = new Auth();

    private Pagination pagination = new Pagination();

    @Data
    public static class Storage {
        /**
         * 上传文件目录
         */
        private String uploadFolder = "./uploads";

        /**
         * 派生文件目录（页面图片、txt、json）
         */
        private String outputFolder = "./outputs";

        /**
         * 单个文件大小上限
         */
        private DataSize maxFileSize = DataSize.ofMegabytes(50);

        /**
         * 允许上传的扩展名（小写，不含点）
         */
        private Set<String> allowedExtensions = new LinkedHashSet<>(
            List.of("png", "jpg", "jpeg", "pdf", "bmp", "tiff", "tif", "webp"));
    }

    @Data
    public static class Dispatch {
        /**
         * inline: 进程内每任务一个线程; queue: 投递 RabbitMQ 由 worker 执行
         */
        private String mode = "inline";

        /**
         * 队列任务执行结果的保留时长，超过后仍未取得结果的任务按失败处理
         */
        private Duration jobResultTtl = Duration.ofHours(24);
    }

    @Data
    public static class Store {
        /**
         * redis: 持久化存储; memory: 单进程内存存储
         */
        private String type = "redis";
    }

    @Data
    public static class Engine {
        /**
         * OCR 识别服务地址
         */
        private String url = "http://localhost:8866/ocr";

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(120);

        /**
         * 是否强制使用本地模型
         */
        private boolean useLocalModels = false;

        private String detModelDir;

        private String recModelDir;

        private String clsModelDir;

        /**
         * 禁止识别引擎远程下载模型
         */
        private boolean disableDownload = false;
    }

    @Data
    public static class Extraction {
        /**
         * 是否启用字段抽取后端
         */
        private boolean enabled = true;

        /**
         * 单页抽取调用超时
         */
        private Duration timeout = Duration.ofSeconds(60);

        private Duration connectTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Auth {
        /**
         * 换取访问令牌的 API Key，为空表示未配置
         */
        private String apiKey = "";

        /**
         * API Key 对应的登录主体
         */
        private String principal = "primary";
    }

    @Data
    public static class Pagination {
        private int defaultPageSize = 20;

        private int maxPageSize = 100;
    }
}
