package com.invoiceocr.config;

import cn.dev33.satoken.filter.SaTokenContextFilterForJakartaServlet;
import cn.dev33.satoken.interceptor.SaInterceptor;
import cn.dev33.satoken.router.SaRouter;
import cn.dev33.satoken.stp.StpUtil;
import jakarta.servlet.DispatcherType;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.EnumSet;

/**
 * Sa-Token 配置类
 *
 * @author invoice-ocr
 */
@Configuration
public class SaTokenConfig implements WebMvcConfigurer {

    /**
     * 注册 Sa-Token 拦截器，/api/** 下除健康检查和令牌签发外均需登录
     */
    @Override
    public void addInterceptors(@NonNull InterceptorRegistry registry) {
        registry.addInterceptor(new SaInterceptor(handle -> SaRouter.match("/api/**")
                .notMatch(
                    "/api/v1/health",
                    "/api/v1/auth/token"
                )
                .check(r -> StpUtil.checkLogin())))
            .addPathPatterns("/**")
            .excludePathPatterns(
                // 错误处理
                "/error",
                // 接口文档相关资源
                "/favicon.ico",
                "/swagger-ui.html",
                "/swagger-ui/**",
                "/v3/api-docs/**"
            );
    }

    /**
     * 注册 SaToken 上下文 Filter
     */
    @Bean
    public FilterRegistrationBean<SaTokenContextFilterForJakartaServlet> saTokenContextFilterForJakartaServlet() {
        FilterRegistrationBean<SaTokenContextFilterForJakartaServlet> bean =
            new FilterRegistrationBean<>(new SaTokenContextFilterForJakartaServlet());
        bean.addUrlPatterns("/*");
        bean.setOrder(Ordered.HIGHEST_PRECEDENCE);
        bean.setAsyncSupported(true);
        bean.setDispatcherTypes(EnumSet.of(DispatcherType.ASYNC, DispatcherType.REQUEST));
        return bean;
    }
}
