package com.hao.blog.config;

import com.hao.blog.common.interceptor.AuthInterceptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web 拦截器与跨域配置类
 *
 * 类职责：
 * 统一注册认证拦截器并配置跨域规则。
 *
 * 设计目的：
 * 1. 集中管理拦截器装配，避免分散配置导致的遗漏。
 * 2. 前端页面与接口服务分开部署，需要开放跨域访问。
 *
 * 核心实现思路：
 * - /api/** 全部经过认证拦截器；/register 与 /login 不拦截。
 * - 跨域来源由 blog.cors.allowed-origins 配置。
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private AuthInterceptor authInterceptor;

    @Value("${blog.cors.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(authInterceptor)
                .addPathPatterns("/api/**");
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        for (String pattern : new String[]{"/register", "/login", "/api/**"}) {
            registry.addMapping(pattern)
                    .allowedOriginPatterns(allowedOrigins)
                    .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                    .allowedHeaders("*");
        }
    }
}
