package com.hao.blog.common.interceptor;

import com.hao.blog.common.constants.AuthConstants;
import com.hao.blog.service.AuthService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Bearer 令牌认证拦截器
 *
 * 类职责：
 * 在受保护接口执行前校验 Authorization 请求头中的令牌。
 *
 * 设计目的：
 * 1. 认证是横切能力，通过拦截器集中处理，业务代码无需感知。
 * 2. 认证失败直接抛出异常，由 GlobalExceptionHandler 统一返回 401。
 *
 * 核心实现思路：
 * - 解析 "Authorization: Bearer <token>"。
 * - 认证通过后将用户名写入请求属性，供后续处理读取。
 * - CORS 预检请求不携带令牌，直接放行。
 * - 当前只做身份认证，不做基于身份的权限控制。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthInterceptor implements HandlerInterceptor {

    private final AuthService authService;

    /**
     * 拦截请求并校验令牌
     *
     * @param request 请求对象
     * @param response 响应对象
     * @param handler 处理器对象
     * @return 是否放行
     */
    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }
        String username = authService.authenticate(resolveBearerToken(request));
        request.setAttribute(AuthConstants.CURRENT_USER_ATTRIBUTE, username);
        log.debug("请求认证通过|Request_authenticated,username={},uri={}", username, request.getRequestURI());
        return true;
    }

    /**
     * 提取 Bearer 令牌
     *
     * @param request 请求对象
     * @return 令牌；请求头缺失或不是 Bearer 方案时返回 null
     */
    private String resolveBearerToken(HttpServletRequest request) {
        String header = request.getHeader(AuthConstants.AUTHORIZATION_HEADER);
        String prefix = AuthConstants.BEARER_PREFIX;
        if (header == null || !header.regionMatches(true, 0, prefix, 0, prefix.length())) {
            return null;
        }
        return header.substring(prefix.length()).trim();
    }
}
