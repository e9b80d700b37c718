package com.hao.blog.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

/**
 * 全局异常处理器
 *
 * 类职责：
 * 统一捕获并处理 Controller 层与拦截器抛出的异常，转换为 {"error": "..."} 响应。
 *
 * 设计目的：
 * 1. 屏蔽底层异常细节，防止敏感信息泄露给前端。
 * 2. 统一错误结构，业务错误与框架错误的返回格式保持一致。
 * 3. 集中记录异常日志，便于排查。
 *
 * 实现思路：
 * - 使用 @RestControllerAdvice 拦截所有 Controller 异常。
 * - BlogException 自带状态码，直接映射为响应状态。
 * - 常见框架异常（请求体解析失败、路由不存在、方法不支持）单独映射。
 * - 使用 Exception 作为兜底策略，捕获未预期的运行时异常。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理业务异常
     *
     * 实现逻辑：
     * 1. 捕获 BlogException 及其子类。
     * 2. 记录 WARN 级别日志（业务拒绝属于预期内行为，非系统错误）。
     * 3. 以异常自带的状态码返回。
     *
     * @param e 业务异常
     * @param request 请求上下文
     * @return 标准化错误响应
     */
    @ExceptionHandler(BlogException.class)
    public ResponseEntity<Map<String, Object>> handleBlogException(BlogException e, WebRequest request) {
        // 实现思路：
        // 1. 记录告警日志，保留请求路径与状态码。
        // 2. 使用异常自带的状态码构造响应。
        log.warn("业务请求被拒绝|Request_rejected,path={},status={},message={}",
                getRequestPath(request), e.getStatus().value(), e.getMessage());
        return ResponseEntity.status(e.getStatus()).body(errorBody(e.getMessage()));
    }

    /**
     * 处理请求体无法解析（非法 JSON 等）
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnreadableBody(HttpMessageNotReadableException e, WebRequest request) {
        log.warn("请求体解析失败|Request_body_unreadable,path={},message={}", getRequestPath(request), e.getMessage());
        return errorBody("Malformed JSON request body");
    }

    /**
     * 处理路由不存在（包括非数字的文章ID）
     */
    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(Exception e, WebRequest request) {
        log.warn("路由不存在|Route_not_found,path={}", getRequestPath(request));
        return errorBody("Not found");
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    @ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
    public Map<String, Object> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e, WebRequest request) {
        log.warn("请求方法不支持|Method_not_allowed,path={},method={}", getRequestPath(request), e.getMethod());
        return errorBody("Method not allowed");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    @ResponseStatus(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
    public Map<String, Object> handleMediaType(HttpMediaTypeNotSupportedException e, WebRequest request) {
        log.warn("请求类型不支持|Media_type_not_supported,path={},contentType={}", getRequestPath(request), e.getContentType());
        return errorBody("Content-Type must be application/json");
    }

    /**
     * 处理系统兜底异常
     *
     * 实现逻辑：
     * 1. 捕获所有未被单独处理的 Exception。
     * 2. 记录 ERROR 级别日志，必须包含堆栈信息与请求路径。
     * 3. 返回 HTTP 500，隐藏具体错误细节。
     *
     * @param e 未知异常对象
     * @param request 请求上下文
     * @return 标准化错误响应
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleException(Exception e, WebRequest request) {
        // 实现思路：
        // 1. 必须打印堆栈，否则无法排查线上Bug。
        // 2. 隐藏具体错误细节，防止内部信息暴露。
        log.error("系统未知异常|System_unknown_error,path={},message={}", getRequestPath(request), e.getMessage(), e);
        return errorBody("Internal server error");
    }

    private Map<String, Object> errorBody(String message) {
        Map<String, Object> result = new HashMap<>();
        result.put("error", message);
        return result;
    }

    /**
     * 提取纯净的请求路径
     *
     * WebRequest.getDescription(false) 返回格式通常为 "uri=/path"，去除前缀使日志更整洁。
     *
     * @param request 请求上下文
     * @return 请求URI
     */
    private String getRequestPath(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}
