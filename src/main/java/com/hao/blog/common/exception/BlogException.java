package com.hao.blog.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 博客业务异常基类
 *
 * 类职责：
 * 承载业务错误信息与对应的 HTTP 状态码，中断当前请求。
 *
 * 设计目的：
 * 1. 业务层只需抛出语义明确的子类，无需感知 HTTP 细节。
 * 2. 配合 GlobalExceptionHandler 统一输出 {"error": "..."} 结构。
 *
 * 实现思路：
 * - 继承 RuntimeException，属于非受检异常，业务层无需显式捕获。
 * - 子类在构造时固定状态码。
 */
@Getter
public abstract class BlogException extends RuntimeException {

    /** 对应的 HTTP 状态码 */
    private final HttpStatus status;

    protected BlogException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }
}
