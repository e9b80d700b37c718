package com.hao.blog.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 资源冲突（如用户名重复）
 *
 * 现有客户端按 400 处理重复注册，因此这里沿用 400 而不是 409。
 */
public class ConflictException extends BlogException {

    public ConflictException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
