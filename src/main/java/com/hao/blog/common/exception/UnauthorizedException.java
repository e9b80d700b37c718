package com.hao.blog.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 凭证错误或令牌缺失、无效、过期，对应 HTTP 401
 */
public class UnauthorizedException extends BlogException {

    public UnauthorizedException(String message) {
        super(HttpStatus.UNAUTHORIZED, message);
    }
}
