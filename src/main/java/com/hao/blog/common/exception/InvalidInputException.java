package com.hao.blog.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 请求参数缺失或格式错误，对应 HTTP 400
 */
public class InvalidInputException extends BlogException {

    public InvalidInputException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
