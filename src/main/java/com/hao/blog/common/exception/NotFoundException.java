package com.hao.blog.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 目标资源不存在，对应 HTTP 404
 */
public class NotFoundException extends BlogException {

    public NotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, message);
    }
}
