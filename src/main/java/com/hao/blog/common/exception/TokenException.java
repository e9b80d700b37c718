package com.hao.blog.common.exception;

/**
 * 令牌校验失败
 *
 * 由 TokenService 抛出，描述签名不符、结构损坏或已过期等具体原因；
 * 认证层捕获后统一转换为 UnauthorizedException，避免向客户端泄露细节。
 */
public class TokenException extends RuntimeException {

    public TokenException(String message) {
        super(message);
    }

    public TokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
