package com.hao.blog.common.constants;

/**
 * 认证相关常量定义
 */
public class AuthConstants {

    /** 请求头：Authorization */
    public static final String AUTHORIZATION_HEADER = "Authorization";

    /** Bearer 前缀（含空格） */
    public static final String BEARER_PREFIX = "Bearer ";

    /**
     * 请求属性键：已认证用户名
     * 由认证拦截器写入，控制层可按需读取
     */
    public static final String CURRENT_USER_ATTRIBUTE = "blog.currentUser";

    public static final String MSG_MISSING_CREDENTIALS = "Missing username or password";

    public static final String MSG_USER_EXISTS = "User already exists";

    public static final String MSG_INVALID_CREDENTIALS = "Invalid username or password";

    public static final String MSG_REGISTERED = "User registered successfully";

    public static final String MSG_MISSING_TOKEN = "Missing Authorization Header";

    public static final String MSG_INVALID_TOKEN = "Invalid or expired token";

    private AuthConstants() {}
}
