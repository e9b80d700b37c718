package com.hao.blog.service;

/**
 * 认证服务接口
 *
 * 类职责：
 * 提供用户注册、登录签发令牌与令牌认证能力。
 *
 * 设计目的：
 * 1. 抽象认证能力与实现细节，便于测试与替换实现。
 * 2. 控制层与拦截器只依赖该接口。
 */
public interface AuthService {

    /**
     * 注册新用户
     *
     * 实现逻辑：
     * 1. 校验用户名与密码非空。
     * 2. 生成加盐摘要并写入用户存储，用户名重复则失败。
     *
     * @param username 用户名
     * @param password 明文密码
     */
    void register(String username, String password);

    /**
     * 登录并签发访问令牌
     *
     * @param username 用户名
     * @param password 明文密码
     * @return 访问令牌
     */
    String login(String username, String password);

    /**
     * 认证 Bearer 令牌
     *
     * @param token 令牌（不含 Bearer 前缀），可为空
     * @return 令牌对应的用户名
     */
    String authenticate(String token);
}
