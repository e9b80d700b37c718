package com.hao.blog.auth;

import com.hao.blog.common.exception.TokenException;

/**
 * 访问令牌服务
 *
 * 类职责：
 * 签发与校验 Bearer 令牌，令牌主体（subject）即用户名。
 *
 * 设计目的：
 * 签名机制可替换，认证拦截器与业务代码只依赖该接口。
 */
public interface TokenService {

    /**
     * 为指定主体签发新令牌
     *
     * @param subject 用户名
     * @return 令牌字符串
     */
    String issue(String subject);

    /**
     * 校验令牌并解析主体
     *
     * @param token 令牌字符串
     * @return 用户名
     * @throws TokenException 令牌为空、结构损坏、签名不符或已过期
     */
    String verify(String token);
}
