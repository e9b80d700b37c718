package com.hao.blog.config;

import com.hao.blog.auth.HmacTokenService;
import com.hao.blog.auth.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.Duration;

/**
 * 认证组件配置类
 *
 * 类职责：
 * 装配密码摘要器与令牌服务。
 *
 * 为什么需要该类：
 * 密钥、有效期等参数来自配置文件，集中在此处构建 Bean，业务代码只依赖接口。
 */
@Slf4j
@Configuration
public class AuthConfig {

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * 令牌服务
     *
     * @param secret 签名密钥
     * @param ttl 有效期，0 表示不过期
     * @return HMAC 令牌服务
     */
    @Bean
    public TokenService tokenService(@Value("${blog.token.secret}") String secret,
                                     @Value("${blog.token.ttl:15m}") Duration ttl) {
        log.info("加载令牌配置|Loaded_token_config,ttl={}", ttl);
        return new HmacTokenService(secret, ttl, Clock.systemUTC());
    }
}
