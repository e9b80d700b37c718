package com.hao.blog.service.impl;

import com.google.common.base.Strings;
import com.hao.blog.auth.TokenService;
import com.hao.blog.common.constants.AuthConstants;
import com.hao.blog.common.exception.ConflictException;
import com.hao.blog.common.exception.InvalidInputException;
import com.hao.blog.common.exception.TokenException;
import com.hao.blog.common.exception.UnauthorizedException;
import com.hao.blog.dal.model.UserAccount;
import com.hao.blog.dal.store.UserStore;
import com.hao.blog.service.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * 认证服务实现
 *
 * 类职责：
 * 实现注册、登录与令牌认证。
 *
 * 核心实现思路：
 * - 密码经 PasswordEncoder（BCrypt，自带随机盐）摘要后保存。
 * - 令牌签发与校验委托给 TokenService。
 * - 用户不存在与密码错误返回同一提示，避免探测用户名。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    private final UserStore userStore;

    private final PasswordEncoder passwordEncoder;

    private final TokenService tokenService;

    @Override
    public void register(String username, String password) {
        // 实现思路：
        // 1. 校验用户名与密码非空。
        // 2. 判重后写入加盐摘要。
        requireCredentials(username, password);
        // 先判重再摘要，BCrypt 计算代价较高
        if (userStore.exists(username)) {
            throw new ConflictException(AuthConstants.MSG_USER_EXISTS);
        }
        if (!userStore.add(new UserAccount(username, passwordEncoder.encode(password)))) {
            // 并发注册同名用户时由 putIfAbsent 兜底
            throw new ConflictException(AuthConstants.MSG_USER_EXISTS);
        }
        log.info("用户注册成功|User_registered,username={}", username);
    }

    /**
     * 登录并签发访问令牌
     *
     * 实现逻辑：
     * 1. 校验用户名与密码非空。
     * 2. 查询用户并比对密码摘要。
     * 3. 签发以用户名为主体的令牌。
     */
    @Override
    public String login(String username, String password) {
        requireCredentials(username, password);
        // 核心代码：查询用户并比对摘要，用户不存在与密码错误走同一分支
        UserAccount account = userStore.find(username)
                .filter(user -> passwordEncoder.matches(password, user.getPasswordHash()))
                .orElseThrow(() -> {
                    log.warn("登录失败|Login_failed,username={}", username);
                    return new UnauthorizedException(AuthConstants.MSG_INVALID_CREDENTIALS);
                });
        // 核心代码：签发令牌
        String token = tokenService.issue(account.getUsername());
        log.info("登录成功|Login_succeeded,username={}", username);
        return token;
    }

    @Override
    public String authenticate(String token) {
        // 实现思路：
        // 1. 令牌缺失直接拒绝。
        // 2. 校验失败的具体原因只写日志，不返回给客户端。
        if (Strings.isNullOrEmpty(token)) {
            throw new UnauthorizedException(AuthConstants.MSG_MISSING_TOKEN);
        }
        try {
            return tokenService.verify(token);
        } catch (TokenException e) {
            log.warn("令牌校验失败|Token_rejected,reason={}", e.getMessage());
            throw new UnauthorizedException(AuthConstants.MSG_INVALID_TOKEN);
        }
    }

    private static void requireCredentials(String username, String password) {
        if (Strings.isNullOrEmpty(username) || Strings.isNullOrEmpty(password)) {
            throw new InvalidInputException(AuthConstants.MSG_MISSING_CREDENTIALS);
        }
    }
}
