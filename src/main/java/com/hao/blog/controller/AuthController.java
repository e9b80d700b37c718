package com.hao.blog.controller;

import com.hao.blog.common.constants.AuthConstants;
import com.hao.blog.dto.CredentialsRequest;
import com.hao.blog.service.AuthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 认证控制器
 *
 * 类职责：
 * 提供注册与登录接口，这两个接口不需要令牌。
 *
 * 核心实现思路：
 * - 请求体缺失时按空凭证处理，由服务层返回 400。
 * - 业务逻辑委托给 AuthService。
 */
@RestController
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    /**
     * 注册新用户
     *
     * @param body {"username": "...", "password": "..."}
     * @return 201 与成功提示
     */
    @PostMapping("/register")
    public ResponseEntity<Map<String, String>> register(@RequestBody(required = false) CredentialsRequest body) {
        CredentialsRequest credentials = body == null ? new CredentialsRequest() : body;
        authService.register(credentials.getUsername(), credentials.getPassword());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("message", AuthConstants.MSG_REGISTERED));
    }

    /**
     * 登录
     *
     * @param body {"username": "...", "password": "..."}
     * @return {"access_token": "..."}
     */
    @PostMapping("/login")
    public Map<String, String> login(@RequestBody(required = false) CredentialsRequest body) {
        CredentialsRequest credentials = body == null ? new CredentialsRequest() : body;
        String token = authService.login(credentials.getUsername(), credentials.getPassword());
        return Map.of("access_token", token);
    }
}
