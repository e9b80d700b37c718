package com.hao.blog.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 注册与登录请求体
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class CredentialsRequest {

    private String username;

    private String password;
}
