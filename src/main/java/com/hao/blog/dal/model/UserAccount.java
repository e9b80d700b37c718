package com.hao.blog.dal.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 注册用户实体
 *
 * 类职责：
 * 保存用户名与密码摘要，用户注册后不可修改、不可删除。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class UserAccount {

    /** 用户名（主键） */
    private String username;

    /** 加盐单向摘要（BCrypt），从不保存明文 */
    private String passwordHash;
}
