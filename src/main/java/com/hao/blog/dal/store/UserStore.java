package com.hao.blog.dal.store;

import com.hao.blog.dal.model.UserAccount;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 用户内存存储
 *
 * 类职责：
 * 以用户名为键保存注册用户。
 *
 * 核心实现思路：
 * - ConcurrentHashMap 提供无锁读与按键独占写。
 * - putIfAbsent 保证同名并发注册只有一个成功。
 */
@Repository
public class UserStore {

    private final ConcurrentMap<String, UserAccount> users = new ConcurrentHashMap<>();

    /**
     * 写入新用户
     *
     * @param account 用户
     * @return true 表示写入成功，false 表示用户名已存在
     */
    public boolean add(UserAccount account) {
        return users.putIfAbsent(account.getUsername(), account) == null;
    }

    public Optional<UserAccount> find(String username) {
        return Optional.ofNullable(users.get(username));
    }

    public boolean exists(String username) {
        return users.containsKey(username);
    }
}
