package com.hao.blog.dal.store;

import com.hao.blog.dal.model.BlogPost;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * 文章内存存储
 *
 * 类职责：
 * 在进程内保存全部文章，负责ID分配以及增删改查的原子性。
 *
 * 设计目的：
 * 1. 以可注入的 Bean 替代全局变量，测试可直接 new 出互相隔离的实例。
 * 2. 发号与写入在同一把写锁内完成，并发创建不会拿到相同ID。
 *
 * 核心实现思路：
 * - LinkedHashMap 保持插入顺序，同时支持按ID快速定位。
 * - 读写锁：读操作共享，创建、更新、删除独占。
 * - 发号器单调递增，删除后ID不回收。
 * - 对外只返回副本，调用方无法绕过锁修改内部数据。
 */
@Repository
public class PostStore {

    private final Map<Integer, BlogPost> posts = new LinkedHashMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** 已分配的最大ID，下一篇文章取 lastId + 1 */
    private int lastId = 0;

    /**
     * 读取全部文章快照
     *
     * @return 按插入顺序排列的副本列表
     */
    public List<BlogPost> findAll() {
        lock.readLock().lock();
        try {
            List<BlogPost> snapshot = new ArrayList<>(posts.size());
            for (BlogPost post : posts.values()) {
                snapshot.add(post.copy());
            }
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 分配新ID并追加文章
     *
     * 实现逻辑：
     * 1. 获取写锁。
     * 2. 发号器自增得到新ID。
     * 3. 以新ID构造文章并追加到末尾。
     *
     * @param title 标题
     * @param content 正文
     * @param author 作者
     * @param date 日期
     * @return 新文章副本
     */
    public BlogPost insert(String title, String content, String author, String date) {
        lock.writeLock().lock();
        try {
            int id = ++lastId;
            BlogPost post = new BlogPost(id, title, content, author, date);
            posts.put(id, post);
            return post.copy();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 按既有ID写入文章（用于启动初始化数据）
     *
     * 发号器会前移到不小于该ID的位置，保证后续分配的ID不会与之冲突。
     *
     * @param post 带ID的文章
     * @throws IllegalArgumentException ID 为空或已存在
     */
    public void importPost(BlogPost post) {
        if (post.getId() == null) {
            throw new IllegalArgumentException("post id is required");
        }
        lock.writeLock().lock();
        try {
            if (posts.containsKey(post.getId())) {
                throw new IllegalArgumentException("duplicate post id " + post.getId());
            }
            posts.put(post.getId(), post.copy());
            lastId = Math.max(lastId, post.getId());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 原地修改文章
     *
     * @param id 文章ID
     * @param mutator 修改逻辑，在写锁内执行
     * @return 修改后的副本；文章不存在时为空
     */
    public Optional<BlogPost> update(int id, Consumer<BlogPost> mutator) {
        lock.writeLock().lock();
        try {
            BlogPost post = posts.get(id);
            if (post == null) {
                return Optional.empty();
            }
            mutator.accept(post);
            // ID 是主键，不允许修改逻辑改动
            post.setId(id);
            return Optional.of(post.copy());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 删除文章
     *
     * @param id 文章ID
     * @return 是否存在并已删除
     */
    public boolean delete(int id) {
        lock.writeLock().lock();
        try {
            return posts.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
