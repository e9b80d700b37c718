package com.hao.blog.common.seed;

import com.hao.blog.dal.model.BlogPost;
import com.hao.blog.dal.store.PostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 示例文章初始化执行器
 *
 * 类职责：
 * 在应用启动时写入两篇示例文章，便于前端页面与接口联调。
 *
 * 核心实现思路：
 * - 使用 CommandLineRunner 在启动后执行。
 * - 通过 blog.seed.enabled 控制是否启用，默认启用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "blog.seed.enabled", havingValue = "true", matchIfMissing = true)
public class PostSeedRunner implements CommandLineRunner {

    static final List<BlogPost> SAMPLE_POSTS = List.of(
            new BlogPost(1, "First post", "This is the first post.", "Author One", "2023-01-01"),
            new BlogPost(2, "Second post", "This is the second post.", "Author Two", "2023-02-01"));

    private final PostStore postStore;

    @Override
    public void run(String... args) {
        SAMPLE_POSTS.forEach(postStore::importPost);
        log.info("示例文章初始化完成|Sample_posts_seeded,count={}", SAMPLE_POSTS.size());
    }
}
