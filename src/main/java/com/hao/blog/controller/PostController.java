package com.hao.blog.controller;

import com.google.common.primitives.Ints;
import com.hao.blog.common.constants.PostConstants;
import com.hao.blog.common.exception.NotFoundException;
import com.hao.blog.dal.model.BlogPost;
import com.hao.blog.dto.PostQuery;
import com.hao.blog.dto.PostRequest;
import com.hao.blog.service.PostService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 文章控制器
 *
 * 类职责：
 * 提供文章的列表、创建、更新、删除与检索接口，负责参数接收与请求转发。
 *
 * 设计目的：
 * 1. 统一 HTTP 入口，保持控制层轻量。
 * 2. 与服务层解耦，集中处理请求映射。
 *
 * 核心实现思路：
 * - 所有接口位于 /api/posts 下，经认证拦截器保护。
 * - 分页参数无法解析为整数时回退到默认值。
 * - 业务逻辑委托给 PostService。
 */
@RestController
@RequestMapping("/api/posts") // 统一接口前缀
public class PostController {

    @Autowired
    private PostService postService;

    @Value("${blog.page.default-size:" + PostConstants.DEFAULT_PER_PAGE + "}")
    private int defaultPerPage;

    /**
     * 分页列出文章
     *
     * @param sort 排序字段 title/content/author/date
     * @param direction 排序方向 asc/desc
     * @param page 页码，默认 1
     * @param perPage 每页条数，默认 10
     * @return 当前页文章
     */
    @GetMapping
    public List<BlogPost> listPosts(@RequestParam(name = "sort", required = false) String sort,
                                    @RequestParam(name = "direction", required = false) String direction,
                                    @RequestParam(name = "page", required = false) String page,
                                    @RequestParam(name = "per_page", required = false) String perPage) {
        // 实现思路：
        // 1. 分页参数宽松解析，非整数回退默认值。
        // 2. 排序与切片规则交由服务层处理。
        return postService.listPosts(sort, direction,
                parseIntOrDefault(page, PostConstants.DEFAULT_PAGE),
                parseIntOrDefault(perPage, defaultPerPage));
    }

    /**
     * 创建文章
     *
     * @param body 文章内容
     * @return 201 与新文章
     */
    @PostMapping
    public ResponseEntity<BlogPost> createPost(@RequestBody(required = false) PostRequest body) {
        // 核心代码：调用创建服务，成功返回 201
        return ResponseEntity.status(HttpStatus.CREATED).body(postService.createPost(body));
    }

    /**
     * 局部更新文章
     *
     * @param id 文章ID
     * @param body 需要覆盖的字段
     * @return 更新后的文章
     */
    @PutMapping("/{id:\\d+}")
    public BlogPost updatePost(@PathVariable("id") String id, @RequestBody(required = false) PostRequest body) {
        // 实现思路：
        // 1. 解析文章ID，超出 int 范围的ID必然不存在。
        // 2. 委托服务层完成局部更新。
        return postService.updatePost(parsePostId(id), body);
    }

    /**
     * 删除文章
     *
     * @param id 文章ID
     * @return 删除成功提示
     */
    @DeleteMapping("/{id:\\d+}")
    public Map<String, String> deletePost(@PathVariable("id") String id) {
        // 核心代码：调用删除服务
        return Map.of("message", postService.deletePost(parsePostId(id)));
    }

    /**
     * 多条件检索文章
     *
     * @return 匹配的文章，无条件时返回全部
     */
    @GetMapping("/search")
    public List<BlogPost> searchPosts(@RequestParam(name = "title", required = false) String title,
                                      @RequestParam(name = "content", required = false) String content,
                                      @RequestParam(name = "author", required = false) String author,
                                      @RequestParam(name = "date", required = false) String date) {
        // 实现思路：
        // 1. 组装检索条件，空条件在服务层被忽略。
        return postService.searchPosts(PostQuery.builder()
                .title(title)
                .content(content)
                .author(author)
                .date(date)
                .build());
    }

    /**
     * 解析路径中的文章ID
     *
     * 路由已限定为纯数字，解析失败只可能是超出 int 范围，按文章不存在处理。
     *
     * @param id 路径变量
     * @return 文章ID
     */
    private static int parsePostId(String id) {
        Integer parsed = Ints.tryParse(id);
        if (parsed == null) {
            throw new NotFoundException(PostConstants.MSG_POST_NOT_FOUND);
        }
        return parsed;
    }

    private static int parseIntOrDefault(String value, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        Integer parsed = Ints.tryParse(value.trim());
        return parsed == null ? defaultValue : parsed;
    }
}
