package com.hao.blog.service;

import com.hao.blog.dal.model.BlogPost;
import com.hao.blog.dto.PostQuery;
import com.hao.blog.dto.PostRequest;

import java.util.List;

/**
 * 文章业务服务接口
 *
 * 类职责：
 * 提供文章的分页列表、创建、局部更新、删除与多条件检索能力。
 *
 * 设计目的：
 * 1. 保持控制层与存储层解耦。
 * 2. 参数校验集中在服务层，控制层只负责请求映射。
 */
public interface PostService {

    /**
     * 分页列出文章
     *
     * 实现逻辑：
     * 1. 指定排序字段时先做稳定排序，否则保持插入顺序。
     * 2. 按页码切片，越界返回空列表。
     *
     * @param sort 排序字段，可为空
     * @param direction 排序方向 asc/desc，可为空（默认 asc）
     * @param page 页码，从 1 开始
     * @param perPage 每页条数
     * @return 当前页文章
     */
    List<BlogPost> listPosts(String sort, String direction, int page, int perPage);

    /**
     * 创建文章
     *
     * @param request 请求体，可为空（视为全部字段缺失）
     * @return 新文章
     */
    BlogPost createPost(PostRequest request);

    /**
     * 局部更新文章，仅覆盖请求中非空的字段
     *
     * @param id 文章ID
     * @param request 请求体，可为空（视为不修改任何字段）
     * @return 更新后的文章
     */
    BlogPost updatePost(int id, PostRequest request);

    /**
     * 删除文章
     *
     * @param id 文章ID
     * @return 删除成功提示
     */
    String deletePost(int id);

    /**
     * 多条件检索文章
     *
     * @param query 检索条件
     * @return 匹配的文章（按插入顺序）
     */
    List<BlogPost> searchPosts(PostQuery query);
}
