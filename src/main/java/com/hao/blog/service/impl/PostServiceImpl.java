package com.hao.blog.service.impl;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.hao.blog.common.constants.DateConstants;
import com.hao.blog.common.constants.PostConstants;
import com.hao.blog.common.enums.SortDirection;
import com.hao.blog.common.enums.SortField;
import com.hao.blog.common.exception.InvalidInputException;
import com.hao.blog.common.exception.NotFoundException;
import com.hao.blog.dal.model.BlogPost;
import com.hao.blog.dal.store.PostStore;
import com.hao.blog.dto.PostQuery;
import com.hao.blog.dto.PostRequest;
import com.hao.blog.service.PostService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 文章业务服务实现
 *
 * 类职责：
 * 实现文章列表、创建、更新、删除与检索的业务规则。
 *
 * 设计目的：
 * 1. 业务校验（排序字段、必填字段、日期格式）集中在此处。
 * 2. 并发安全由 PostStore 的读写锁保证，服务层本身无状态。
 *
 * 核心实现思路：
 * - 列表与检索基于存储快照计算，不持有锁。
 * - 排序使用 List.sort（稳定排序），降序时相同值保持原有先后顺序。
 * - 创建校验日期格式，更新不校验（保持现有接口行为）。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostServiceImpl implements PostService {

    private static final Joiner FIELD_JOINER = Joiner.on(", ");

    private final PostStore postStore;

    /**
     * 分页列出文章
     *
     * 实现逻辑：
     * 1. 校验排序字段与排序方向。
     * 2. 基于快照排序。
     * 3. 计算切片区间，越界返回空列表。
     */
    @Override
    public List<BlogPost> listPosts(String sort, String direction, int page, int perPage) {
        // 实现思路：
        // 1. 读取存储快照，排序不影响存储中的插入顺序。
        // 2. 校验并应用排序。
        // 3. 计算切片区间。
        List<BlogPost> posts = postStore.findAll();

        if (!Strings.isNullOrEmpty(sort)) {
            SortField field = SortField.fromParam(sort)
                    .orElseThrow(() -> new InvalidInputException(PostConstants.MSG_INVALID_SORT_FIELD));
            // 仅在未传方向时取默认值，传空字符串视为非法方向
            String directionParam = direction == null ? PostConstants.DEFAULT_DIRECTION : direction;
            SortDirection sortDirection = SortDirection.fromParam(directionParam)
                    .orElseThrow(() -> new InvalidInputException(PostConstants.MSG_INVALID_SORT_DIRECTION));

            Comparator<BlogPost> comparator = field.comparator();
            posts.sort(sortDirection == SortDirection.DESC ? comparator.reversed() : comparator);
        }

        if (page < 1 || perPage < 1) {
            return Collections.emptyList();
        }
        // 使用 long 计算起始下标，避免大页码溢出
        long start = (long) (page - 1) * perPage;
        if (start >= posts.size()) {
            return Collections.emptyList();
        }
        int end = (int) Math.min(start + perPage, posts.size());
        return new ArrayList<>(posts.subList((int) start, end));
    }

    /**
     * 创建文章
     *
     * 实现逻辑：
     * 1. 按 title、content、author、date 顺序收集缺失字段。
     * 2. 校验日期为真实存在的 yyyy-MM-dd。
     * 3. 交由存储层分配ID并追加。
     */
    @Override
    public BlogPost createPost(PostRequest request) {
        // 实现思路：
        // 1. 收集缺失字段并一次性返回。
        // 2. 校验日期后再分配ID，失败的请求不消耗ID。
        PostRequest body = request == null ? new PostRequest() : request;

        List<String> missing = new ArrayList<>();
        if (body.getTitle() == null) {
            missing.add("title");
        }
        if (body.getContent() == null) {
            missing.add("content");
        }
        if (body.getAuthor() == null) {
            missing.add("author");
        }
        if (body.getDate() == null) {
            missing.add("date");
        }
        if (!missing.isEmpty()) {
            throw new InvalidInputException(PostConstants.MSG_MISSING_FIELDS + FIELD_JOINER.join(missing));
        }
        if (!isValidDate(body.getDate())) {
            throw new InvalidInputException(PostConstants.MSG_INVALID_DATE);
        }

        // 核心代码：发号并追加
        BlogPost created = postStore.insert(body.getTitle(), body.getContent(), body.getAuthor(), body.getDate());
        log.info("文章创建成功|Post_created,id={},author={}", created.getId(), created.getAuthor());
        return created;
    }

    /**
     * 局部更新文章
     *
     * 注意：日期字段在更新时不做格式校验。
     */
    @Override
    public BlogPost updatePost(int id, PostRequest request) {
        // 实现思路：
        // 1. 在存储写锁内逐个覆盖非空字段。
        // 2. 文章不存在时返回 404。
        PostRequest body = request == null ? new PostRequest() : request;
        BlogPost updated = postStore.update(id, post -> {
            if (body.getTitle() != null) {
                post.setTitle(body.getTitle());
            }
            if (body.getContent() != null) {
                post.setContent(body.getContent());
            }
            if (body.getAuthor() != null) {
                post.setAuthor(body.getAuthor());
            }
            if (body.getDate() != null) {
                post.setDate(body.getDate());
            }
        }).orElseThrow(() -> new NotFoundException(PostConstants.MSG_POST_NOT_FOUND));
        log.info("文章更新成功|Post_updated,id={}", id);
        return updated;
    }

    @Override
    public String deletePost(int id) {
        // 核心代码：删除并判断是否存在
        if (!postStore.delete(id)) {
            throw new NotFoundException(PostConstants.MSG_POST_NOT_FOUND);
        }
        log.info("文章删除成功|Post_deleted,id={}", id);
        return String.format(PostConstants.MSG_POST_DELETED, id);
    }

    /**
     * 多条件检索
     *
     * 实现逻辑：
     * 1. 为每个非空条件构造过滤谓词。
     * 2. 标题、正文、作者忽略大小写；日期按原样做子串匹配。
     * 3. 所有谓词取逻辑与。
     */
    @Override
    public List<BlogPost> searchPosts(PostQuery query) {
        // 实现思路：
        // 1. 逐个叠加过滤条件。
        // 2. 基于快照过滤，保持插入顺序。
        Predicate<BlogPost> filter = post -> true;
        if (query != null) {
            filter = filter
                    .and(containsIgnoreCase(query.getTitle(), BlogPost::getTitle))
                    .and(containsIgnoreCase(query.getContent(), BlogPost::getContent))
                    .and(containsIgnoreCase(query.getAuthor(), BlogPost::getAuthor))
                    .and(contains(query.getDate(), BlogPost::getDate));
        }
        return postStore.findAll().stream()
                .filter(filter)
                .collect(Collectors.toList());
    }

    private static Predicate<BlogPost> containsIgnoreCase(String keyword, Function<BlogPost, String> extractor) {
        if (Strings.isNullOrEmpty(keyword)) {
            return post -> true;
        }
        String needle = keyword.toLowerCase(Locale.ROOT);
        return post -> {
            String value = extractor.apply(post);
            return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
        };
    }

    private static Predicate<BlogPost> contains(String keyword, Function<BlogPost, String> extractor) {
        if (Strings.isNullOrEmpty(keyword)) {
            return post -> true;
        }
        return post -> {
            String value = extractor.apply(post);
            return value != null && value.contains(keyword);
        };
    }

    private static boolean isValidDate(String date) {
        try {
            LocalDate.parse(date, DateConstants.POST_DATE_FORMATTER);
            return true;
        } catch (DateTimeParseException e) {
            log.warn("文章日期格式非法|Post_date_invalid,date={}", date);
            return false;
        }
    }
}
