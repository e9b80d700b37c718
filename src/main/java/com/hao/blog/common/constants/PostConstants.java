package com.hao.blog.common.constants;

/**
 * 文章接口常量定义
 *
 * 类职责：
 * 集中管理分页默认值与接口返回文案，避免魔法值散落在业务代码中。
 */
public class PostConstants {

    /** 默认页码（从 1 开始） */
    public static final int DEFAULT_PAGE = 1;

    /** 默认每页条数 */
    public static final int DEFAULT_PER_PAGE = 10;

    /** 排序方向缺省值 */
    public static final String DEFAULT_DIRECTION = "asc";

    public static final String MSG_POST_NOT_FOUND = "Post not found";

    public static final String MSG_INVALID_DATE = "Invalid date format. Use YYYY-MM-DD.";

    public static final String MSG_MISSING_FIELDS = "Missing fields: ";

    public static final String MSG_INVALID_SORT_FIELD =
            "Invalid sort field. Must be 'title', 'content', 'author', or 'date'.";

    public static final String MSG_INVALID_SORT_DIRECTION =
            "Invalid sort direction. Must be 'asc' or 'desc'.";

    /** 删除成功文案，占位符为文章ID */
    public static final String MSG_POST_DELETED = "Post with id %d has been deleted successfully.";

    private PostConstants() {}
}
