package com.hao.blog.common.constants;

import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;

/**
 * 日期常量定义
 *
 * 类职责：
 * 集中管理博客文章日期字段使用的格式与格式化器。
 *
 * 为什么需要该类：
 * DateTimeFormatter 是线程安全的，应当作为全局单例复用。
 */
public class DateConstants {

    /**
     * 文章日期格式模式
     * 示例：2023-10-27，月、日允许不补零（2023-1-5）
     */
    public static final String POST_DATE_PATTERN = "uuuu-M-d";

    /**
     * 文章日期格式化器 (线程安全)
     * STRICT 模式拒绝 2023-02-30、2023-13-01 这类不存在的日期
     */
    public static final DateTimeFormatter POST_DATE_FORMATTER =
            DateTimeFormatter.ofPattern(POST_DATE_PATTERN).withResolverStyle(ResolverStyle.STRICT);

    // 私有构造防止实例化
    private DateConstants() {}
}
