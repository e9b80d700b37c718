package com.hao.blog.common.enums;

import com.hao.blog.dal.model.BlogPost;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;
import java.util.function.Function;

/**
 * 文章排序字段枚举
 *
 * 类职责：
 * 统一管理列表接口允许的排序字段，以及字段到取值函数的映射。
 *
 * 设计目的：
 * 1. 以白名单方式校验外部传入的排序字段。
 * 2. 避免在业务代码中使用反射或 switch 取字段值。
 *
 * 核心实现思路：
 * - 枚举承载查询参数名与字段取值函数。
 * - 排序统一使用字符串自然顺序，空值排在最前。
 */
@Getter
@AllArgsConstructor
public enum SortField {

    TITLE("title", BlogPost::getTitle),

    CONTENT("content", BlogPost::getContent),

    AUTHOR("author", BlogPost::getAuthor),

    /**
     * 日期以字符串比较，yyyy-MM-dd 格式下与时间先后一致
     */
    DATE("date", BlogPost::getDate);

    /** 查询参数中的字段名 */
    private final String param;

    /** 字段取值函数 */
    private final Function<BlogPost, String> extractor;

    /**
     * 构造该字段的升序比较器
     *
     * @return 比较器（空值优先）
     */
    public Comparator<BlogPost> comparator() {
        return Comparator.comparing(extractor, Comparator.nullsFirst(Comparator.<String>naturalOrder()));
    }

    /**
     * 按查询参数名解析排序字段
     *
     * @param param 查询参数值（区分大小写）
     * @return 匹配的字段，不存在时为空
     */
    public static Optional<SortField> fromParam(String param) {
        return Arrays.stream(values())
                .filter(field -> field.param.equals(param))
                .findFirst();
    }
}
