package com.hao.blog.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 文章检索条件
 *
 * 每个非空字段都会进一步收窄结果集（逻辑与）。
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PostQuery {

    /** 标题关键字（忽略大小写） */
    private String title;

    /** 正文关键字（忽略大小写） */
    private String content;

    /** 作者关键字（忽略大小写） */
    private String author;

    /** 日期片段（区分大小写的子串匹配） */
    private String date;
}
