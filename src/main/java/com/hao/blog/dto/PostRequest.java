package com.hao.blog.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 文章写入请求体
 *
 * 创建时四个字段都必填；更新时只覆盖非空字段。
 * JSON 中显式的 null 与缺省字段等价。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class PostRequest {

    private String title;

    private String content;

    private String author;

    private String date;
}
