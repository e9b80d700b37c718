package com.hao.blog.dal.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 博客文章实体
 *
 * 类职责：
 * 描述一篇博客文章的全部字段，同时作为接口的 JSON 结构。
 *
 * 核心实现思路：
 * - 使用简单字段映射业务属性，字段名即 JSON 键名。
 * - 通过 Lombok 降低样板代码。
 */
@Data                // 自动生成访问器与字符串表示方法
@AllArgsConstructor  // 全参构造器
@NoArgsConstructor   // 无参构造器
@JsonPropertyOrder({"id", "title", "content", "author", "date"})
public class BlogPost {

    /** 文章ID（唯一且不复用） */
    private Integer id;

    /** 标题 */
    private String title;

    /** 正文 */
    private String content;

    /** 作者 */
    private String author;

    /** 发布日期（格式化字符串，如 "2023-01-01"） */
    private String date;

    /**
     * 生成当前文章的副本
     *
     * 存储层对外只暴露副本，调用方修改返回值不会影响已存储的数据。
     *
     * @return 字段相同的新对象
     */
    public BlogPost copy() {
        return new BlogPost(id, title, content, author, date);
    }
}
