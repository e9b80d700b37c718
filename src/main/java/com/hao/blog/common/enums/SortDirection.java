package com.hao.blog.common.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

/**
 * 排序方向枚举
 */
@Getter
@AllArgsConstructor
public enum SortDirection {

    ASC("asc"),

    DESC("desc");

    private final String param;

    public static Optional<SortDirection> fromParam(String param) {
        return Arrays.stream(values())
                .filter(direction -> direction.param.equals(param))
                .findFirst();
    }
}
