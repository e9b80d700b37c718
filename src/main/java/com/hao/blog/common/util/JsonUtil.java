package com.hao.blog.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON 工具类
 *
 * 类职责：
 * 提供全局复用的 ObjectMapper 与常用序列化、反序列化方法。
 *
 * 设计目的：
 * 1. ObjectMapper 创建成本高且线程安全，全局单例复用。
 * 2. 将受检的 JsonProcessingException 转换为非受检异常，简化调用方代码。
 *
 * 核心实现思路：
 * - 序列化失败抛出 IllegalStateException（属于程序缺陷）。
 * - 反序列化失败抛出 IllegalArgumentException（属于输入错误），由调用方决定如何处理。
 */
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonUtil() {}

    /**
     * 对象序列化为 JSON 字符串
     *
     * @param value 任意对象
     * @return JSON 字符串
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /**
     * JSON 字符串反序列化为泛型类型
     *
     * @param json JSON 字符串
     * @param typeReference 目标泛型类型
     * @return 反序列化结果
     */
    public static <T> T toType(String json, TypeReference<T> typeReference) {
        try {
            return MAPPER.readValue(json, typeReference);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("JSON parse failed", e);
        }
    }
}
