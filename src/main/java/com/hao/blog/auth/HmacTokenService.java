package com.hao.blog.auth;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import com.hao.blog.common.exception.TokenException;
import com.hao.blog.common.util.JsonUtil;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * HMAC-SHA256 签名令牌
 *
 * 类职责：
 * 生成与校验 JWS 紧凑格式的令牌：base64url(头部).base64url(声明).base64url(签名)。
 *
 * 设计目的：
 * 1. 无状态：服务端不保存令牌，重启后只要密钥不变令牌依然有效。
 * 2. 与常见 JWT 库互通：头部固定为 {"alg":"HS256","typ":"JWT"}。
 *
 * 核心实现思路：
 * - 使用 Guava Hashing.hmacSha256 计算签名，BaseEncoding.base64Url 编码。
 * - 声明包含 sub、iat、jti，ttl 大于 0 时附带 exp。
 * - 签名比较使用 MessageDigest.isEqual，耗时与内容无关。
 */
public class HmacTokenService implements TokenService {

    private static final String ALGORITHM = "HS256";

    private static final BaseEncoding BASE64_URL = BaseEncoding.base64Url().omitPadding();

    private static final Splitter DOT_SPLITTER = Splitter.on('.');

    private static final String HEADER_SEGMENT = BASE64_URL.encode(
            JsonUtil.toJson(headerClaims()).getBytes(StandardCharsets.UTF_8));

    private final HashFunction hmac;

    private final Duration ttl;

    private final Clock clock;

    /**
     * @param secret 签名密钥，不能为空
     * @param ttl 令牌有效期，为空、零或负数表示不过期
     * @param clock 时钟（测试可注入固定时钟）
     */
    public HmacTokenService(String secret, Duration ttl, Clock clock) {
        if (Strings.isNullOrEmpty(secret)) {
            throw new IllegalArgumentException("token secret must not be empty");
        }
        this.hmac = Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8));
        this.ttl = ttl;
        this.clock = clock;
    }

    @Override
    public String issue(String subject) {
        if (Strings.isNullOrEmpty(subject)) {
            throw new IllegalArgumentException("token subject must not be empty");
        }
        long now = clock.instant().getEpochSecond();
        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("sub", subject);
        claims.put("iat", now);
        claims.put("jti", UUID.randomUUID().toString());
        if (expires()) {
            claims.put("exp", now + ttl.getSeconds());
        }
        String payload = BASE64_URL.encode(JsonUtil.toJson(claims).getBytes(StandardCharsets.UTF_8));
        String signingInput = HEADER_SEGMENT + "." + payload;
        return signingInput + "." + BASE64_URL.encode(sign(signingInput));
    }

    /**
     * 校验令牌
     *
     * 实现逻辑：
     * 1. 拆分三段结构。
     * 2. 重新计算签名并比对。
     * 3. 解析头部与声明，校验算法、主体与过期时间。
     *
     * @param token 令牌字符串
     * @return 主体（用户名）
     */
    @Override
    public String verify(String token) {
        if (Strings.isNullOrEmpty(token)) {
            throw new TokenException("token is empty");
        }
        List<String> parts = DOT_SPLITTER.splitToList(token);
        if (parts.size() != 3) {
            throw new TokenException("token must have three segments");
        }

        byte[] expected = sign(parts.get(0) + "." + parts.get(1));
        byte[] actual = decode(parts.get(2));
        if (!MessageDigest.isEqual(expected, actual)) {
            throw new TokenException("token signature mismatch");
        }

        Map<String, Object> header = parseSegment(parts.get(0));
        if (!ALGORITHM.equals(header.get("alg"))) {
            throw new TokenException("unsupported token algorithm");
        }

        Map<String, Object> claims = parseSegment(parts.get(1));
        Object subject = claims.get("sub");
        if (!(subject instanceof String) || ((String) subject).isEmpty()) {
            throw new TokenException("token subject missing");
        }
        Object exp = claims.get("exp");
        if (exp != null) {
            if (!(exp instanceof Number)) {
                throw new TokenException("token expiry malformed");
            }
            if (clock.instant().getEpochSecond() >= ((Number) exp).longValue()) {
                throw new TokenException("token expired");
            }
        }
        return (String) subject;
    }

    private boolean expires() {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }

    private byte[] sign(String signingInput) {
        return hmac.hashString(signingInput, StandardCharsets.UTF_8).asBytes();
    }

    private byte[] decode(String segment) {
        try {
            return BASE64_URL.decode(segment);
        } catch (IllegalArgumentException e) {
            throw new TokenException("token segment is not base64url", e);
        }
    }

    private Map<String, Object> parseSegment(String segment) {
        String json = new String(decode(segment), StandardCharsets.UTF_8);
        try {
            Map<String, Object> parsed = JsonUtil.toType(json, new TypeReference<Map<String, Object>>() {});
            if (parsed == null) {
                throw new TokenException("token segment is empty");
            }
            return parsed;
        } catch (IllegalArgumentException e) {
            throw new TokenException("token segment is not JSON", e);
        }
    }

    private static Map<String, Object> headerClaims() {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("alg", ALGORITHM);
        header.put("typ", "JWT");
        return header;
    }
}
