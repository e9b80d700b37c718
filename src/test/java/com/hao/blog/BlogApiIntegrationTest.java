package com.hao.blog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.hao.blog.common.util.JsonUtil;
import com.hao.blog.dal.model.BlogPost;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 博客接口全链路集成测试
 *
 * 类职责：
 * 在真实 HTTP 链路下验证注册、登录、认证拦截与文章接口。
 *
 * 设计思路：
 * - 使用 MockMvc 模拟真实 HTTP 请求链路。
 * - 每个用例结束后重建上下文，保证都从两篇初始化文章开始。
 */
@Slf4j
@SpringBootTest
@AutoConfigureMockMvc
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
public class BlogApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    private String bearer;

    @BeforeEach
    public void setup() throws Exception {
        bearer = "Bearer " + registerAndLogin("tester", "secret");
    }

    private String registerAndLogin(String username, String password) throws Exception {
        String credentials = JsonUtil.toJson(Map.of("username", username, "password", password));
        mockMvc.perform(post("/register").contentType(MediaType.APPLICATION_JSON).content(credentials))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("User registered successfully"));

        MvcResult result = mockMvc.perform(post("/login").contentType(MediaType.APPLICATION_JSON).content(credentials))
                .andExpect(status().isOk())
                .andReturn();
        Map<String, String> body = JsonUtil.toType(result.getResponse().getContentAsString(),
                new TypeReference<Map<String, String>>() {});
        assertNotNull(body.get("access_token"));
        return body.get("access_token");
    }

    private List<BlogPost> readPosts(MvcResult result) throws Exception {
        return JsonUtil.toType(result.getResponse().getContentAsString(StandardCharsets.UTF_8),
                new TypeReference<List<BlogPost>>() {});
    }

    private List<Integer> listIds(String query) throws Exception {
        MvcResult result = mockMvc.perform(get("/api/posts" + query).header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andReturn();
        return readPosts(result).stream().map(BlogPost::getId).collect(Collectors.toList());
    }

    // ===========================
    // 1. 认证
    // ===========================

    @Test
    @DisplayName("重复注册返回400")
    public void testDuplicateRegister() throws Exception {
        mockMvc.perform(post("/register").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"tester\",\"password\":\"other\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("User already exists"));
    }

    @Test
    @DisplayName("注册与登录缺少字段返回400")
    public void testMissingCredentials() throws Exception {
        mockMvc.perform(post("/register").contentType(MediaType.APPLICATION_JSON).content("{\"username\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing username or password"));
        mockMvc.perform(post("/login").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("错误密码与未知用户登录返回401")
    public void testLoginRejected() throws Exception {
        mockMvc.perform(post("/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"tester\",\"password\":\"wrong\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid username or password"));
        mockMvc.perform(post("/login").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"username\":\"ghost\",\"password\":\"secret\"}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("受保护接口缺少或携带无效令牌返回401")
    public void testProtectedEndpointsRequireToken() throws Exception {
        mockMvc.perform(get("/api/posts")).andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/posts/search")).andExpect(status().isUnauthorized());
        mockMvc.perform(delete("/api/posts/1")).andExpect(status().isUnauthorized());
        mockMvc.perform(get("/api/posts").header(HttpHeaders.AUTHORIZATION, "Bearer garbage"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("Invalid or expired token"));
        mockMvc.perform(get("/api/posts").header(HttpHeaders.AUTHORIZATION, "Basic dXNlcjpwdw=="))
                .andExpect(status().isUnauthorized());

        // 未认证的删除请求不应生效
        assertEquals(List.of(1, 2), listIds(""));
    }

    @Test
    @DisplayName("跨域预检请求无需令牌")
    public void testPreflightPassesWithoutToken() throws Exception {
        mockMvc.perform(options("/api/posts")
                        .header(HttpHeaders.ORIGIN, "http://localhost:5001")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
                .andExpect(status().isOk())
                .andExpect(header().exists(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN));
    }

    // ===========================
    // 2. 文章
    // ===========================

    @Test
    @DisplayName("启动后存在两篇初始化文章")
    public void testSeededPosts() throws Exception {
        mockMvc.perform(get("/api/posts").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].id").value(1))
                .andExpect(jsonPath("$[0].title").value("First post"))
                .andExpect(jsonPath("$[1].author").value("Author Two"))
                .andExpect(jsonPath("$[1].date").value("2023-02-01"));
    }

    @Test
    @DisplayName("排序、分页与参数校验")
    public void testListSortingAndPaging() throws Exception {
        assertEquals(List.of(2, 1), listIds("?sort=title&direction=desc"));
        assertEquals(List.of(2), listIds("?page=2&per_page=1"));
        assertEquals(List.of(), listIds("?page=5"));
        // 非整数分页参数回退到默认值
        assertEquals(List.of(1, 2), listIds("?page=abc&per_page=xyz"));

        mockMvc.perform(get("/api/posts").param("sort", "id").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid sort field. Must be 'title', 'content', 'author', or 'date'."));
        mockMvc.perform(get("/api/posts?sort=title&direction=").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid sort direction. Must be 'asc' or 'desc'."));
        mockMvc.perform(get("/api/posts").param("sort", "title").param("direction", "down")
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid sort direction. Must be 'asc' or 'desc'."));
    }

    @Test
    @DisplayName("创建文章返回201，缺失字段与非法日期返回400")
    public void testCreatePost() throws Exception {
        mockMvc.perform(post("/api/posts").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(JsonUtil.toJson(Map.of("title", "Third", "content", "Body",
                                "author", "Author Three", "date", "2023-03-01"))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(3))
                .andExpect(jsonPath("$.title").value("Third"));

        mockMvc.perform(post("/api/posts").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"t\",\"content\":\"c\",\"date\":\"2023-01-01\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing fields: author"));

        mockMvc.perform(post("/api/posts").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"t\",\"content\":\"c\",\"author\":\"a\",\"date\":\"2023-13-01\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid date format. Use YYYY-MM-DD."));

        mockMvc.perform(post("/api/posts").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());

        assertEquals(List.of(1, 2, 3), listIds(""));
    }

    @Test
    @DisplayName("局部更新只修改提供的字段")
    public void testUpdatePost() throws Exception {
        mockMvc.perform(put("/api/posts/1").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"X\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.title").value("X"))
                .andExpect(jsonPath("$.content").value("This is the first post."))
                .andExpect(jsonPath("$.author").value("Author One"))
                .andExpect(jsonPath("$.date").value("2023-01-01"));

        mockMvc.perform(put("/api/posts/42").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"X\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Post not found"));
    }

    @Test
    @DisplayName("删除文章后不再出现，ID不复用")
    public void testDeletePost() throws Exception {
        mockMvc.perform(delete("/api/posts/2").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Post with id 2 has been deleted successfully."));
        mockMvc.perform(delete("/api/posts/2").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isNotFound());
        assertEquals(List.of(1), listIds(""));

        mockMvc.perform(post("/api/posts").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"t\",\"content\":\"c\",\"author\":\"a\",\"date\":\"2023-05-05\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(3));
    }

    @Test
    @DisplayName("超出 int 范围的文章ID返回404")
    public void testOversizedIdNotFound() throws Exception {
        mockMvc.perform(delete("/api/posts/99999999999").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Post not found"));
        mockMvc.perform(put("/api/posts/99999999999999999999999").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"X\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Post not found"));
        assertEquals(List.of(1, 2), listIds(""));
    }

    @Test
    @DisplayName("月、日不补零的日期可以创建")
    public void testCreateUnpaddedDate() throws Exception {
        mockMvc.perform(post("/api/posts").header(HttpHeaders.AUTHORIZATION, bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"t\",\"content\":\"c\",\"author\":\"a\",\"date\":\"2023-1-5\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.date").value("2023-1-5"));
    }

    @Test
    @DisplayName("检索：作者忽略大小写，无条件返回全部")
    public void testSearch() throws Exception {
        MvcResult byAuthor = mockMvc.perform(get("/api/posts/search").param("author", "one")
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andReturn();
        List<BlogPost> found = readPosts(byAuthor);
        assertEquals(1, found.size());
        assertEquals("Author One", found.get(0).getAuthor());

        mockMvc.perform(get("/api/posts/search").param("title", "nothing-matches")
                        .header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(get("/api/posts/search").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
        log.info("检索接口验证通过|Search_api_verified");
    }
}
