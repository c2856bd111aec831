package cn.bafuka.timecache.example.controller;

import cn.bafuka.timecache.core.CacheSession;
import cn.bafuka.timecache.example.entity.Post;
import cn.bafuka.timecache.example.service.PostService;
import cn.bafuka.timecache.example.web.CacheSessionInterceptor;
import cn.bafuka.timecache.score.ScoredResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import javax.servlet.http.HttpServletRequest;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 帖子控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/posts")
public class PostController {

    @Autowired
    private PostService postService;

    /**
     * 查看帖子（计一次浏览）
     */
    @GetMapping("/{keyName}")
    public Map<String, Object> getPost(@PathVariable String keyName, HttpServletRequest request) {
        CacheSession session = CacheSessionInterceptor.currentSession(request);
        Post post = postService.view(session, keyName);
        Map<String, Object> result = new HashMap<>();
        result.put("success", post != null);
        result.put("data", post);
        if (post != null) {
            result.put("scores", postService.scores(session, post));
        }
        return result;
    }

    /**
     * 创建帖子
     */
    @PostMapping
    public Map<String, Object> createPost(@RequestBody Post post, HttpServletRequest request) {
        Post created = postService.createPost(CacheSessionInterceptor.currentSession(request), post);
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", created);
        result.put("message", "帖子创建成功");
        return result;
    }

    /**
     * 投票
     */
    @PostMapping("/{keyName}/vote")
    public Map<String, Object> vote(@PathVariable String keyName, HttpServletRequest request) {
        boolean counted = postService.vote(CacheSessionInterceptor.currentSession(request), keyName);
        Map<String, Object> result = new HashMap<>();
        result.put("success", counted);
        result.put("message", counted ? "投票成功" : "投票未计入（重复、匿名或过于频繁）");
        return result;
    }

    /**
     * 排行榜
     */
    @GetMapping("/top")
    public Map<String, Object> top(@RequestParam(defaultValue = "day") String halfLife,
                                   @RequestParam(defaultValue = "10") int limit,
                                   HttpServletRequest request) {
        List<ScoredResult<Post>> ranked = postService.top(CacheSessionInterceptor.currentSession(request), halfLife, limit);
        List<Map<String, Object>> data = new ArrayList<>();
        for (ScoredResult<Post> item : ranked) {
            Map<String, Object> row = new HashMap<>();
            row.put("keyName", item.getEntity().getKeyName());
            row.put("title", item.getEntity().getTitle());
            row.put("score", item.getScore());
            data.add(row);
        }
        Map<String, Object> result = new HashMap<>();
        result.put("success", true);
        result.put("data", data);
        result.put("total", data.size());
        return result;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException e) {
        Map<String, Object> result = new HashMap<>();
        result.put("success", false);
        result.put("message", e.getMessage());
        return result;
    }
}
