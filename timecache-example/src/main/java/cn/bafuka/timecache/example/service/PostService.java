package cn.bafuka.timecache.example.service;

import cn.bafuka.timecache.core.CacheSession;
import cn.bafuka.timecache.example.entity.Post;
import cn.bafuka.timecache.example.store.MybatisPostStore;
import cn.bafuka.timecache.limiter.KeyedRateLimiter;
import cn.bafuka.timecache.score.HalfLives;
import cn.bafuka.timecache.score.ScoreEngine;
import cn.bafuka.timecache.score.ScoredResult;
import cn.bafuka.timecache.tier.TierCacheManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * 帖子服务
 * 所有读写都经过当前请求的 {@link CacheSession}，修改在请求结束时统一写回
 */
@Slf4j
@Service
public class PostService {

    private static final String VOTE_ACTION = "vote";

    private static final double VOTE_WEIGHT = 1.0;

    private static final double VIEW_WEIGHT = 0.1;

    @Autowired
    private TierCacheManager<Post> postCacheManager;

    @Autowired
    private MybatisPostStore postStore;

    @Autowired
    private ScoreEngine scoreEngine;

    @Autowired
    private KeyedRateLimiter keyedRateLimiter;

    public Post getPost(CacheSession session, String keyName) {
        return postCacheManager.get(session, keyName);
    }

    /**
     * 创建帖子，已存在时直接返回已有帖子
     */
    public Post createPost(CacheSession session, Post post) {
        log.info("创建帖子: keyName={}", post.getKeyName());
        return postCacheManager.getOrCreate(session, post.getKeyName(),
                key -> Post.create(key, post.getTitle(), post.getContent()));
    }

    /**
     * 投票：每个用户对每个帖子只计一次，且同一用户的投票频率受限
     *
     * @return true 表示本次投票已计分
     */
    public boolean vote(CacheSession session, String keyName) {
        if (session.getUserId() != null
                && keyedRateLimiter.isExceeded(VOTE_ACTION + ":" + session.getUserId(), session.nowSeconds(), 1.0)) {
            log.warn("投票过于频繁: userId={}", session.getUserId());
            return false;
        }

        Post post = postCacheManager.get(session, keyName);
        if (post == null) {
            return false;
        }
        boolean counted = scoreEngine.recordEventOncePerUser(session, post, VOTE_ACTION, VOTE_WEIGHT);
        if (counted) {
            postCacheManager.markDirty(session, post, false);
        }
        return counted;
    }

    /**
     * 浏览：低权重事件，延迟写回
     */
    public Post view(CacheSession session, String keyName) {
        Post post = postCacheManager.get(session, keyName);
        if (post != null) {
            scoreEngine.recordEvent(session, post, VIEW_WEIGHT);
            postCacheManager.markDirty(session, post, false);
        }
        return post;
    }

    public Map<String, Double> scores(CacheSession session, Post post) {
        return scoreEngine.namedScores(post, session.nowHours());
    }

    /**
     * 排行榜
     *
     * @param halfLife 半衰期名称：day / week / month / year
     */
    public List<ScoredResult<Post>> top(CacheSession session, String halfLife, int limit) {
        return scoreEngine.rank(postStore, null, parseHalfLife(halfLife), limit, session.nowHours());
    }

    private static double parseHalfLife(String name) {
        for (Double halfLife : HalfLives.DEFAULTS) {
            if (HalfLives.name(halfLife).equals(name)) {
                return halfLife;
            }
        }
        throw new IllegalArgumentException("Unknown half-life: " + name);
    }
}
