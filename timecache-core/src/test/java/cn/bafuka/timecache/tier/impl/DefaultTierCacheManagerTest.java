package cn.bafuka.timecache.tier.impl;

import cn.bafuka.timecache.core.CacheSession;
import cn.bafuka.timecache.core.CacheState;
import cn.bafuka.timecache.core.CacheStats;
import cn.bafuka.timecache.core.EntryState;
import cn.bafuka.timecache.dataplane.DurableStore;
import cn.bafuka.timecache.dataplane.impl.CaffeineDistributedCache;
import cn.bafuka.timecache.dataplane.impl.InMemoryDurableStore;
import cn.bafuka.timecache.decay.RateLimiter;
import cn.bafuka.timecache.exception.CacheConflictException;
import cn.bafuka.timecache.exception.MissingMigrationException;
import cn.bafuka.timecache.fixture.Article;
import cn.bafuka.timecache.score.ScoreClock;
import cn.bafuka.timecache.score.ScoreEngine;
import cn.bafuka.timecache.tier.TierCacheManager;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;
import java.util.Collections;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * DefaultTierCacheManager 单元测试
 * 请求级缓存 -> 分布式缓存 -> 持久化存储
 */
public class DefaultTierCacheManagerTest {

    private static final Instant NOW = ScoreClock.instantFromHours(200000);

    private InMemoryDurableStore<Article> store;

    private CaffeineDistributedCache sharedCache;

    private DefaultTierCacheManager<Article> manager;

    private ScoreEngine scoreEngine;

    @Mock
    private DurableStore<Article> failingStore;

    @Before
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        store = new InMemoryDurableStore<>(Article.class);
        sharedCache = new CaffeineDistributedCache();
        manager = new DefaultTierCacheManager<>(Article.class, store, sharedCache, "v1", 3600);
        scoreEngine = new ScoreEngine();

        when(failingStore.save(any(Article.class))).thenThrow(new IllegalStateException("db down"));
    }

    private CacheSession newSession(String sessionId) {
        return CacheSession.builder().sessionId(sessionId).userId("alice").now(NOW).build();
    }

    @Test
    public void testCacheKey() {
        assertEquals("Article~42~Cache~v1", manager.cacheKey("42"));
    }

    @Test
    public void testGet_Miss() {
        assertNull(manager.get(newSession("s1"), "none"));
        assertEquals(1, manager.getStats().getMissCount());
    }

    /**
     * 读取顺序：请求级缓存 -> 分布式缓存 -> 持久化存储
     */
    @Test
    public void testGet_TierOrder() {
        store.save(new Article("42"));

        CacheSession s1 = newSession("s1");
        Article first = manager.get(s1, "42");
        assertNotNull(first);
        assertTrue(manager.isCached(s1, first));
        assertTrue(first.getEntryState().isPresentInDistributedTier());

        // 同一会话内返回同一个实例
        assertSame(first, manager.get(s1, "42"));

        // 其他会话从分布式缓存读取副本
        CacheSession s2 = newSession("s2");
        Article second = manager.get(s2, "42");
        assertNotNull(second);
        assertNotSame(first, second);

        CacheStats stats = manager.getStats();
        assertEquals(1, stats.getDurableLoadCount());
        assertEquals(1, stats.getLocalHitCount());
        assertEquals(1, stats.getDistributedHitCount());
        assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
    }

    /**
     * 从分布式缓存读出的实体不继承脏状态
     */
    @Test
    public void testGet_SharedReadIsClean() {
        store.save(new Article("42", 24.0));
        CacheSession s1 = newSession("s1");
        Article article = manager.get(s1, "42");
        scoreEngine.recordEvent(s1, article, 1);
        manager.markDirty(s1, article, false);
        assertEquals(CacheState.DIRTY, article.getEntryState().getState());

        Article shared = manager.get(newSession("s2"), "42");

        assertTrue(shared.getEntryState().isClean());
        assertTrue(shared.getEntryState().isPresentInDistributedTier());
        assertEquals(s1.nowHours(), shared.getScoreRegister(24).getLastTime(), 1e-6);
    }

    /**
     * 同键的不同对象替换一个已修改的缓存对象时报冲突
     */
    @Test(expected = CacheConflictException.class)
    public void testEnsureCached_ConflictWithDirtyEntity() {
        store.save(new Article("42"));
        CacheSession session = newSession("s1");
        Article cached = manager.get(session, "42");
        cached.getEntryState().markDirty(false);

        manager.ensureCached(session, new Article("42"));
    }

    @Test
    public void testEnsureCached_ReplacesCleanEntity() {
        store.save(new Article("42"));
        CacheSession session = newSession("s1");
        Article cached = manager.get(session, "42");
        Article replacement = new Article("42");

        manager.ensureCached(session, replacement);

        assertTrue(manager.isCached(session, replacement));
        assertFalse(manager.isCached(session, cached));
    }

    @Test
    public void testConflictException_CarriesKey() {
        CacheConflictException e = new CacheConflictException("Article~42~Cache~v1");
        assertEquals("Article~42~Cache~v1", e.getCacheKey());
        assertTrue(e.getMessage().contains("Article~42~Cache~v1"));
    }

    @Test
    public void testGetOrCreate() {
        CacheSession session = newSession("s1");

        Article created = manager.getOrCreate(session, "new", key -> new Article(key, 24.0));
        Article again = manager.getOrCreate(session, "new", key -> {
            throw new AssertionError("factory should not be called twice");
        });

        assertSame(created, again);
        assertEquals(1, store.size());
        assertTrue(created.getEntryState().isClean());
        assertEquals(1, manager.getStats().getFlushCount());
    }

    /**
     * 会话关闭时写回脏实体
     */
    @Test
    public void testSessionClose_FlushesDirtyEntities() {
        CacheSession session = newSession("s1");
        Article article = manager.getOrCreate(session, "42", key -> new Article(key, 24.0));
        scoreEngine.recordEvent(session, article, 1);
        manager.markDirty(session, article, false);

        session.close();
        session.close();

        assertTrue(article.getEntryState().isClean());
        assertEquals(2, manager.getStats().getFlushCount());
        Article persisted = store.load("42");
        assertEquals(article.getScoreRegister(24), persisted.getScoreRegister(24));
    }

    /**
     * DIRTY 受写入限流约束，CRITICAL 总是写回
     */
    @Test
    public void testDeferredFlush_Throttling() {
        CacheSession session = newSession("s1");
        Article article = new Article("t", 24.0);
        article.setEntryState(new EntryState(new RateLimiter(1, 60)));
        manager.put(session, article);

        manager.markDirty(session, article, false);
        manager.deferredFlush(session, article);
        assertTrue(article.getEntryState().isClean());

        manager.markDirty(session, article, false);
        manager.deferredFlush(session, article);
        assertEquals(CacheState.DIRTY, article.getEntryState().getState());
        assertEquals(1, manager.getStats().getThrottledFlushCount());

        manager.markDirty(session, article, true);
        manager.deferredFlush(session, article);
        assertTrue(article.getEntryState().isClean());
        assertEquals(3, manager.getStats().getFlushCount());
    }

    @Test
    public void testDeferredFlush_CleanIsNoop() {
        CacheSession session = newSession("s1");
        Article article = new Article("c");

        manager.deferredFlush(session, article);

        assertFalse(manager.isCached(session, article));
        assertEquals(0, store.size());
    }

    /**
     * 延迟写回失败只记录日志，实体保持脏状态
     */
    @Test
    public void testDeferredFlush_SuppressesStoreFailure() {
        DefaultTierCacheManager<Article> failing =
                new DefaultTierCacheManager<>(Article.class, failingStore, sharedCache, "v1", 3600);
        CacheSession session = newSession("s1");
        Article article = new Article("f");
        failing.markDirty(session, article, false);

        failing.deferredFlush(session, article);
        session.close();

        assertEquals(CacheState.DIRTY, article.getEntryState().getState());
        assertTrue(failing.isCached(session, article));
        assertEquals(2, failing.getStats().getFlushFailureCount());
        verify(failingStore, times(2)).save(article);
    }

    /**
     * 落库失败时退还写入额度，下一次写回不会被限流
     */
    @Test
    public void testDeferredFlush_FailureRefundsWriteBudget() {
        DefaultTierCacheManager<Article> failing =
                new DefaultTierCacheManager<>(Article.class, failingStore, sharedCache, "v1", 3600);
        CacheSession session = newSession("s1");
        Article article = new Article("f");
        article.setEntryState(new EntryState(new RateLimiter(1, 60)));
        failing.markDirty(session, article, false);

        failing.deferredFlush(session, article);
        failing.deferredFlush(session, article);

        assertEquals(0, failing.getStats().getThrottledFlushCount());
        assertEquals(2, failing.getStats().getFlushFailureCount());
        assertEquals(0.0, article.getEntryState().getWriteRate().currentValue(session.nowSeconds()), 1e-9);
        verify(failingStore, times(2)).save(article);
    }

    /**
     * 同步写入失败直接抛出
     */
    @Test(expected = IllegalStateException.class)
    public void testPut_PropagatesStoreFailure() {
        TierCacheManager<Article> failing =
                new DefaultTierCacheManager<>(Article.class, failingStore, sharedCache, "v1", 3600);

        failing.put(newSession("s1"), new Article("f"));
    }

    /**
     * 分布式缓存中的数据类型不对时按未命中处理
     */
    @Test
    public void testGet_MalformedSharedValueIsMiss() {
        store.save(new Article("42"));
        sharedCache.set(manager.cacheKey("42"), "not an article", 0);

        Article article = manager.get(newSession("s1"), "42");

        assertNotNull(article);
        assertEquals(1, manager.getStats().getDurableLoadCount());
        assertEquals(0, manager.getStats().getDistributedHitCount());
        // 回源后覆盖了错误数据
        assertTrue(sharedCache.get(manager.cacheKey("42")) instanceof Article);
    }

    /**
     * 部署版本不同的管理器互不读取对方的缓存
     */
    @Test
    public void testDeploymentVersionIsolation() {
        store.save(new Article("42"));
        manager.get(newSession("s1"), "42");

        DefaultTierCacheManager<Article> next =
                new DefaultTierCacheManager<>(Article.class, store, sharedCache, "v2", 3600);
        assertNotNull(next.get(newSession("s2"), "42"));

        assertEquals(0, next.getStats().getDistributedHitCount());
        assertEquals(1, next.getStats().getDurableLoadCount());
    }

    /**
     * 从持久化存储读出旧版本数据时逐级升级并写回
     */
    @Test
    public void testGet_UpgradesSchema() {
        Article old = new Article("m");
        old.setTitle("  hello  ");
        old.setTargetSchemaVersion(2);
        store.save(old);

        Article loaded = manager.get(newSession("s1"), "m");

        assertEquals(2, loaded.getSchemaVersion());
        assertEquals("hello", loaded.getTitle());
        assertEquals(Collections.singletonList(2), loaded.getAppliedMigrations());
        assertEquals(2, store.load("m").getSchemaVersion());
    }

    @Test(expected = MissingMigrationException.class)
    public void testGet_MissingMigration() {
        Article old = new Article("m");
        old.setTargetSchemaVersion(3);
        store.save(old);

        manager.get(newSession("s1"), "m");
    }

    /**
     * 落库并移出缓存后重新读取：从持久化存储读出的实体是干净的，只读会话关闭时不写回
     */
    @Test
    public void testGet_DurableLoadIsClean() {
        CacheSession writer = newSession("s1");
        Article article = manager.getOrCreate(writer, "42", key -> new Article(key, 24.0));
        scoreEngine.recordEvent(writer, article, 1);
        manager.markDirty(writer, article, true);
        manager.flushAndEvict(writer, article);
        long flushesBefore = manager.getStats().getFlushCount();

        CacheSession reader = newSession("s2");
        Article loaded = manager.get(reader, "42");

        assertEquals(CacheState.CLEAN, loaded.getEntryState().getState());
        assertTrue(loaded.getEntryState().isPresentInDistributedTier());
        assertEquals(1, manager.getStats().getDurableLoadCount());

        // 同键的新对象可以替换干净的缓存对象
        Article replacement = new Article("42", 24.0);
        manager.ensureCached(reader, replacement);
        assertTrue(manager.isCached(reader, replacement));

        reader.close();
        assertEquals(flushesBefore, manager.getStats().getFlushCount());
    }

    /**
     * 保存时仍是脏状态的快照，读出后同样是干净的
     */
    @Test
    public void testGet_DirtySnapshotInStoreIsClean() {
        Article dirty = new Article("d");
        dirty.getEntryState().markDirty(true);
        store.save(dirty);

        CacheSession session = newSession("s1");
        Article loaded = manager.get(session, "d");
        session.close();

        assertTrue(loaded.getEntryState().isClean());
        assertEquals(0, manager.getStats().getFlushCount());
    }

    @Test
    public void testFlushAndEvict() {
        CacheSession session = newSession("s1");
        Article article = manager.getOrCreate(session, "42", key -> new Article(key, 24.0));
        scoreEngine.recordEvent(session, article, 1);

        manager.flushAndEvict(session, article);

        String cacheKey = manager.cacheKey("42");
        assertFalse(session.getLocalTier().contains(cacheKey));
        assertNull(sharedCache.get(cacheKey));
        assertFalse(article.getEntryState().isPresentInDistributedTier());
        assertTrue(article.getEntryState().isClean());
        assertEquals(article.getScoreRegister(24), store.load("42").getScoreRegister(24));
    }
}
