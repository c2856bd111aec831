package cn.bafuka.timecache.dataplane.impl;

import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * RedisDistributedCache 单元测试
 */
public class RedisDistributedCacheTest {

    private RedisDistributedCache distributedCache;

    @Mock
    private RedisTemplate<String, Object> redisTemplate;

    @Mock
    private ValueOperations<String, Object> valueOperations;

    @Before
    public void setUp() {
        MockitoAnnotations.openMocks(this);
        distributedCache = new RedisDistributedCache(redisTemplate, "timecache:");

        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    public void testGet_Hit() {
        when(valueOperations.get("timecache:Post~1~Cache~1")).thenReturn("cachedValue");

        assertEquals("cachedValue", distributedCache.get("Post~1~Cache~1"));
        verify(valueOperations).get("timecache:Post~1~Cache~1");
    }

    /**
     * Redis 异常（包括反序列化失败）按未命中处理
     */
    @Test
    public void testGet_ExceptionIsMiss() {
        when(valueOperations.get(anyString())).thenThrow(new RuntimeException("Redis connection failed"));

        assertNull(distributedCache.get("Post~1~Cache~1"));
    }

    @Test
    public void testSet_WithTtl() {
        distributedCache.set("k", "v", 300);

        verify(valueOperations).set("timecache:k", "v", 300, TimeUnit.SECONDS);
    }

    @Test
    public void testSet_WithoutTtl() {
        distributedCache.set("k", "v", 0);

        verify(valueOperations).set("timecache:k", "v");
        verify(valueOperations, never()).set(anyString(), any(), anyLong(), any(TimeUnit.class));
    }

    @Test
    public void testSet_ExceptionIsSwallowed() {
        doThrow(new RuntimeException("Redis down"))
                .when(valueOperations).set(anyString(), any(), anyLong(), any(TimeUnit.class));

        distributedCache.set("k", "v", 300);
    }

    @Test
    public void testDelete() {
        distributedCache.delete("k");

        verify(redisTemplate).delete("timecache:k");
    }

    @Test
    public void testGetRedisKey() {
        assertEquals("timecache:k", distributedCache.getRedisKey("k"));
        assertEquals("k", new RedisDistributedCache(redisTemplate, null).getRedisKey("k"));
    }
}
