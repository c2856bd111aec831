package cn.bafuka.timecache.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 请求级缓存层
 * 只属于一个会话，生命周期与请求相同，不需要加锁
 */
public class LocalTier {

    /**
     * Key: 缓存键
     * Value: 实体及其写回者
     */
    private final Map<String, Slot> slots = new LinkedHashMap<>();

    public CacheableEntity get(String cacheKey) {
        Slot slot = slots.get(cacheKey);
        return slot == null ? null : slot.entity;
    }

    public void put(String cacheKey, CacheableEntity entity, EntryFlusher flusher) {
        slots.put(cacheKey, new Slot(entity, flusher));
    }

    public CacheableEntity remove(String cacheKey) {
        Slot slot = slots.remove(cacheKey);
        return slot == null ? null : slot.entity;
    }

    public boolean contains(String cacheKey) {
        return slots.containsKey(cacheKey);
    }

    public int size() {
        return slots.size();
    }

    /**
     * 对所有条目执行延迟写回
     * 先复制快照，写回过程中会重新登记条目
     * 某个条目抛出异常时继续写回其余条目，结束后抛出第一个异常，其余异常附加为 suppressed
     *
     * @param session 当前会话
     */
    void flushAll(CacheSession session) {
        List<Slot> snapshot = new ArrayList<>(slots.values());
        RuntimeException failure = null;
        for (Slot slot : snapshot) {
            try {
                slot.flusher.flushDeferred(session, slot.entity);
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private static final class Slot {
        private final CacheableEntity entity;
        private final EntryFlusher flusher;

        private Slot(CacheableEntity entity, EntryFlusher flusher) {
            this.entity = entity;
            this.flusher = flusher;
        }
    }
}
