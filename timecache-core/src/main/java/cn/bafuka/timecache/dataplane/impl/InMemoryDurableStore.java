package cn.bafuka.timecache.dataplane.impl;

import cn.bafuka.timecache.core.CacheableEntity;
import cn.bafuka.timecache.dataplane.DurableStore;
import cn.bafuka.timecache.dataplane.EntityQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.SerializationUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 内存持久化存储
 * 保存序列化快照，读取时返回新实例，行为与真实数据库一致
 *
 * @param <E> 实体类型
 */
@Slf4j
public class InMemoryDurableStore<E extends CacheableEntity> implements DurableStore<E> {

    private final Class<E> type;

    private final Map<String, byte[]> rows = new ConcurrentHashMap<>();

    public InMemoryDurableStore(Class<E> type) {
        this.type = type;
    }

    @Override
    public E load(String keyName) {
        byte[] bytes = rows.get(keyName);
        return bytes == null ? null : copyOf(bytes);
    }

    @Override
    public String save(E entity) {
        rows.put(entity.getKeyName(), SerializationUtils.serialize(entity));
        log.debug("内存存储写入: type={}, key={}", type.getSimpleName(), entity.getKeyName());
        return entity.getKeyName();
    }

    @Override
    public List<E> queryByFilter(EntityQuery<E> query) {
        Stream<E> stream = new ArrayList<>(rows.values()).stream()
                .map(this::copyOf)
                .filter(query::matches);
        if (query.getOrder() != null) {
            stream = stream.sorted(query.getOrder().toComparator());
        }
        return stream.limit(query.getLimit()).collect(Collectors.toList());
    }

    public int size() {
        return rows.size();
    }

    private E copyOf(byte[] bytes) {
        return type.cast(SerializationUtils.deserialize(bytes));
    }
}
