package cn.bafuka.timecache.dataplane;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.function.Predicate;

/**
 * 持久化存储查询条件
 *
 * @param <E> 实体类型
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityQuery<E> {

    /**
     * 过滤条件，null 表示不过滤
     */
    private Predicate<? super E> filter;

    /**
     * 排序键，null 表示存储自然顺序
     */
    private SortKey<E> order;

    /**
     * 最大返回条数
     */
    @Builder.Default
    private int limit = 100;

    public boolean matches(E entity) {
        return filter == null || filter.test(entity);
    }
}
