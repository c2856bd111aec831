package cn.bafuka.timecache.dataplane;

import java.util.Comparator;
import java.util.function.ToDoubleFunction;

/**
 * 排序键
 * 同时携带字段名（供数据库下推排序）和取值函数（供内存排序）
 *
 * @param <E> 实体类型
 */
public final class SortKey<E> {

    private final String property;

    private final ToDoubleFunction<? super E> extractor;

    private final boolean descending;

    private SortKey(String property, ToDoubleFunction<? super E> extractor, boolean descending) {
        this.property = property;
        this.extractor = extractor;
        this.descending = descending;
    }

    public static <E> SortKey<E> ascending(String property, ToDoubleFunction<? super E> extractor) {
        return new SortKey<>(property, extractor, false);
    }

    public static <E> SortKey<E> descending(String property, ToDoubleFunction<? super E> extractor) {
        return new SortKey<>(property, extractor, true);
    }

    public String getProperty() {
        return property;
    }

    public boolean isDescending() {
        return descending;
    }

    public double valueOf(E entity) {
        return extractor.applyAsDouble(entity);
    }

    public Comparator<E> toComparator() {
        Comparator<E> comparator = Comparator.comparingDouble(this::valueOf);
        return descending ? comparator.reversed() : comparator;
    }
}
