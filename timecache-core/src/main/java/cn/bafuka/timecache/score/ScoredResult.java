package cn.bafuka.timecache.score;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 带当前分数的查询结果
 *
 * @param <S> 实体类型
 */
@Data
@AllArgsConstructor
public class ScoredResult<S extends Scorable> {

    private S entity;

    /**
     * 查询时刻的线性分数（不持久化）
     */
    private double score;
}
