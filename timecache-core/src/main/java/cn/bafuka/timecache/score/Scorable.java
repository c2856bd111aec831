package cn.bafuka.timecache.score;

import cn.bafuka.timecache.core.CacheableEntity;

import java.util.List;

/**
 * 可计分实体能力接口
 * 实体为每个半衰期保存一个 {@link ScoreRegister}，由 {@link ScoreEngine} 负责计算
 */
public interface Scorable extends CacheableEntity {

    /**
     * 参与计分的半衰期（小时）
     *
     * @return 半衰期列表
     */
    default List<Double> getHalfLives() {
        return HalfLives.DEFAULTS;
    }

    /**
     * 读取寄存器，从未计分时返回 {@link ScoreRegister#initial()}
     *
     * @param halfLife 半衰期
     * @return 寄存器
     */
    ScoreRegister getScoreRegister(double halfLife);

    void setScoreRegister(double halfLife, ScoreRegister register);
}
