package cn.bafuka.timecache.score;

import cn.bafuka.timecache.core.CacheSession;
import cn.bafuka.timecache.core.UserActionLedger;
import cn.bafuka.timecache.dataplane.DurableStore;
import cn.bafuka.timecache.dataplane.EntityQuery;
import cn.bafuka.timecache.dataplane.SortKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * 时间衰减计分引擎
 *
 * 每个实体在每个半衰期上只保存 (logScore, lastTime)，不保存事件历史：
 * 空间 O(1)，更新 O(1)，logScore 可以在任意未来时刻直接作为全局排序键
 */
@Slf4j
public class ScoreEngine {

    /**
     * 用户动作台账（可选，未配置时“每用户一次”的事件全部拒绝）
     */
    private final UserActionLedger actionLedger;

    public ScoreEngine() {
        this(null);
    }

    public ScoreEngine(UserActionLedger actionLedger) {
        this.actionLedger = actionLedger;
    }

    /**
     * 记录一次活动事件
     * 权重为正时把实体标记为脏数据，等待会话结束时写回
     *
     * @param entity 实体
     * @param weight 事件权重
     * @param time   事件时间（小时）
     */
    public void recordEvent(Scorable entity, double weight, double time) {
        for (Double halfLife : entity.getHalfLives()) {
            TimeScore ts = new TimeScore(halfLife, entity.getScoreRegister(halfLife));
            ts.increment(weight, time);
            entity.setScoreRegister(halfLife, ts.toRegister());
        }

        if (weight > 0) {
            entity.getEntryState().markDirty(false);
        }
        log.debug("记录活动事件: key={}, weight={}, time={}", entity.getKeyName(), weight, time);
    }

    /**
     * 在会话时间记录活动事件
     *
     * @param session 当前会话
     * @param entity  实体
     * @param weight  事件权重
     */
    public void recordEvent(CacheSession session, Scorable entity, double weight) {
        recordEvent(entity, weight, session.nowHours());
    }

    /**
     * 每个用户对同一实体的同一动作只计一次（投票、举报等）
     *
     * @param session 当前会话
     * @param entity  实体
     * @param action  动作名称
     * @param weight  事件权重
     * @return true 表示本次已计分
     */
    public boolean recordEventOncePerUser(CacheSession session, Scorable entity, String action, double weight) {
        if (actionLedger == null || session.getUserId() == null) {
            log.debug("匿名会话或未配置台账，忽略事件: action={}, key={}", action, entity.getKeyName());
            return false;
        }

        String marker = action + "." + entity.getKeyName();
        if (!actionLedger.firstTime(session.getUserId(), marker)) {
            log.debug("重复动作，忽略: userId={}, action={}", session.getUserId(), marker);
            return false;
        }

        recordEvent(session, entity, weight);
        return true;
    }

    /**
     * 某时刻的线性分数（只读，不修改寄存器）
     *
     * @param entity   实体
     * @param halfLife 半衰期
     * @param time     查询时间（小时）
     * @return 线性分数
     */
    public double scoreAt(Scorable entity, double halfLife, double time) {
        return new TimeScore(halfLife, entity.getScoreRegister(halfLife)).peek(time);
    }

    /**
     * 全局排序键：直接返回已存储的 logScore，不需要当前时间
     *
     * @param entity   实体
     * @param halfLife 半衰期
     * @return logScore
     */
    public double orderingKey(Scorable entity, double halfLife) {
        return entity.getScoreRegister(halfLife).getLogScore();
    }

    /**
     * 各半衰期在某时刻的分数
     *
     * @param entity 实体
     * @param time   查询时间（小时）
     * @return 名称（day / week / month / year）到分数的映射
     */
    public Map<String, Double> namedScores(Scorable entity, double time) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (Double halfLife : entity.getHalfLives()) {
            scores.put(HalfLives.name(halfLife), scoreAt(entity, halfLife, time));
        }
        return scores;
    }

    /**
     * 分数是否刚初始化（从未计分）
     *
     * @param entity 实体
     * @return true 表示从未计分
     */
    public boolean isNewScore(Scorable entity) {
        for (Double halfLife : entity.getHalfLives()) {
            if (!entity.getScoreRegister(halfLife).isNew()) {
                return false;
            }
        }
        return true;
    }

    /**
     * 按分数降序排序的排序键
     *
     * @param halfLife 半衰期
     * @param <S>      实体类型
     * @return 排序键
     */
    public <S extends Scorable> SortKey<S> byScore(double halfLife) {
        return SortKey.descending(HalfLives.property(halfLife), entity -> orderingKey(entity, halfLife));
    }

    /**
     * 排行榜查询：从持久化存储按分数降序取前 limit 条，并附上查询时刻的分数
     *
     * @param store    持久化存储
     * @param filter   过滤条件，可以为 null
     * @param halfLife 半衰期
     * @param limit    条数
     * @param time     查询时间（小时）
     * @param <S>      实体类型
     * @return 带分数的结果
     */
    public <S extends Scorable> List<ScoredResult<S>> rank(DurableStore<S> store,
                                                          Predicate<? super S> filter,
                                                          double halfLife,
                                                          int limit,
                                                          double time) {
        EntityQuery<S> query = EntityQuery.<S>builder()
                .filter(filter)
                .order(byScore(halfLife))
                .limit(limit)
                .build();

        List<ScoredResult<S>> results = new ArrayList<>();
        for (S entity : store.queryByFilter(query)) {
            if (entity == null) {
                continue;
            }
            results.add(new ScoredResult<>(entity, scoreAt(entity, halfLife, time)));
        }
        log.debug("排行榜查询: halfLife={}, limit={}, results={}", HalfLives.name(halfLife), limit, results.size());
        return results;
    }
}
