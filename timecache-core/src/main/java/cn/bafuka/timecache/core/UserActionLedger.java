package cn.bafuka.timecache.core;

/**
 * 用户动作台账
 * 用于“每个用户只能执行一次”的幂等判断（投票、举报等）
 */
public interface UserActionLedger {

    /**
     * 记录用户动作
     *
     * @param userId 用户 ID
     * @param action 动作标识
     * @return true 表示第一次执行；false 表示已执行过或用户未知
     */
    boolean firstTime(String userId, String action);
}
