package cn.bafuka.timecache.core;

import cn.bafuka.timecache.exception.MissingMigrationException;

/**
 * 支持模式版本升级的实体
 * 每次模式变更时提升 {@link #currentSchemaVersion()}，并在 {@link #migrate(int)} 中实现逐级升级
 */
public interface Migratable {

    int getSchemaVersion();

    void setSchemaVersion(int schemaVersion);

    /**
     * 当前代码期望的模式版本
     *
     * @return 版本号
     */
    int currentSchemaVersion();

    /**
     * 升级到下一个版本
     *
     * @param nextVersion 目标版本
     */
    default void migrate(int nextVersion) {
        throw new MissingMigrationException(getClass().getSimpleName(), nextVersion);
    }
}
