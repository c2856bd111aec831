package cn.bafuka.timecache.exception;

/**
 * 缺少模式升级步骤
 */
public class MissingMigrationException extends TimeCacheException {

    private final String entityType;

    private final int targetVersion;

    public MissingMigrationException(String entityType, int targetVersion) {
        super(String.format("Missing migration for %s to schema version %d", entityType, targetVersion));
        this.entityType = entityType;
        this.targetVersion = targetVersion;
    }

    public String getEntityType() {
        return entityType;
    }

    public int getTargetVersion() {
        return targetVersion;
    }
}
